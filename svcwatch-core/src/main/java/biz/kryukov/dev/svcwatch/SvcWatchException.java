package biz.kryukov.dev.svcwatch;

/**
 * Base runtime exception for the svcwatch engine.
 */
public class SvcWatchException extends RuntimeException {

    public SvcWatchException(String message) {
        super(message);
    }

    public SvcWatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
