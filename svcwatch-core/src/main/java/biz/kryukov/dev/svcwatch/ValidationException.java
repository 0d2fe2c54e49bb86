package biz.kryukov.dev.svcwatch;

/**
 * Parameter validation error.
 */
public class ValidationException extends SvcWatchException {

    public ValidationException(String message) {
        super(message);
    }
}
