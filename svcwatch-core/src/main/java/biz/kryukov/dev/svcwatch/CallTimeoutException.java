package biz.kryukov.dev.svcwatch;

/**
 * Call timed out.
 */
public class CallTimeoutException extends CallException {

    public CallTimeoutException(String message) {
        super(message, FailureKind.TIMEOUT);
    }

    public CallTimeoutException(String message, Throwable cause) {
        super(message, cause, FailureKind.TIMEOUT);
    }
}
