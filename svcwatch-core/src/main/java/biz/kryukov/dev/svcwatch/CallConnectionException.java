package biz.kryukov.dev.svcwatch;

/**
 * Connection refused, host unresolvable or unreachable.
 */
public class CallConnectionException extends CallException {

    public CallConnectionException(String message) {
        super(message, FailureKind.CONNECTION_FAILURE);
    }

    public CallConnectionException(String message, Throwable cause) {
        super(message, cause, FailureKind.CONNECTION_FAILURE);
    }
}
