package biz.kryukov.dev.svcwatch;

/**
 * TLS handshake or certificate validation error.
 */
public class CallTlsException extends CallException {

    public CallTlsException(String message) {
        super(message, FailureKind.TLS_FAILURE);
    }

    public CallTlsException(String message, Throwable cause) {
        super(message, cause, FailureKind.TLS_FAILURE);
    }
}
