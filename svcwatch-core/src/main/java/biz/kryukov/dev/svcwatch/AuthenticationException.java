package biz.kryukov.dev.svcwatch;

/**
 * No working authentication method, or the remote side kept rejecting credentials.
 */
public class AuthenticationException extends CallException {

    public AuthenticationException(String message) {
        super(message, FailureKind.AUTHENTICATION_FAILURE);
    }
}
