package biz.kryukov.dev.svcwatch;

/**
 * Response body could not be parsed as expected.
 */
public class MalformedResponseException extends CallException {

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause, FailureKind.MALFORMED_RESPONSE);
    }
}
