package biz.kryukov.dev.svcwatch;

/**
 * Base exception for a failed outbound call, carrying its {@link FailureKind}.
 *
 * <p>Callers branch on {@link #kind()} instead of catching transport exceptions.
 * The authenticated request executor surfaces every terminal failure as one of the
 * subclasses so a relay can report a meaningful error upstream.</p>
 */
public class CallException extends Exception {

    private final FailureKind kind;

    public CallException(String message, FailureKind kind) {
        super(message);
        this.kind = kind;
    }

    public CallException(String message, Throwable cause, FailureKind kind) {
        super(message, cause);
        this.kind = kind;
    }

    /** Returns the failure classification. */
    public FailureKind kind() {
        return kind;
    }
}
