package biz.kryukov.dev.svcwatch.http;

import biz.kryukov.dev.svcwatch.FailureKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one outbound call: either a reply with its elapsed time, or a classified failure.
 */
public final class CallResult {

    private final HttpReply reply;
    private final Duration elapsed;
    private final FailureKind failure;
    private final Throwable cause;

    private CallResult(HttpReply reply, Duration elapsed, FailureKind failure, Throwable cause) {
        this.reply = reply;
        this.elapsed = elapsed;
        this.failure = failure;
        this.cause = cause;
    }

    /** Completed exchange. */
    public static CallResult replied(HttpReply reply, Duration elapsed) {
        return new CallResult(Objects.requireNonNull(reply, "reply"),
                Objects.requireNonNull(elapsed, "elapsed"), null, null);
    }

    /** Failed exchange. */
    public static CallResult failed(FailureKind kind, Throwable cause) {
        return new CallResult(null, null, Objects.requireNonNull(kind, "kind"), cause);
    }

    /** Whether an HTTP reply was received (whatever its status). */
    public boolean hasReply() {
        return reply != null;
    }

    /** The reply; throws if the call failed. */
    public HttpReply reply() {
        if (reply == null) {
            throw new IllegalStateException("call failed: " + failure);
        }
        return reply;
    }

    /** Round trip time of a completed exchange; throws if the call failed. */
    public Duration elapsed() {
        if (elapsed == null) {
            throw new IllegalStateException("call failed: " + failure);
        }
        return elapsed;
    }

    /** Failure kind, or null when a reply was received. */
    public FailureKind failure() {
        return failure;
    }

    /** Underlying exception of a failed call, or null. */
    public Throwable cause() {
        return cause;
    }

    /** Short human readable failure description. */
    public String describeFailure() {
        if (failure == null) {
            return "";
        }
        if (cause == null) {
            return failure.label();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return failure.label() + ": " + msg;
    }

    @Override
    public String toString() {
        return hasReply() ? "reply " + reply.statusCode() : "failure " + failure.label();
    }
}
