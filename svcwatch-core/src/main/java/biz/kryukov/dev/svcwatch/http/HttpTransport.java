package biz.kryukov.dev.svcwatch.http;

/**
 * Executes outbound HTTP calls.
 *
 * <p>This is the single failure boundary for network calls: implementations never throw
 * for transport errors and instead return a {@link CallResult} carrying the classified
 * {@link biz.kryukov.dev.svcwatch.FailureKind}. Implementations must be thread-safe.</p>
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * Executes the call.
     *
     * @param call the call to execute
     * @return the reply or the classified failure
     */
    CallResult execute(HttpCall call);
}
