package biz.kryukov.dev.svcwatch;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

/**
 * Classifies call exceptions into a {@link FailureKind}.
 *
 * <p>Classification chain:
 * <ol>
 *   <li>{@link CallException} with an explicit kind</li>
 *   <li>Platform exception types (timeout, DNS, connection, TLS)</li>
 *   <li>Wrapped exception cause (recursive)</li>
 *   <li>Fallback: {@link FailureKind#ERROR}</li>
 * </ol>
 */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    /**
     * Classifies an exception.
     *
     * @param err the exception to classify
     * @return the failure kind, never null
     */
    public static FailureKind classify(Throwable err) {
        if (err == null) {
            return FailureKind.ERROR;
        }

        // 1. CallException with explicit classification.
        if (err instanceof CallException ce) {
            return ce.kind();
        }

        // 2. Platform exception types.
        FailureKind platform = classifyPlatform(err);
        if (platform != null) {
            return platform;
        }

        // 3. Check wrapped cause.
        Throwable cause = err.getCause();
        if (cause != null && cause != err) {
            FailureKind inner = classify(cause);
            if (inner != FailureKind.ERROR) {
                return inner;
            }
        }

        // 4. Fallback.
        return FailureKind.ERROR;
    }

    private static FailureKind classifyPlatform(Throwable err) {
        // HttpConnectTimeoutException extends HttpTimeoutException
        if (err instanceof HttpTimeoutException
                || err instanceof SocketTimeoutException
                || err instanceof TimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (err instanceof UnknownHostException || err instanceof UnresolvedAddressException) {
            return FailureKind.CONNECTION_FAILURE;
        }
        if (err instanceof ConnectException || err instanceof NoRouteToHostException) {
            return FailureKind.CONNECTION_FAILURE;
        }
        if (err instanceof SSLException) {
            return FailureKind.TLS_FAILURE;
        }
        return null;
    }
}
