package biz.kryukov.dev.svcwatch.http;

import biz.kryukov.dev.svcwatch.ErrorClassifier;
import biz.kryukov.dev.svcwatch.FailureKind;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link HttpTransport} backed by {@link java.net.http.HttpClient}.
 *
 * <p>Redirect policy, certificate verification and connect timeout are client-level settings
 * in the JDK client, so one client is kept per combination actually used.</p>
 */
public final class JdkHttpTransport implements HttpTransport {

    private final Map<ClientKey, HttpClient> clients = new ConcurrentHashMap<>();

    @Override
    public CallResult execute(HttpCall call) {
        HttpClient client = clients.computeIfAbsent(
                new ClientKey(call.verifyTls(), call.followRedirects(), call.timeout()),
                JdkHttpTransport::newClient);

        long startNs = System.nanoTime();
        try {
            HttpResponse<String> response = client.send(toRequest(call),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNs);
            HttpReply reply = new HttpReply(response.statusCode(),
                    response.headers().map(), response.body());
            return CallResult.replied(reply, elapsed);
        } catch (IOException e) {
            return CallResult.failed(ErrorClassifier.classify(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallResult.failed(FailureKind.ERROR, e);
        } catch (IllegalArgumentException e) {
            // URI the JDK client rejects (no usable host, unsupported scheme) or a malformed header
            return CallResult.failed(FailureKind.ERROR, e);
        }
    }

    private static HttpRequest toRequest(HttpCall call) {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(call.uri())
                .timeout(call.timeout());
        for (Map.Entry<String, String> entry : call.headers().entrySet()) {
            requestBuilder.header(entry.getKey(), entry.getValue());
        }
        HttpRequest.BodyPublisher publisher = call.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(call.body(), StandardCharsets.UTF_8);
        return requestBuilder.method(call.method(), publisher).build();
    }

    private static HttpClient newClient(ClientKey key) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(key.timeout())
                .followRedirects(key.followRedirects()
                        ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER);
        if (!key.verifyTls()) {
            builder.sslContext(InsecureSslContext.create());
        }
        return builder.build();
    }

    private record ClientKey(boolean verifyTls, boolean followRedirects, Duration timeout) {}
}
