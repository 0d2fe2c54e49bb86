package biz.kryukov.dev.svcwatch.liveness;

import biz.kryukov.dev.svcwatch.FailureKind;
import biz.kryukov.dev.svcwatch.LivenessStatus;
import biz.kryukov.dev.svcwatch.Target;
import biz.kryukov.dev.svcwatch.WatchConfig;
import biz.kryukov.dev.svcwatch.http.HttpCall;
import biz.kryukov.dev.svcwatch.http.JdkHttpTransport;
import biz.kryukov.dev.svcwatch.http.ScriptedTransport;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HealthProberTest {

    private static final WatchConfig CONFIG = WatchConfig.defaults();

    private HttpServer server;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void okServerIsUpWithResponseTime() throws Exception {
        AtomicReference<String> userAgent = new AtomicReference<>();
        server.createContext("/", exchange -> {
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();

        HealthProber prober = new HealthProber(new JdkHttpTransport(), CONFIG);
        String url = "http://localhost:" + port;
        ProbeResult result = prober.probe(Target.builder("local", url).build());

        assertEquals(LivenessStatus.UP, result.status());
        assertNotNull(result.responseTimeMillis());
        assertTrue(result.responseTimeMillis() >= 0);
        assertEquals(url, result.url());
        assertNull(result.failure());
        assertEquals(WatchConfig.DEFAULT_USER_AGENT, userAgent.get());
    }

    @Test
    void unauthorizedCountsAsUp() throws Exception {
        server.createContext("/", exchange -> {
            exchange.sendResponseHeaders(401, -1);
            exchange.close();
        });
        server.start();

        HealthProber prober = new HealthProber(new JdkHttpTransport(), CONFIG);
        ProbeResult result = prober.probe(Target.builder("local", "http://localhost:" + port).build());

        assertEquals(LivenessStatus.UP, result.status());
    }

    @Test
    void serverErrorIsDownWithResponseTime() throws Exception {
        server.createContext("/", exchange -> {
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        server.start();

        HealthProber prober = new HealthProber(new JdkHttpTransport(), CONFIG);
        ProbeResult result = prober.probe(Target.builder("local", "http://localhost:" + port).build());

        assertEquals(LivenessStatus.DOWN, result.status());
        assertNotNull(result.responseTimeMillis());
        assertEquals(FailureKind.HTTP_STATUS_FAILURE, result.failure());
    }

    @Test
    void redirectsAreFollowed() throws Exception {
        server.createContext("/", exchange -> {
            if (exchange.getRequestURI().getPath().equals("/login")) {
                exchange.sendResponseHeaders(500, -1);
            } else {
                exchange.getResponseHeaders().add("Location", "/login");
                exchange.sendResponseHeaders(302, -1);
            }
            exchange.close();
        });
        server.start();

        HealthProber prober = new HealthProber(new JdkHttpTransport(), CONFIG);
        ProbeResult result = prober.probe(Target.builder("local", "http://localhost:" + port).build());

        assertEquals(LivenessStatus.DOWN, result.status());
    }

    @Test
    void timeoutIsDownWithoutFallback() {
        ScriptedTransport transport = new ScriptedTransport(call -> ScriptedTransport.timeout());
        HealthProber prober = new HealthProber(transport, CONFIG);

        ProbeResult result = prober.probe(Target.builder("slow", "https://slow.local").build());

        assertEquals(LivenessStatus.DOWN, result.status());
        assertNull(result.responseTimeMillis());
        assertEquals(FailureKind.TIMEOUT, result.failure());
        assertEquals("https://slow.local", result.url());
        assertEquals(1, transport.calls().size());
    }

    @Test
    void realTimeoutHonorsProbeTimeout() throws Exception {
        server.createContext("/", exchange -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();

        WatchConfig config = WatchConfig.builder().probeTimeout(Duration.ofMillis(300)).build();
        HealthProber prober = new HealthProber(new JdkHttpTransport(), config);
        long start = System.nanoTime();
        ProbeResult result = prober.probe(Target.builder("slow", "http://localhost:" + port).build());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(LivenessStatus.DOWN, result.status());
        assertEquals(FailureKind.TIMEOUT, result.failure());
        assertTrue(elapsedMs < 1500, "took " + elapsedMs + " ms");
    }

    @Test
    void tlsFailureRetriesWithoutVerification() {
        ScriptedTransport transport = new ScriptedTransport(call ->
                call.verifyTls() ? ScriptedTransport.tlsFailure() : ScriptedTransport.reply(200));
        HealthProber prober = new HealthProber(transport, CONFIG);

        ProbeResult result = prober.probe(Target.builder("self-signed", "https://nas.local").build());

        assertEquals(LivenessStatus.UP, result.status());
        assertEquals("https://nas.local", result.url());
        assertEquals(2, transport.calls().size());
        assertTrue(transport.calls().get(0).verifyTls());
        assertFalse(transport.calls().get(1).verifyTls());
    }

    @Test
    void refusedHttpsFallsBackToPlaintextAndRewritesUrl() {
        ScriptedTransport transport = new ScriptedTransport(call ->
                call.uri().getScheme().equals("https") ? ScriptedTransport.refused() : ScriptedTransport.reply(200));
        HealthProber prober = new HealthProber(transport, CONFIG);

        ProbeResult result = prober.probe(Target.builder("plain", "https://plain.local:8080").build());

        assertEquals(LivenessStatus.UP, result.status());
        assertEquals("http://plain.local:8080", result.url());
        assertNotNull(result.responseTimeMillis());
        HttpCall fallback = transport.calls().get(1);
        assertEquals("http", fallback.uri().getScheme());
        assertFalse(fallback.verifyTls());
    }

    @Test
    void plaintextFallbackNotUpIsDownWithoutResponseTime() {
        ScriptedTransport transport = new ScriptedTransport(call ->
                call.uri().getScheme().equals("https") ? ScriptedTransport.refused() : ScriptedTransport.reply(502));
        HealthProber prober = new HealthProber(transport, CONFIG);

        ProbeResult result = prober.probe(Target.builder("plain", "https://plain.local").build());

        assertEquals(LivenessStatus.DOWN, result.status());
        assertNull(result.responseTimeMillis());
        assertEquals("https://plain.local", result.url());
    }

    @Test
    void connectionFailureAfterTlsRetryAlsoFallsBack() {
        ScriptedTransport transport = new ScriptedTransport(call -> {
            if (call.uri().getScheme().equals("http")) {
                return ScriptedTransport.reply(200);
            }
            return call.verifyTls() ? ScriptedTransport.tlsFailure() : ScriptedTransport.refused();
        });
        HealthProber prober = new HealthProber(transport, CONFIG);

        ProbeResult result = prober.probe(Target.builder("odd", "https://odd.local").build());

        assertEquals(LivenessStatus.UP, result.status());
        assertEquals("http://odd.local", result.url());
        assertEquals(3, transport.calls().size());
    }

    @Test
    void refusedPlainHttpIsDownWithoutRetry() {
        ScriptedTransport transport = new ScriptedTransport(call -> ScriptedTransport.refused());
        HealthProber prober = new HealthProber(transport, CONFIG);

        ProbeResult result = prober.probe(Target.builder("gone", "http://gone.local").build());

        assertEquals(LivenessStatus.DOWN, result.status());
        assertEquals(FailureKind.CONNECTION_FAILURE, result.failure());
        assertEquals(1, transport.calls().size());
    }

    @Test
    void otherErrorsAreDown() {
        ScriptedTransport transport = new ScriptedTransport(call -> ScriptedTransport.error());
        HealthProber prober = new HealthProber(transport, CONFIG);

        ProbeResult result = prober.probe(Target.builder("broken", "https://broken.local").build());

        assertEquals(LivenessStatus.DOWN, result.status());
        assertNull(result.responseTimeMillis());
        assertEquals(FailureKind.ERROR, result.failure());
        assertEquals(1, transport.calls().size());
    }

    @Test
    void underscoreHostIsDown() {
        HealthProber prober = new HealthProber(new JdkHttpTransport(), CONFIG);

        ProbeResult result = prober.probe(Target.builder("ha", "http://home_assistant.invalid").build());

        assertEquals(LivenessStatus.DOWN, result.status());
        assertEquals(FailureKind.ERROR, result.failure());
        assertEquals("http://home_assistant.invalid", result.url());
    }

    @Test
    void throwingTransportIsDown() {
        HealthProber prober = new HealthProber(call -> {
            throw new IllegalStateException("boom");
        }, CONFIG);

        ProbeResult result = prober.probe(Target.builder("broken", "https://broken.local").build());

        assertEquals(LivenessStatus.DOWN, result.status());
        assertEquals(FailureKind.ERROR, result.failure());
        assertTrue(result.detail().contains("boom"));
    }
}
