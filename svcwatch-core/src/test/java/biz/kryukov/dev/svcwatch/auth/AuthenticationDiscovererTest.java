package biz.kryukov.dev.svcwatch.auth;

import biz.kryukov.dev.svcwatch.Credentials;
import biz.kryukov.dev.svcwatch.WatchConfig;
import biz.kryukov.dev.svcwatch.http.CallResult;
import biz.kryukov.dev.svcwatch.http.HttpCall;
import biz.kryukov.dev.svcwatch.http.HttpReply;
import biz.kryukov.dev.svcwatch.http.JdkHttpTransport;
import biz.kryukov.dev.svcwatch.http.ScriptedTransport;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuthenticationDiscovererTest {

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

    private static ApiClient client(ScriptedTransport transport, Credentials credentials, String authEndpoint) {
        return ApiClient.builder("https://svc.local")
                .credentials(credentials)
                .authEndpoint(authEndpoint)
                .transport(transport)
                .config(CONFIG)
                .build();
    }

    private static boolean authenticate(ApiClient client, ScriptedTransport transport) {
        return new AuthenticationDiscoverer(transport, CONFIG).authenticate(client);
    }

    @Test
    void apiKeyNeedsNoRoundTrip() {
        ScriptedTransport transport = new ScriptedTransport(call -> ScriptedTransport.reply(500));
        ApiClient client = client(transport, Credentials.ofApiKey("k-123"), "");

        assertTrue(authenticate(client, transport));

        assertEquals(AuthMethod.API_KEY, client.authState().method());
        assertEquals("k-123", client.authState().requestHeaders().get("X-API-Key"));
        assertTrue(transport.calls().isEmpty());
    }

    @Test
    void missingCredentialsFail() {
        ScriptedTransport transport = new ScriptedTransport(call -> ScriptedTransport.reply(200));

        assertFalse(authenticate(client(transport, Credentials.NONE, ""), transport));
        assertFalse(authenticate(client(transport, Credentials.of("admin", null, null), ""), transport));
        assertTrue(transport.calls().isEmpty());
    }

    @Test
    void triesEveryEndpointWithJsonFormBasicInOrder() {
        ScriptedTransport transport = new ScriptedTransport(call -> ScriptedTransport.reply(404));
        ApiClient client = client(transport, Credentials.ofPassword("admin", "pw"), "");

        assertFalse(authenticate(client, transport));

        List<HttpCall> calls = transport.calls();
        assertEquals(AuthenticationDiscoverer.DEFAULT_ENDPOINTS.size() * 3, calls.size());
        for (int i = 0; i < AuthenticationDiscoverer.DEFAULT_ENDPOINTS.size(); i++) {
            String url = "https://svc.local" + AuthenticationDiscoverer.DEFAULT_ENDPOINTS.get(i);
            HttpCall json = calls.get(i * 3);
            HttpCall form = calls.get(i * 3 + 1);
            HttpCall basic = calls.get(i * 3 + 2);
            assertEquals(url, json.uri().toString());
            assertEquals("POST", json.method());
            assertEquals("application/json", json.headers().get("Content-Type"));
            assertEquals("application/x-www-form-urlencoded", form.headers().get("Content-Type"));
            assertTrue(basic.headers().get("Authorization").startsWith("Basic "));
            assertFalse(json.verifyTls());
            assertFalse(json.followRedirects());
            assertEquals(Duration.ofSeconds(5), json.timeout());
        }
        assertFalse(client.authState().isEstablished());
    }

    @Test
    void overrideEndpointIsTheOnlyCandidate() {
        ScriptedTransport transport = new ScriptedTransport(call -> ScriptedTransport.reply(401));
        ApiClient client = client(transport, Credentials.ofPassword("admin", "pw"), "custom/signin");

        assertFalse(authenticate(client, transport));

        assertEquals(3, transport.calls().size());
        transport.calls().forEach(call ->
                assertEquals("https://svc.local/custom/signin", call.uri().toString()));
    }

    @Test
    void formAcceptedAfterJsonRejected() {
        ScriptedTransport transport = new ScriptedTransport(call -> {
            String contentType = call.headers().getOrDefault("Content-Type", "");
            if (call.uri().getPath().equals("/api/v2/auth/login")
                    && contentType.equals("application/x-www-form-urlencoded")) {
                return CallResult.replied(new HttpReply(200, Map.of(
                        "Content-Type", List.of("text/plain; charset=UTF-8"),
                        "Set-Cookie", List.of("SID=s1; HttpOnly; path=/")), "Ok."), Duration.ofMillis(3));
            }
            return ScriptedTransport.reply(400, "application/json", "{\"error\":\"send form data\"}");
        });
        ApiClient client = client(transport, Credentials.ofPassword("admin", "pw"), "");

        assertTrue(authenticate(client, transport));

        assertEquals(2, transport.calls().size());
        assertEquals("username=admin&password=pw", transport.calls().get(1).body());
        assertEquals(AuthMethod.FORM, client.authState().method());
        assertEquals("/api/v2/auth/login", client.authState().endpoint());
        assertEquals("SID=s1", client.authState().requestHeaders().get("Cookie"));
    }

    @Test
    void jsonTokenFromRealServer() throws Exception {
        server.createContext("/api/auth", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
            byte[] response;
            int status;
            if ("application/json".equals(contentType)
                    && body.contains("\"username\":\"admin\"") && body.contains("\"password\":\"pw\"")) {
                response = "{\"jwt\":\"eyJ.token\"}".getBytes(StandardCharsets.UTF_8);
                status = 200;
            } else {
                response = "{\"message\":\"bad\"}".getBytes(StandardCharsets.UTF_8);
                status = 400;
            }
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, response.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        });
        server.start();

        ApiClient client = ApiClient.builder("http://localhost:" + port)
                .credentials(Credentials.ofPassword("admin", "pw"))
                .authEndpoint("/api/auth")
                .transport(new JdkHttpTransport())
                .config(CONFIG)
                .build();

        assertTrue(new AuthenticationDiscoverer(new JdkHttpTransport(), CONFIG).authenticate(client));

        assertEquals(AuthMethod.JSON, client.authState().method());
        assertEquals("Bearer eyJ.token", client.authState().requestHeaders().get("Authorization"));
    }

    @Test
    void basicLoginKeepsBasicHeaderForCookieSessions() {
        String expected = "Basic " + Base64.getEncoder()
                .encodeToString("admin:pw".getBytes(StandardCharsets.UTF_8));
        ScriptedTransport transport = new ScriptedTransport(call ->
                expected.equals(call.headers().get("Authorization"))
                        ? ScriptedTransport.reply(200, "text/html", "<p>ok</p>")
                        : ScriptedTransport.reply(401));
        ApiClient client = client(transport, Credentials.ofPassword("admin", "pw"), "/login");

        assertTrue(authenticate(client, transport));

        assertEquals(AuthMethod.BASIC, client.authState().method());
        assertEquals(expected, client.authState().requestHeaders().get("Authorization"));
    }

    @Test
    void okWithoutTokenOrSessionIsRejected() {
        ScriptedTransport transport = new ScriptedTransport(call ->
                ScriptedTransport.reply(200, "application/json", "{\"user\":\"admin\"}"));
        ApiClient client = client(transport, Credentials.ofPassword("admin", "pw"), "/login");

        assertFalse(authenticate(client, transport));
        assertEquals(3, transport.calls().size());
    }

    @Test
    void transportFailuresMoveOn() {
        ScriptedTransport transport = new ScriptedTransport(call -> {
            if (call.uri().getPath().equals("/api/v2/auth/login")) {
                return ScriptedTransport.timeout();
            }
            return ScriptedTransport.reply(200, "application/json", "{\"token\":\"t\"}");
        });
        ApiClient client = client(transport, Credentials.ofPassword("admin", "pw"), "");

        assertTrue(authenticate(client, transport));

        assertEquals("/api/auth", client.authState().endpoint());
        assertEquals(4, transport.calls().size());
    }
}
