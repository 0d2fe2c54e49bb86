package biz.kryukov.dev.svcwatch.auth;

import biz.kryukov.dev.svcwatch.http.HttpReply;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AuthHintsTest {

    @Test
    void wwwAuthenticateBearer() {
        HttpReply reply = new HttpReply(401, Map.of("WWW-Authenticate", List.of("Bearer realm=\"api\"")), "");
        assertEquals(Optional.of("expected Bearer token authentication"), AuthHints.fromReply(reply));
    }

    @Test
    void wwwAuthenticateBasic() {
        HttpReply reply = new HttpReply(401, Map.of("WWW-Authenticate", List.of("Basic realm=\"x\"")), "");
        assertEquals(Optional.of("expected HTTP Basic authentication"), AuthHints.fromReply(reply));
    }

    @Test
    void jsonErrorMessages() {
        assertEquals(Optional.of("response suggests form data"), AuthHints.fromReply(
                HttpReply.of(400, "application/json", "{\"error\":\"expected form data\"}")));
        assertEquals(Optional.of("response suggests a JSON body"), AuthHints.fromReply(
                HttpReply.of(400, "application/json", "{\"message\":\"Invalid JSON payload\"}")));
        assertEquals(Optional.of("response suggests a Bearer token"), AuthHints.fromReply(
                HttpReply.of(401, "application/json", "{\"error\":\"missing token\"}")));
        assertEquals(Optional.of("response suggests API key authentication"), AuthHints.fromReply(
                HttpReply.of(401, "application/json", "{\"error\":\"api key required\"}")));
    }

    @Test
    void noHint() {
        assertTrue(AuthHints.fromReply(HttpReply.of(404, "text/html", "<h1>nope</h1>")).isEmpty());
        assertTrue(AuthHints.fromReply(HttpReply.of(400, "application/json", "{broken")).isEmpty());
        assertTrue(AuthHints.fromReply(HttpReply.of(400, "application/json", "{\"error\":\"denied\"}")).isEmpty());
    }
}
