package biz.kryukov.dev.svcwatch.detect;

import biz.kryukov.dev.svcwatch.Credentials;
import biz.kryukov.dev.svcwatch.Target;
import biz.kryukov.dev.svcwatch.WatchConfig;
import biz.kryukov.dev.svcwatch.http.ScriptedTransport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ApiDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private static ScriptedTransport apiAt(String path) {
        return new ScriptedTransport(call -> call.uri().getPath().equals(path)
                ? ScriptedTransport.reply(200, "application/json", "{}")
                : ScriptedTransport.reply(404));
    }

    private static ApiDetector detector(ScriptedTransport transport) {
        return new ApiDetector(new ApiEndpointScanner(transport, WatchConfig.defaults()));
    }

    @Test
    void detectedScanUpdatesTarget() {
        Target target = Target.builder("Sonarr Main", "https://sonarr.local").detectionAttempts(3).build();

        DetectionResult result = detector(apiAt("/api/v3")).detect(target, Credentials.NONE, false, NOW);

        assertEquals(DetectionResult.Outcome.DETECTED, result.outcome());
        Target t = result.target();
        assertTrue(t.apiDetected());
        assertEquals("/api/v3", t.apiEndpoint());
        assertEquals("sonarrmain", t.apiType());
        assertEquals("https://sonarr.local", t.apiUrl());
        assertEquals(0, t.detectionAttempts());
        assertEquals(NOW, t.apiLastDetected());
    }

    @Test
    void declaredTypeAndApiUrlWin() {
        Target target = Target.builder("nas", "https://nas.local")
                .apiType("qbittorrent").apiUrl("https://nas.local:8080").build();

        Target t = detector(apiAt("/api")).detect(target, Credentials.NONE, false, NOW).target();

        assertEquals("qbittorrent", t.apiType());
        assertEquals("https://nas.local:8080", t.apiUrl());
    }

    @Test
    void shortNamesGetCustomType() {
        Target target = Target.builder("ha", "https://ha.local").build();

        Target t = detector(apiAt("/api")).detect(target, Credentials.NONE, false, NOW).target();

        assertEquals("custom", t.apiType());
    }

    @Test
    void notFoundCountsFailure() {
        ScriptedTransport transport = new ScriptedTransport(call -> ScriptedTransport.reply(404));
        Target target = Target.builder("plain", "https://plain.local").detectionAttempts(4).build();

        DetectionResult result = detector(transport).detect(target, Credentials.NONE, false, NOW);

        assertEquals(DetectionResult.Outcome.NOT_FOUND, result.outcome());
        assertFalse(result.available());
        assertEquals(5, result.target().detectionAttempts());
        assertEquals(NOW.plus(Duration.ofMinutes(5)), result.target().nextCheck());
    }

    @Test
    void scanErrorCountsFailure() {
        ScriptedTransport transport = new ScriptedTransport(call -> {
            throw new IllegalStateException("resolver exploded");
        });
        Target target = Target.builder("plain", "https://plain.local").build();

        DetectionResult result = detector(transport).detect(target, Credentials.NONE, false, NOW);

        assertEquals(DetectionResult.Outcome.NOT_FOUND, result.outcome());
        assertEquals(1, result.target().detectionAttempts());
    }

    @Test
    void throttledTargetIsNotScanned() {
        ScriptedTransport transport = apiAt("/api");
        Target target = Target.builder("plain", "https://plain.local")
                .detectionAttempts(5).nextCheck(NOW.plusSeconds(120)).build();

        DetectionResult result = detector(transport).detect(target, Credentials.NONE, false, NOW);

        assertEquals(DetectionResult.Outcome.THROTTLED, result.outcome());
        assertSame(target, result.target());
        assertTrue(transport.calls().isEmpty());
    }

    @Test
    void detectedTargetIsSkippedWithinWindow() {
        ScriptedTransport transport = apiAt("/api");
        Target target = Target.builder("svc", "https://svc.local")
                .apiDetected(true).apiLastDetected(NOW.minus(Duration.ofDays(1))).build();

        DetectionResult result = detector(transport).detect(target, Credentials.NONE, false, NOW);

        assertEquals(DetectionResult.Outcome.SKIPPED, result.outcome());
        assertTrue(result.available());
        assertTrue(transport.calls().isEmpty());
    }

    @Test
    void forceBypassesThrottle() {
        ScriptedTransport transport = apiAt("/api");
        Target target = Target.builder("svc", "https://svc.local")
                .detectionAttempts(9).nextCheck(NOW.plusSeconds(120)).build();

        DetectionResult result = detector(transport).detect(target, Credentials.NONE, true, NOW);

        assertEquals(DetectionResult.Outcome.DETECTED, result.outcome());
        assertNull(result.target().nextCheck());
    }

    @Test
    void manualCredentialsShortCircuitWithoutProbing() {
        ScriptedTransport transport = apiAt("/api");
        Target target = Target.builder("Portainer", "https://portainer.local")
                .detectionAttempts(5).nextCheck(NOW.plusSeconds(120)).build();

        DetectionResult result = detector(transport)
                .detect(target, Credentials.ofPassword("admin", "secret"), false, NOW);

        assertEquals(DetectionResult.Outcome.MANUAL, result.outcome());
        assertTrue(result.target().apiDetected());
        assertEquals("portainer", result.target().apiType());
        assertEquals(0, result.target().detectionAttempts());
        assertTrue(transport.calls().isEmpty());
    }

    @Test
    void apiKeyAloneDoesNotShortCircuit() {
        ScriptedTransport transport = apiAt("/api");
        Target target = Target.builder("media", "https://media.local").build();

        DetectionResult result = detector(transport).detect(target, Credentials.ofApiKey("k"), false, NOW);

        assertEquals(DetectionResult.Outcome.DETECTED, result.outcome());
        assertFalse(transport.calls().isEmpty());
    }
}
