package biz.kryukov.dev.svcwatch.spring;

import biz.kryukov.dev.svcwatch.SvcWatch;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SvcWatchHealthIndicatorTest {

    @Test
    void allUpReturnsUp() {
        SvcWatch svcWatch = mock(SvcWatch.class);
        when(svcWatch.health()).thenReturn(Map.of("nas", true, "router", true));

        Health health = new SvcWatchHealthIndicator(svcWatch).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("UP", health.getDetails().get("nas"));
        assertEquals("UP", health.getDetails().get("router"));
    }

    @Test
    void anyDownReturnsDown() {
        SvcWatch svcWatch = mock(SvcWatch.class);
        when(svcWatch.health()).thenReturn(Map.of("nas", true, "router", false));

        Health health = new SvcWatchHealthIndicator(svcWatch).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("DOWN", health.getDetails().get("router"));
    }

    @Test
    void nothingProbedReturnsUp() {
        SvcWatch svcWatch = mock(SvcWatch.class);
        when(svcWatch.health()).thenReturn(Map.of());

        assertEquals(Status.UP, new SvcWatchHealthIndicator(svcWatch).health().getStatus());
    }
}
