package biz.kryukov.dev.svcwatch.spring;

import biz.kryukov.dev.svcwatch.SvcWatch;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.Map;

/**
 * Spring Boot Actuator HealthIndicator: down when any probed target is down.
 * Targets not probed yet are not reported.
 */
public class SvcWatchHealthIndicator implements HealthIndicator {

    private final SvcWatch svcWatch;

    public SvcWatchHealthIndicator(SvcWatch svcWatch) {
        this.svcWatch = svcWatch;
    }

    @Override
    public Health health() {
        Map<String, Boolean> states = svcWatch.health();

        boolean allUp = states.values().stream().allMatch(Boolean::booleanValue);

        Health.Builder builder = allUp ? Health.up() : Health.down();

        states.forEach((name, up) -> builder.withDetail(name, up ? "UP" : "DOWN"));

        return builder.build();
    }
}
