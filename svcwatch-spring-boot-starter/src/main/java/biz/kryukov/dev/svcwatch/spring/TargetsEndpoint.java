package biz.kryukov.dev.svcwatch.spring;

import biz.kryukov.dev.svcwatch.SvcWatch;
import biz.kryukov.dev.svcwatch.Target;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actuator endpoint /actuator/targets: liveness and API detection state per target.
 */
@Endpoint(id = "targets")
public class TargetsEndpoint {

    private final SvcWatch svcWatch;

    public TargetsEndpoint(SvcWatch svcWatch) {
        this.svcWatch = svcWatch;
    }

    @ReadOperation
    public Map<String, Map<String, Object>> targets() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (Target target : svcWatch.targets()) {
            result.put(target.name(), describe(target));
        }
        return result;
    }

    /** Returns one target, or null (404) when unknown. */
    @ReadOperation
    public Map<String, Object> target(@Selector String name) {
        return svcWatch.target(name).map(this::describe).orElse(null);
    }

    private Map<String, Object> describe(Target target) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("url", target.url());
        view.put("status", target.status().label());
        view.put("lastChecked", format(target.lastChecked()));
        view.put("statusChangedAt", format(target.statusChangedAt()));
        view.put("responseTimeMs", target.responseTimeMillis());
        view.put("uptime", svcWatch.uptime(target.name()));
        view.put("apiDetected", target.apiDetected());
        view.put("apiType", target.apiType());
        view.put("apiEndpoint", target.apiEndpoint());
        view.put("apiUrl", target.apiUrl());
        view.put("detectionAttempts", target.detectionAttempts());
        view.put("nextCheck", format(target.nextCheck()));
        return view;
    }

    private static String format(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
