package biz.kryukov.dev.svcwatch.store;

import biz.kryukov.dev.svcwatch.LivenessStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * One probe outcome in a target's check history.
 *
 * @param status             verdict
 * @param responseTimeMillis round trip in milliseconds, or null
 * @param checkedAt          probe time
 * @param detail             failure description, or empty
 */
public record CheckRecord(
        LivenessStatus status,
        Long responseTimeMillis,
        Instant checkedAt,
        String detail
) {

    public CheckRecord {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(checkedAt, "checkedAt");
        detail = detail == null ? "" : detail;
    }
}
