package biz.kryukov.dev.svcwatch.registry;

import java.util.List;

/**
 * Source of targets, polled on every tick.
 */
public interface TargetRegistry {

    /** Registry name used in logs. */
    String name();

    /**
     * Whether the registry can be queried now. Unavailable registries are skipped
     * and the engine keeps monitoring the targets it already knows.
     */
    boolean available();

    /**
     * Current target declarations.
     *
     * @throws RuntimeException if the registry fails; the tick logs and skips it
     */
    List<TargetDefinition> targets();
}
