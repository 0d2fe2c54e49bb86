package biz.kryukov.dev.svcwatch.store;

import java.util.Optional;

/**
 * Opaque secret storage. Encryption at rest is the implementation's concern.
 * Implementations must be thread-safe.
 */
public interface SecretStore {

    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);
}
