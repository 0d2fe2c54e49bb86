package biz.kryukov.dev.svcwatch.store;

import biz.kryukov.dev.svcwatch.Credentials;

import java.util.Objects;

/**
 * Maps target credentials onto {@link SecretStore} keys ({@code <target>/username},
 * {@code <target>/password}, {@code <target>/api-key}).
 */
public final class CredentialVault {

    private static final String USERNAME = "username";
    private static final String PASSWORD = "password";
    private static final String API_KEY = "api-key";

    private final SecretStore secrets;

    public CredentialVault(SecretStore secrets) {
        this.secrets = Objects.requireNonNull(secrets, "secrets");
    }

    /** Loads the credentials of a target; {@link Credentials#NONE} when nothing is stored. */
    public Credentials load(String target) {
        return Credentials.of(
                secrets.get(key(target, USERNAME)).orElse(null),
                secrets.get(key(target, PASSWORD)).orElse(null),
                secrets.get(key(target, API_KEY)).orElse(null));
    }

    /** Replaces the stored credentials of a target. Absent values are removed. */
    public void store(String target, Credentials credentials) {
        write(key(target, USERNAME), credentials.username());
        write(key(target, PASSWORD), credentials.password());
        write(key(target, API_KEY), credentials.apiKey());
    }

    /** Removes every secret of a target. */
    public void remove(String target) {
        secrets.remove(key(target, USERNAME));
        secrets.remove(key(target, PASSWORD));
        secrets.remove(key(target, API_KEY));
    }

    private void write(String key, String value) {
        if (value == null) {
            secrets.remove(key);
        } else {
            secrets.put(key, value);
        }
    }

    static String key(String target, String field) {
        return target + "/" + field;
    }
}
