package biz.kryukov.dev.svcwatch;

import java.util.Objects;

/**
 * API credentials of a target: optional username/password pair and optional API key. Immutable.
 *
 * <p>Values are secrets: {@link #toString()} never prints them.</p>
 */
public final class Credentials {

    /** No credentials configured. */
    public static final Credentials NONE = new Credentials(null, null, null);

    private final String username;
    private final String password;
    private final String apiKey;

    private Credentials(String username, String password, String apiKey) {
        this.username = emptyToNull(username);
        this.password = emptyToNull(password);
        this.apiKey = emptyToNull(apiKey);
    }

    /** Creates credentials for username/password authentication. */
    public static Credentials ofPassword(String username, String password) {
        return new Credentials(username, password, null);
    }

    /** Creates credentials for API key authentication. */
    public static Credentials ofApiKey(String apiKey) {
        return new Credentials(null, null, apiKey);
    }

    /** Creates credentials from any combination of values; blanks are treated as absent. */
    public static Credentials of(String username, String password, String apiKey) {
        return new Credentials(username, password, apiKey);
    }

    /** Returns the username, or null. */
    public String username() {
        return username;
    }

    /** Returns the password, or null. */
    public String password() {
        return password;
    }

    /** Returns the API key, or null. */
    public String apiKey() {
        return apiKey;
    }

    /** Whether both username and password are configured. */
    public boolean hasUsernamePassword() {
        return username != null && password != null;
    }

    /** Whether an API key is configured. */
    public boolean hasApiKey() {
        return apiKey != null;
    }

    /** Whether no value at all is configured. */
    public boolean isEmpty() {
        return username == null && password == null && apiKey == null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Credentials c)) {
            return false;
        }
        return Objects.equals(username, c.username)
                && Objects.equals(password, c.password)
                && Objects.equals(apiKey, c.apiKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(username, password, apiKey);
    }

    @Override
    public String toString() {
        return "Credentials{username=" + mask(username)
                + ", password=" + mask(password)
                + ", apiKey=" + mask(apiKey) + "}";
    }

    private static String mask(String value) {
        return value == null ? "<none>" : "****";
    }
}
