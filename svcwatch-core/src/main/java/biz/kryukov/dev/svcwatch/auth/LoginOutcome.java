package biz.kryukov.dev.svcwatch.auth;

import java.util.Objects;

/**
 * Interpretation of a successful login response.
 *
 * @param kind  what the response established
 * @param token bearer token for {@link Kind#TOKEN}, otherwise null
 */
public record LoginOutcome(Kind kind, String token) {

    private static final LoginOutcome COOKIE_SESSION = new LoginOutcome(Kind.COOKIE_SESSION, null);
    private static final LoginOutcome INCONCLUSIVE = new LoginOutcome(Kind.INCONCLUSIVE, null);

    /** Outcome kinds. */
    public enum Kind {
        /** A bearer token was issued. */
        TOKEN,
        /** The session lives in cookies. */
        COOKIE_SESSION,
        /** Nothing recognizable; the next extractor decides. */
        INCONCLUSIVE
    }

    public LoginOutcome {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.TOKEN && (token == null || token.isEmpty())) {
            throw new IllegalArgumentException("token outcome requires a token");
        }
    }

    public static LoginOutcome token(String token) {
        return new LoginOutcome(Kind.TOKEN, token);
    }

    public static LoginOutcome cookieSession() {
        return COOKIE_SESSION;
    }

    public static LoginOutcome inconclusive() {
        return INCONCLUSIVE;
    }

    /** Whether the login is accepted. */
    public boolean accepted() {
        return kind != Kind.INCONCLUSIVE;
    }

    @Override
    public String toString() {
        // never print the token
        return "LoginOutcome{" + kind + "}";
    }
}
