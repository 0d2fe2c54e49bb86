package biz.kryukov.dev.svcwatch.auth;

import biz.kryukov.dev.svcwatch.http.HttpReply;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;

/**
 * Derives a human readable hint about the expected authentication method from a rejected
 * login reply. Used for debug logging only.
 */
public final class AuthHints {

    private AuthHints() {}

    /**
     * Inspects {@code WWW-Authenticate} first, then a JSON {@code error} or {@code message} field.
     *
     * @param reply rejected login reply
     * @return hint text, or empty
     */
    public static Optional<String> fromReply(HttpReply reply) {
        String wwwAuthenticate = reply.header("WWW-Authenticate");
        if (!wwwAuthenticate.isEmpty()) {
            String lower = wwwAuthenticate.toLowerCase(Locale.ROOT);
            if (lower.contains("bearer")) {
                return Optional.of("expected Bearer token authentication");
            }
            if (lower.contains("basic")) {
                return Optional.of("expected HTTP Basic authentication");
            }
            return Optional.of("WWW-Authenticate: " + wwwAuthenticate);
        }
        if (!reply.contentType().contains("application/json")) {
            return Optional.empty();
        }
        return errorText(reply).flatMap(AuthHints::hintFromMessage);
    }

    private static Optional<String> errorText(HttpReply reply) {
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(reply.body());
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode node = root.hasNonNull("error") ? root.get("error") : root.get("message");
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(node.isValueNode() ? node.asText() : node.toString());
    }

    private static Optional<String> hintFromMessage(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("form") || lower.contains("application/x-www-form-urlencoded")) {
            return Optional.of("response suggests form data");
        }
        if (lower.contains("json")) {
            return Optional.of("response suggests a JSON body");
        }
        if (lower.contains("bearer") || lower.contains("token")) {
            return Optional.of("response suggests a Bearer token");
        }
        if (lower.contains("api key") || lower.contains("api_key")) {
            return Optional.of("response suggests API key authentication");
        }
        return Optional.empty();
    }
}
