package biz.kryukov.dev.svcwatch.auth;

import biz.kryukov.dev.svcwatch.http.HttpReply;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * JSON login reply carrying a token in one of the well-known fields.
 */
public final class JsonTokenExtractor implements LoginResponseExtractor {

    /** Token field names, in lookup order. */
    public static final List<String> TOKEN_FIELDS = List.of("jwt", "token", "access_token", "auth_token");

    @Override
    public LoginOutcome extract(HttpReply reply) {
        if (reply.body().isBlank()) {
            return LoginOutcome.inconclusive();
        }
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(reply.body());
        } catch (JsonProcessingException e) {
            return LoginOutcome.inconclusive();
        }
        if (root == null || !root.isObject()) {
            return LoginOutcome.inconclusive();
        }
        for (String field : TOKEN_FIELDS) {
            JsonNode value = root.get(field);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isEmpty()) {
                return LoginOutcome.token(value.asText());
            }
        }
        return LoginOutcome.inconclusive();
    }
}
