package biz.kryukov.dev.svcwatch.auth;

import biz.kryukov.dev.svcwatch.MalformedResponseException;
import biz.kryukov.dev.svcwatch.http.HttpReply;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Successful (2xx) reply of an authenticated request.
 */
public final class ApiResponse {

    private final HttpReply reply;

    ApiResponse(HttpReply reply) {
        this.reply = Objects.requireNonNull(reply, "reply");
    }

    public int statusCode() {
        return reply.statusCode();
    }

    /** First value of a response header, or an empty string. */
    public String header(String name) {
        return reply.header(name);
    }

    public String contentType() {
        return reply.contentType();
    }

    /** Body text, never null. */
    public String body() {
        return reply.body();
    }

    /** Whether the body is empty. */
    public boolean isEmpty() {
        return reply.body().isEmpty();
    }

    /**
     * Parses the body as JSON.
     *
     * @return the parsed tree
     * @throws MalformedResponseException if the body is not valid JSON
     */
    public JsonNode json() throws MalformedResponseException {
        try {
            JsonNode node = Json.MAPPER.readTree(reply.body());
            if (node == null || node.isMissingNode()) {
                throw new MalformedResponseException("empty body is not JSON", null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Binds the JSON body to a type.
     *
     * @throws MalformedResponseException if the body does not bind
     */
    public <T> T as(Class<T> type) throws MalformedResponseException {
        try {
            return Json.MAPPER.readValue(reply.body(), type);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("response does not bind to " + type.getSimpleName(), e);
        }
    }
}
