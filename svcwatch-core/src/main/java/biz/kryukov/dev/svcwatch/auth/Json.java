package biz.kryukov.dev.svcwatch.auth;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson mapper. ObjectMapper is thread-safe once configured.
 */
final class Json {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private Json() {}
}
