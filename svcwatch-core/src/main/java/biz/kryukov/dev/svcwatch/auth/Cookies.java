package biz.kryukov.dev.svcwatch.auth;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Minimal cookie handling: name/value pairs from {@code Set-Cookie}, rendered back as {@code Cookie}.
 * Attributes (path, expiry, domain) are ignored; a client talks to one base URL.
 */
final class Cookies {

    private Cookies() {}

    static Map<String, String> parse(List<String> setCookieHeaders) {
        Map<String, String> cookies = new LinkedHashMap<>();
        for (String header : setCookieHeaders) {
            String pair = header;
            int semi = pair.indexOf(';');
            if (semi >= 0) {
                pair = pair.substring(0, semi);
            }
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = pair.substring(0, eq).trim();
            if (!name.isEmpty()) {
                cookies.put(name, pair.substring(eq + 1).trim());
            }
        }
        return cookies;
    }

    static String header(Map<String, String> cookies) {
        StringJoiner joiner = new StringJoiner("; ");
        cookies.forEach((name, value) -> joiner.add(name + "=" + value));
        return joiner.toString();
    }
}
