package biz.kryukov.dev.svcwatch.http;

import biz.kryukov.dev.svcwatch.ValidationException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * URL helpers shared by the prober, scanner and API client.
 */
public final class Urls {

    private static final String HTTP = "http://";
    private static final String HTTPS = "https://";

    private Urls() {}

    /**
     * Normalizes a base URL: rejects blanks, defaults a missing scheme to https, strips trailing slashes.
     *
     * @param url raw URL
     * @return normalized URL
     * @throws ValidationException if the URL is null or blank
     */
    public static String normalizeBaseUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("base url must not be empty");
        }
        String result = url.trim();
        if (!hasScheme(result)) {
            result = HTTPS + result;
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    /** Whether the URL starts with http:// or https://. */
    public static boolean hasScheme(String url) {
        String lower = url.toLowerCase();
        return lower.startsWith(HTTP) || lower.startsWith(HTTPS);
    }

    /** Whether the URL uses the https scheme. */
    public static boolean isSecure(String url) {
        return url.toLowerCase().startsWith(HTTPS);
    }

    /** Swaps https for http, keeping the rest of the URL. */
    public static String toPlaintext(String url) {
        if (!isSecure(url)) {
            return url;
        }
        return HTTP + url.substring(HTTPS.length());
    }

    /** Prefixes a path with a slash when it lacks one. */
    public static String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    /** Joins a base URL (without trailing slash) and a path. */
    public static String join(String baseUrl, String path) {
        String base = baseUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + normalizePath(path);
    }

    /** Encodes a map as an {@code application/x-www-form-urlencoded} string. */
    public static String formEncode(Map<String, String> values) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> e : values.entrySet()) {
            joiner.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                    + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(),
                    StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }

    /** Appends query parameters to a URL. */
    public static String withQuery(String url, Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + formEncode(query);
    }
}
