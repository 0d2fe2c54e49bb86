package biz.kryukov.dev.svcwatch.registry;

import biz.kryukov.dev.svcwatch.Credentials;
import biz.kryukov.dev.svcwatch.Target;
import biz.kryukov.dev.svcwatch.http.Urls;

import java.util.Objects;

/**
 * Declaration of a target as supplied by an operator or a registry.
 *
 * @param name         unique name
 * @param url          base URL
 * @param apiType      declared API type, or empty
 * @param apiUrl       explicit API base URL, or empty
 * @param authEndpoint login path override, or empty
 * @param credentials  credentials, {@link Credentials#NONE} when absent
 */
public record TargetDefinition(
        String name,
        String url,
        String apiType,
        String apiUrl,
        String authEndpoint,
        Credentials credentials
) {

    public TargetDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(url, "url");
        apiType = apiType == null ? "" : apiType;
        apiUrl = apiUrl == null ? "" : apiUrl;
        authEndpoint = authEndpoint == null ? "" : authEndpoint;
        credentials = credentials == null ? Credentials.NONE : credentials;
    }

    /** Definition with only a name and URL. */
    public static TargetDefinition of(String name, String url) {
        return new TargetDefinition(name, url, "", "", "", Credentials.NONE);
    }

    /** Returns a copy with the given credentials. */
    public TargetDefinition withCredentials(Credentials value) {
        return new TargetDefinition(name, url, apiType, apiUrl, authEndpoint, value);
    }

    /**
     * Creates the initial target snapshot with a normalized URL.
     *
     * @throws biz.kryukov.dev.svcwatch.ValidationException if the name or URL is blank
     */
    public Target toTarget(boolean manual) {
        return Target.builder(name, Urls.normalizeBaseUrl(url))
                .manual(manual)
                .apiType(apiType)
                .apiUrl(apiUrl)
                .authEndpoint(authEndpoint)
                .build();
    }
}
