package biz.kryukov.dev.svcwatch.auth;

import biz.kryukov.dev.svcwatch.http.HttpReply;

import java.util.Locale;

/**
 * Text or HTML login reply containing "ok" (e.g. {@code Ok.}): cookie session.
 */
public final class PlainTextMarkerExtractor implements LoginResponseExtractor {

    @Override
    public LoginOutcome extract(HttpReply reply) {
        String contentType = reply.contentType();
        if (!contentType.contains("text/plain") && !contentType.contains("text/html")) {
            return LoginOutcome.inconclusive();
        }
        if (reply.body().trim().toLowerCase(Locale.ROOT).contains("ok")) {
            return LoginOutcome.cookieSession();
        }
        return LoginOutcome.inconclusive();
    }
}
