package biz.kryukov.dev.svcwatch.auth;

import biz.kryukov.dev.svcwatch.http.HttpReply;

/**
 * Login reply that sets cookies: cookie session.
 */
public final class SessionCookieExtractor implements LoginResponseExtractor {

    @Override
    public LoginOutcome extract(HttpReply reply) {
        return Cookies.parse(reply.headerValues("Set-Cookie")).isEmpty()
                ? LoginOutcome.inconclusive()
                : LoginOutcome.cookieSession();
    }
}
