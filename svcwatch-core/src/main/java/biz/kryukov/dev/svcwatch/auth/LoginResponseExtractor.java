package biz.kryukov.dev.svcwatch.auth;

import biz.kryukov.dev.svcwatch.http.HttpReply;

/**
 * Interprets a 200 reply to a login attempt.
 *
 * <p>Extractors run in order; the first non-inconclusive outcome wins.</p>
 */
@FunctionalInterface
public interface LoginResponseExtractor {

    /**
     * Inspects the reply.
     *
     * @param reply the login reply (status 200)
     * @return the outcome, {@link LoginOutcome#inconclusive()} when this extractor does not apply
     */
    LoginOutcome extract(HttpReply reply);
}
