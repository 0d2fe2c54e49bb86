package biz.kryukov.dev.svcwatch.http;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.net.Socket;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.X509Certificate;

/**
 * SSLContext that accepts all certificates (self-signed targets, TLS relaxation fallback).
 *
 * <p>The trust manager is an {@link X509ExtendedTrustManager}, so the JDK does not wrap it
 * and the endpoint identification (hostname check) is skipped along with chain validation.
 * Targets reached by IP or by an alias of their certificate name still connect.</p>
 */
final class InsecureSslContext {

    private InsecureSslContext() {}

    static SSLContext create() {
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, new TrustManager[]{new TrustAllManager()}, null);
            return ctx;
        } catch (NoSuchAlgorithmException | KeyManagementException e) {
            throw new IllegalStateException("Failed to create insecure SSL context", e);
        }
    }

    @SuppressFBWarnings(value = "WEAK_TRUST_MANAGER",
            justification = "Certificate verification is disabled on purpose for relaxed calls")
    private static final class TrustAllManager extends X509ExtendedTrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // accept all
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // accept all
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
            // accept all
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
            // accept all, no hostname check
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
            // accept all
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
            // accept all, no hostname check
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
