package com.couchbase.lite.changefeed.support;

import com.couchbase.lite.changefeed.Misc;
import com.couchbase.lite.changefeed.internal.InterfaceAudience;

import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLSession;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

/**
 * TLS options applied to the change feed connection.
 *
 * Everything is optional: with no settings the JVM's default trust store and OkHttp's hostname
 * verification are used.
 */
public class TLSSettings {

    private KeyManager[] keyManagers;
    private X509TrustManager trustManager;
    private HostnameVerifier hostnameVerifier;
    private boolean skipValidationForIPAddressHosts;

    @InterfaceAudience.Public
    public TLSSettings() {
    }

    /**
     * Key managers holding a client certificate, for servers that require one. May be null.
     */
    public KeyManager[] getKeyManagers() {
        return keyManagers;
    }

    @InterfaceAudience.Public
    public void setKeyManagers(KeyManager[] keyManagers) {
        this.keyManagers = keyManagers;
    }

    /**
     * The trust manager that decides on server certificates, or null for the JVM default.
     */
    public X509TrustManager getTrustManager() {
        return trustManager;
    }

    @InterfaceAudience.Public
    public void setTrustManager(X509TrustManager trustManager) {
        this.trustManager = trustManager;
    }

    public HostnameVerifier getHostnameVerifier() {
        return hostnameVerifier;
    }

    public void setHostnameVerifier(HostnameVerifier hostnameVerifier) {
        this.hostnameVerifier = hostnameVerifier;
    }

    /**
     * Servers addressed by a bare IP address (local sync gateways, typically) can't present a
     * certificate for their name, so their certificate and hostname checks can be skipped.
     */
    public boolean isSkipValidationForIPAddressHosts() {
        return skipValidationForIPAddressHosts;
    }

    public void setSkipValidationForIPAddressHosts(boolean skip) {
        this.skipValidationForIPAddressHosts = skip;
    }

    /**
     * Is validation of this host's certificate disabled by these settings?
     */
    public boolean shouldDisableCertificateValidation(String host) {
        return skipValidationForIPAddressHosts && Misc.isIPAddressHost(host);
    }

    /**
     * The hostname verifier to install on the connection, wrapping {@code fallback} when no
     * explicit verifier was configured.
     */
    public HostnameVerifier hostnameVerifier(HostnameVerifier fallback) {
        HostnameVerifier verifier = hostnameVerifier != null ? hostnameVerifier : fallback;
        if (!skipValidationForIPAddressHosts) {
            return verifier;
        }
        return new IPAddressHostnameVerifier(verifier);
    }

    /**
     * The JVM's default X509 trust manager.
     */
    public static X509TrustManager defaultTrustManager() throws NoSuchAlgorithmException, KeyStoreException {
        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init((KeyStore) null);
        for (TrustManager trustManager : factory.getTrustManagers()) {
            if (trustManager instanceof X509TrustManager) {
                return (X509TrustManager) trustManager;
            }
        }
        throw new IllegalStateException("No default X509TrustManager: " + Arrays.toString(factory.getTrustManagers()));
    }

    /**
     * Verifies hostnames that are not IP addresses only (which are always allowed)
     */
    static class IPAddressHostnameVerifier implements HostnameVerifier {
        private final HostnameVerifier defaultVerifier;

        IPAddressHostnameVerifier(HostnameVerifier defaultVerifier) {
            this.defaultVerifier = defaultVerifier;
        }

        @Override
        public boolean verify(String hostname, SSLSession session) {
            if (Misc.isIPAddressHost(hostname)) return true;
            else return defaultVerifier.verify(hostname, session);
        }
    }
}
