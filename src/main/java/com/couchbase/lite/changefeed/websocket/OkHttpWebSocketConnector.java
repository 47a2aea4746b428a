package com.couchbase.lite.changefeed.websocket;

import com.couchbase.lite.changefeed.Misc;
import com.couchbase.lite.changefeed.support.TLSSettings;
import com.couchbase.lite.changefeed.util.Log;

import java.io.IOException;
import java.net.URL;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.concurrent.TimeUnit;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;

/**
 * {@link WebSocketConnector} on top of OkHttp's WebSocket client.
 *
 * Each connection gets a client derived from the shared one (same dispatcher and connection
 * pool) with the handshake timeout and TLS settings of its request. Server certificates are
 * handed to {@link WebSocketEventListener#validateServerTrust}.
 *
 * OkHttp can't pause a WebSocket's reader, so a paused connection blocks OkHttp's reader
 * thread after delivering a message until it's resumed or closed. Unread frames then stay in
 * the socket buffers and TCP flow control throttles the server.
 */
public class OkHttpWebSocketConnector implements WebSocketConnector {

    private final OkHttpClient baseClient;

    public OkHttpWebSocketConnector(OkHttpClient baseClient) {
        this.baseClient = baseClient;
    }

    @Override
    public WebSocketConnection open(HandshakeRequest request, WebSocketEventListener listener) throws IOException {
        final OkHttpConnection connection = new OkHttpConnection(request.getURL());
        OkHttpClient client = clientFor(request, connection, listener);
        Log.v(Log.TAG_WEBSOCKET, "%s: opening %s", connection, request);
        WebSocket webSocket = client.newWebSocket(request.getRequest(), new Events(connection, listener));
        connection.attach(webSocket);
        return connection;
    }

    private OkHttpClient clientFor(HandshakeRequest request, OkHttpConnection connection,
                                   WebSocketEventListener listener) throws IOException {
        OkHttpClient.Builder builder = baseClient.newBuilder();
        long timeout = request.getTimeoutMillis();
        if (timeout > 0) {
            builder.connectTimeout(timeout, TimeUnit.MILLISECONDS)
                    .readTimeout(timeout, TimeUnit.MILLISECONDS)
                    .writeTimeout(timeout, TimeUnit.MILLISECONDS);
        }

        TLSSettings tls = request.getTLSSettings();
        try {
            X509TrustManager systemTrust = tls != null && tls.getTrustManager() != null
                    ? tls.getTrustManager()
                    : TLSSettings.defaultTrustManager();
            X509TrustManager trustManager = new ListenerTrustManager(connection, listener, systemTrust);
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(tls != null ? tls.getKeyManagers() : null, new TrustManager[]{trustManager}, null);
            builder.sslSocketFactory(sslContext.getSocketFactory(), trustManager);
        } catch (GeneralSecurityException e) {
            throw new IOException("Unable to set up TLS for " + request, e);
        }
        if (tls != null) {
            builder.hostnameVerifier(tls.hostnameVerifier(baseClient.hostnameVerifier()));
        }
        return builder.build();
    }

    /**
     * Asks the listener about every server certificate chain; the system trust manager is only
     * used for client certificates and the accepted issuers list.
     */
    private static class ListenerTrustManager implements X509TrustManager {
        private final WebSocketConnection connection;
        private final WebSocketEventListener listener;
        private final X509TrustManager systemTrust;

        ListenerTrustManager(WebSocketConnection connection, WebSocketEventListener listener,
                             X509TrustManager systemTrust) {
            this.connection = connection;
            this.listener = listener;
            this.systemTrust = systemTrust;
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            systemTrust.checkClientTrusted(chain, authType);
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            if (!listener.validateServerTrust(connection, chain, authType)) {
                throw new CertificateException("Server certificate rejected for " + connection);
            }
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return systemTrust.getAcceptedIssuers();
        }
    }

    /**
     * The code to answer a peer's close frame with. Codes that may only be received (1005 for a
     * close frame without payload, 1006, 1015) or are otherwise reserved can't be sent back, so
     * those are answered with {@link WebSocketCloseCode#NORMAL}.
     */
    static int replyCode(int receivedCode) {
        if (receivedCode < 1000 || receivedCode >= 5000
                || (receivedCode >= 1004 && receivedCode <= 1006)
                || (receivedCode >= 1015 && receivedCode <= 2999)) {
            return WebSocketCloseCode.NORMAL;
        }
        return receivedCode;
    }

    /**
     * Translates OkHttp's callbacks into {@link WebSocketEventListener} events.
     */
    private static class Events extends WebSocketListener {
        private final OkHttpConnection connection;
        private final WebSocketEventListener listener;

        Events(OkHttpConnection connection, WebSocketEventListener listener) {
            this.connection = connection;
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            Log.v(Log.TAG_WEBSOCKET, "%s: open (HTTP %d)", connection, response.code());
            // open() may not have attached the socket yet
            connection.attach(webSocket);
            listener.onOpen(connection);
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            listener.onTextMessage(connection, text);
            connection.awaitReadable();
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            listener.onBinaryMessage(connection, bytes.toByteArray());
            connection.awaitReadable();
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            Log.v(Log.TAG_WEBSOCKET, "%s: peer is closing (%d %s)", connection, code, reason);
            // complete the closing handshake; onClosed follows once our close frame is out
            webSocket.close(replyCode(code), null);
        }

        @Override
        public void onClosed(WebSocket webSocket, int code, String reason) {
            connection.markClosed();
            listener.onClosed(connection, code, reason, true);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            connection.markClosed();
            int httpStatus = 0;
            if (response != null && response.code() != 101) {
                httpStatus = response.code();
            }
            Log.v(Log.TAG_WEBSOCKET, "%s: failed (HTTP %d): %s", connection, httpStatus, t);
            listener.onFailure(connection, t, httpStatus);
        }
    }

    /**
     * The handle given out to callers. It exists before OkHttp's WebSocket does, so the trust
     * manager can refer to it during the handshake.
     */
    static class OkHttpConnection implements WebSocketConnection {
        private final URL url;
        private final Object readLock = new Object();
        private volatile WebSocket webSocket;
        private boolean readPaused;
        private boolean closed;

        OkHttpConnection(URL url) {
            this.url = url;
        }

        void attach(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public boolean send(String text) {
            WebSocket ws = webSocket;
            return ws != null && ws.send(text);
        }

        @Override
        public boolean close(int code, String reason) {
            markClosed();
            WebSocket ws = webSocket;
            return ws != null && ws.close(code, reason);
        }

        @Override
        public void setReadPaused(boolean paused) {
            synchronized (readLock) {
                readPaused = paused;
                readLock.notifyAll();
            }
        }

        @Override
        public boolean isReadPaused() {
            synchronized (readLock) {
                return readPaused;
            }
        }

        /**
         * Called on OkHttp's reader thread; blocks while reading is paused.
         */
        void awaitReadable() {
            synchronized (readLock) {
                while (readPaused && !closed) {
                    try {
                        readLock.wait();
                    } catch (InterruptedException e) {
                        Log.w(Log.TAG_WEBSOCKET, "%s: interrupted while paused, resuming", this);
                        Thread.currentThread().interrupt();
                        return;
                    }
                }
            }
        }

        void markClosed() {
            synchronized (readLock) {
                closed = true;
                readLock.notifyAll();
            }
        }

        @Override
        public String toString() {
            return "OkHttpConnection[" + Misc.sanitizeURL(url) + "]";
        }
    }
}
