package com.couchbase.lite.changefeed.support;

import com.couchbase.lite.changefeed.internal.InterfaceAudience;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import okhttp3.OkHttpClient;

import org.apache.http.client.CookieStore;
import org.apache.http.cookie.Cookie;
import org.apache.http.impl.client.BasicCookieStore;

public class ChangeFeedHttpClientFactory implements HttpClientFactory {

    private final CookieStore cookieStore;

    private OkHttpClient okHttpClient;

    public static final int DEFAULT_CONNECTION_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_SO_TIMEOUT_SECONDS = 60 * 5;

    public ChangeFeedHttpClientFactory() {
        this(new BasicCookieStore());
    }

    /**
     * Constructor
     */
    public ChangeFeedHttpClientFactory(CookieStore cookieStore) {
        this.cookieStore = cookieStore;
    }

    /**
     * @param okHttpClientFromUser lets the end user share a client (dispatcher, connection pool,
     *                             interceptors) with the rest of the app
     */
    @InterfaceAudience.Private
    public synchronized void setOkHttpClient(OkHttpClient okHttpClientFromUser) {
        if (okHttpClient != null) {
            throw new IllegalStateException("OkHttpClient already set");
        }
        okHttpClient = okHttpClientFromUser;
    }

    /**
     * One client per factory, so every change tracker using this factory shares its
     * dispatcher threads and connection pool.
     */
    @Override
    @InterfaceAudience.Private
    public synchronized OkHttpClient getOkHttpClient() {
        if (okHttpClient == null) {
            okHttpClient = new OkHttpClient.Builder()
                    .connectTimeout(DEFAULT_CONNECTION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .readTimeout(DEFAULT_SO_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .build();
        }
        return okHttpClient;
    }

    @InterfaceAudience.Private
    public void addCookies(List<Cookie> cookies) {
        if (cookieStore == null) {
            return;
        }
        synchronized (this) {
            for (Cookie cookie : cookies) {
                cookieStore.addCookie(cookie);
            }
        }
    }

    public void deleteCookie(String name) {
        // CookieStore can't delete a single cookie: keep the others, clear, re-add them
        if (cookieStore == null) {
            return;
        }
        synchronized (this) {
            List<Cookie> cookies = cookieStore.getCookies();
            List<Cookie> retainedCookies = new ArrayList<Cookie>();
            for (Cookie cookie : cookies) {
                if (!cookie.getName().equals(name)) {
                    retainedCookies.add(cookie);
                }
            }
            cookieStore.clear();
            for (Cookie retainedCookie : retainedCookies) {
                cookieStore.addCookie(retainedCookie);
            }
        }
    }

    @InterfaceAudience.Private
    public CookieStore getCookieStore() {
        return cookieStore;
    }
}
