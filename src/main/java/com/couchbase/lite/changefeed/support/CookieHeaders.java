package com.couchbase.lite.changefeed.support;

import java.net.URL;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import org.apache.http.Header;
import org.apache.http.client.CookieStore;
import org.apache.http.cookie.Cookie;
import org.apache.http.cookie.CookieOrigin;
import org.apache.http.cookie.CookieSpec;
import org.apache.http.impl.cookie.DefaultCookieSpec;

/**
 * Builds the Cookie header for a request from a {@link CookieStore}, with the same domain,
 * path, secure-flag and expiry matching HttpClient applies to its own requests.
 */
public class CookieHeaders {

    public static final String COOKIE = "Cookie";

    private CookieHeaders() {}

    /**
     * Cookies in the store that would be sent to {@code url}.
     */
    public static List<Cookie> cookiesForURL(CookieStore cookieStore, URL url) {
        List<Cookie> matched = new ArrayList<Cookie>();
        if (cookieStore == null) {
            return matched;
        }
        CookieSpec cookieSpec = new DefaultCookieSpec();
        CookieOrigin origin = originOf(url);
        Date now = new Date();
        for (Cookie cookie : cookieStore.getCookies()) {
            if (!cookie.isExpired(now) && cookieSpec.match(cookie, origin)) {
                matched.add(cookie);
            }
        }
        return matched;
    }

    /**
     * The Cookie header value for {@code url}, or null when no stored cookie applies.
     */
    public static String cookieHeaderForURL(CookieStore cookieStore, URL url) {
        List<Cookie> cookies = cookiesForURL(cookieStore, url);
        if (cookies.isEmpty()) {
            return null;
        }
        List<Header> headers = new DefaultCookieSpec().formatCookies(cookies);
        StringBuilder value = new StringBuilder();
        for (Header header : headers) {
            if (value.length() > 0) {
                value.append("; ");
            }
            value.append(header.getValue());
        }
        return value.toString();
    }

    private static CookieOrigin originOf(URL url) {
        int port = url.getPort() < 0 ? url.getDefaultPort() : url.getPort();
        String path = url.getPath() == null || url.getPath().isEmpty() ? "/" : url.getPath();
        boolean secure = "https".equalsIgnoreCase(url.getProtocol()) || "wss".equalsIgnoreCase(url.getProtocol());
        return new CookieOrigin(url.getHost(), port, path, secure);
    }
}
