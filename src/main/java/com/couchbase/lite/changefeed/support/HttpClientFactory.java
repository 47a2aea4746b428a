package com.couchbase.lite.changefeed.support;

import java.util.List;

import okhttp3.OkHttpClient;

import org.apache.http.client.CookieStore;
import org.apache.http.cookie.Cookie;

public interface HttpClientFactory {
    OkHttpClient getOkHttpClient();
    public void addCookies(List<Cookie> cookies);
    public void deleteCookie(String name);
    public CookieStore getCookieStore();
}
