package com.couchbase.lite.changefeed.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import okhttp3.OkHttpClient;
import org.apache.http.cookie.Cookie;
import org.apache.http.impl.cookie.BasicClientCookie;
import org.junit.jupiter.api.Test;

class ChangeFeedHttpClientFactoryTest {

    @Test
    void clientIsCreatedOnceWithDefaultTimeouts() {
        ChangeFeedHttpClientFactory factory = new ChangeFeedHttpClientFactory();

        OkHttpClient client = factory.getOkHttpClient();

        assertSame(client, factory.getOkHttpClient());
        assertEquals(60_000, client.connectTimeoutMillis());
        assertEquals(300_000, client.readTimeoutMillis());
    }

    @Test
    void userClientIsUsed() {
        ChangeFeedHttpClientFactory factory = new ChangeFeedHttpClientFactory();
        OkHttpClient mine = new OkHttpClient();

        factory.setOkHttpClient(mine);

        assertSame(mine, factory.getOkHttpClient());
        assertThrows(IllegalStateException.class, () -> factory.setOkHttpClient(new OkHttpClient()));
    }

    @Test
    void deleteCookieKeepsTheOthers() {
        ChangeFeedHttpClientFactory factory = new ChangeFeedHttpClientFactory();
        factory.addCookies(Arrays.<Cookie>asList(cookie("SyncGatewaySession", "abc"), cookie("theme", "dark")));

        factory.deleteCookie("SyncGatewaySession");

        assertEquals(1, factory.getCookieStore().getCookies().size());
        assertEquals("theme", factory.getCookieStore().getCookies().get(0).getName());
    }

    private static BasicClientCookie cookie(String name, String value) {
        BasicClientCookie cookie = new BasicClientCookie(name, value);
        cookie.setDomain("sync.example.com");
        cookie.setPath("/");
        return cookie;
    }
}
