package com.couchbase.lite.changefeed;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.regex.Pattern;

public class Misc {

    /**
     * Matches hosts that are an IPv4 address literal, optionally with a scheme and credentials.
     */
    private static final Pattern IP_ADDRESS_HOST = Pattern.compile(
            "^(http(s?)://)?((.+?):(.+?)@)?(((([0-9]|[1-9][0-9]|1[0-9]{2}|2[0-4][0-9]|25[0-5])\\.){3}([0-9]|[1-9][0-9]|1[0-9]{2}|2[0-4][0-9]|25[0-5])))+(/[^\\s]*)?");

    private Misc() {}

    /**
     * Appends a relative path (which may contain a query) to a base URL, inserting a "/" when
     * the base doesn't already end with one. Any query on the base URL is dropped.
     */
    public static URL appendToURL(URL base, String relative) {
        String path = base.getPath();
        if (!path.endsWith("/")) {
            path += "/";
        }
        try {
            return new URL(base.getProtocol(), base.getHost(), base.getPort(), path + relative);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException(e);
        }
    }

    public static boolean isIPAddressHost(String host) {
        if (host == null) {
            return false;
        }
        return IP_ADDRESS_HOST.matcher(host).matches();
    }

    /**
     * The URL with any user-info stripped, so passwords don't end up in logs.
     */
    public static String sanitizeURL(URL url) {
        if (url == null) {
            return null;
        }
        if (url.getUserInfo() == null) {
            return url.toExternalForm();
        }
        return url.toExternalForm().replace(url.getUserInfo() + "@", "---:---@");
    }
}
