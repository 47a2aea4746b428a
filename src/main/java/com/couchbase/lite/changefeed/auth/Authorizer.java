package com.couchbase.lite.changefeed.auth;

import java.net.URL;

/**
 * Supplies the value of the Authorization header for requests to a remote database.
 * Instances may be shared by several change trackers and must allow concurrent calls.
 */
public interface Authorizer {

    /**
     * @param url the URL about to be requested
     * @param realm the authentication realm, or null if it isn't known yet
     * @return the Authorization header value, or null/empty to send none
     */
    String authorizeURLRequest(URL url, String realm);
}
