package com.couchbase.lite.changefeed;

/**
 * Same interpretation as HTTP status codes, plus a private code above 500.
 */
public class Status {

    public static final int OK = 200;
    public static final int CREATED = 201;
    public static final int NOT_MODIFIED = 304;
    public static final int BAD_REQUEST = 400;
    public static final int UNAUTHORIZED = 401;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int NOT_ACCEPTABLE = 406;
    public static final int REQUEST_TIMEOUT = 408;
    public static final int CONFLICT = 409;
    public static final int GONE = 410;
    public static final int TOO_MANY_REQUESTS = 429;
    public static final int INTERNAL_SERVER_ERROR = 500;
    public static final int NOT_IMPLEMENTED = 501;
    public static final int BAD_GATEWAY = 502;
    public static final int SERVICE_UNAVAILABLE = 503;
    public static final int GATEWAY_TIMEOUT = 504;

    // private codes
    public static final int UPSTREAM_ERROR = 589;

    private final int code;

    public Status(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isSuccessful() {
        return code > 0 && code < 400;
    }

    /**
     * Errors the server may recover from on its own, so it's worth asking again later.
     */
    public boolean isTransient() {
        return code == REQUEST_TIMEOUT
                || code == TOO_MANY_REQUESTS
                || (code >= 500 && code <= 599 && code != NOT_IMPLEMENTED && code != UPSTREAM_ERROR);
    }

    @Override
    public String toString() {
        return "Status: " + code;
    }
}
