package com.couchbase.lite.changefeed;

/**
 * An exception that carries the {@link Status} the remote server (or this library) reported.
 */
public class CouchbaseLiteException extends Exception {

    private final Status status;

    public CouchbaseLiteException(String detailMessage, Status status) {
        super(detailMessage);
        this.status = status;
    }

    public CouchbaseLiteException(String detailMessage, Throwable throwable, Status status) {
        super(detailMessage, throwable);
        this.status = status;
    }

    public Status getCBLStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "CouchbaseLiteException, " + status + (getMessage() != null ? ", " + getMessage() : "");
    }
}
