package com.couchbase.lite.changefeed.internal;

import java.lang.annotation.Documented;

/**
 * Annotations that tell API consumers which classes and methods they may rely on.
 */
public class InterfaceAudience {

    /**
     * Part of the supported API.
     */
    @Documented
    public @interface Public {}

    /**
     * Used by other classes in this library only; may change without notice.
     */
    @Documented
    public @interface Private {}

    private InterfaceAudience() {}
}
