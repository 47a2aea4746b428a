/**
 * Created by Wayne Carter.
 *
 * Copyright (c) 2012 Couchbase, Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied. See the License for the specific language governing permissions
 * and limitations under the License.
 */

package com.couchbase.lite.changefeed.util;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

public class Log {

    private static volatile Logger logger = new Slf4jLogger();

    /**
     * A map of tags and their enabled log level
     */
    private static final ConcurrentHashMap<String, Integer> enabledTags = new ConcurrentHashMap<String, Integer>();

    /**
     * Logging tags
     */
    public static final String TAG = "CBLite";  // default "catch-all" tag
    public static final String TAG_SYNC = "Sync";
    public static final String TAG_CHANGE_TRACKER = "ChangeTracker";
    public static final String TAG_WEBSOCKET = "WebSocket";

    private static final String[] ALL_TAGS = {
            TAG, TAG_SYNC, TAG_CHANGE_TRACKER, TAG_WEBSOCKET
    };

    /**
     * Logging levels -- values match up with android.util.Log
     */
    public static final int VERBOSE = 2;
    public static final int DEBUG = 3;
    public static final int INFO = 4;
    public static final int WARN = 5;
    public static final int ERROR = 6;
    public static final int ASSERT = 7;

    static {
        enableAllWarnLogs();
    }

    public static void enableAllWarnLogs() {
        for (String tag : ALL_TAGS) {
            enabledTags.put(tag, WARN);
        }
    }

    public static void disableAllLogs() {
        for (String tag : ALL_TAGS) {
            enabledTags.put(tag, ASSERT);
        }
    }

    /**
     * Enable logging for a particular tag / loglevel combo
     * @param tag Used to identify the source of a log message.
     * @param logLevel The loglevel to enable.  Anything matching this loglevel
     *                 or having a more urgent loglevel will be emitted.  Eg, Log.VERBOSE.
     */
    public static void enableLogging(String tag, int logLevel) {
        enabledTags.put(tag, logLevel);
    }

    /**
     * Is logging enabled for given tag / loglevel combo?
     * Tags that were never configured log at INFO and above.
     */
    public static boolean isLoggingEnabled(String tag, int logLevel) {
        Integer logLevelForTag = enabledTags.get(tag);
        return logLevel >= (logLevelForTag == null ? INFO : logLevelForTag);
    }

    public static void setLogger(Logger logger) {
        Log.logger = logger;
    }

    public static Logger getLogger() {
        return logger;
    }

    public static void v(String tag, String msg) {
        if (isLoggingEnabled(tag, VERBOSE)) {
            logger.v(tag, msg);
        }
    }

    public static void v(String tag, String msg, Throwable tr) {
        if (isLoggingEnabled(tag, VERBOSE)) {
            logger.v(tag, msg, tr);
        }
    }

    public static void v(String tag, String formatString, Object... args) {
        if (isLoggingEnabled(tag, VERBOSE)) {
            logger.v(tag, format(formatString, args));
        }
    }

    public static void d(String tag, String msg) {
        if (isLoggingEnabled(tag, DEBUG)) {
            logger.d(tag, msg);
        }
    }

    public static void d(String tag, String msg, Throwable tr) {
        if (isLoggingEnabled(tag, DEBUG)) {
            logger.d(tag, msg, tr);
        }
    }

    /**
     * Send a DEBUG message.
     * @param tag Used to identify the source of a log message.
     * @param formatString The string you would like logged plus format specifiers.
     * @param args Variable number of Object args to be used as params to formatString.
     */
    public static void d(String tag, String formatString, Object... args) {
        if (isLoggingEnabled(tag, DEBUG)) {
            logger.d(tag, format(formatString, args));
        }
    }

    public static void i(String tag, String msg) {
        if (isLoggingEnabled(tag, INFO)) {
            logger.i(tag, msg);
        }
    }

    public static void i(String tag, String msg, Throwable tr) {
        if (isLoggingEnabled(tag, INFO)) {
            logger.i(tag, msg, tr);
        }
    }

    public static void i(String tag, String formatString, Object... args) {
        if (isLoggingEnabled(tag, INFO)) {
            logger.i(tag, format(formatString, args));
        }
    }

    public static void w(String tag, String msg) {
        if (isLoggingEnabled(tag, WARN)) {
            logger.w(tag, msg);
        }
    }

    public static void w(String tag, Throwable tr) {
        if (isLoggingEnabled(tag, WARN)) {
            logger.w(tag, tr);
        }
    }

    public static void w(String tag, String msg, Throwable tr) {
        if (isLoggingEnabled(tag, WARN)) {
            logger.w(tag, msg, tr);
        }
    }

    /**
     * Send a WARN message and log the exception.
     * @param tag Used to identify the source of a log message.
     * @param formatString The string you would like logged plus format specifiers.
     * @param tr An exception to log
     * @param args Variable number of Object args to be used as params to formatString.
     */
    public static void w(String tag, String formatString, Throwable tr, Object... args) {
        if (isLoggingEnabled(tag, WARN)) {
            logger.w(tag, format(formatString, args), tr);
        }
    }

    public static void w(String tag, String formatString, Object... args) {
        if (isLoggingEnabled(tag, WARN)) {
            logger.w(tag, format(formatString, args));
        }
    }

    public static void e(String tag, String msg) {
        if (isLoggingEnabled(tag, ERROR)) {
            logger.e(tag, msg);
        }
    }

    public static void e(String tag, String msg, Throwable tr) {
        if (isLoggingEnabled(tag, ERROR)) {
            logger.e(tag, msg, tr);
        }
    }

    public static void e(String tag, String formatString, Throwable tr, Object... args) {
        if (isLoggingEnabled(tag, ERROR)) {
            logger.e(tag, format(formatString, args), tr);
        }
    }

    public static void e(String tag, String formatString, Object... args) {
        if (isLoggingEnabled(tag, ERROR)) {
            logger.e(tag, format(formatString, args));
        }
    }

    private static String format(String formatString, Object... args) {
        try {
            return String.format(Locale.ENGLISH, formatString, args);
        } catch (Exception e) {
            return String.format(Locale.ENGLISH, "Unable to format log: %s", formatString);
        }
    }
}
