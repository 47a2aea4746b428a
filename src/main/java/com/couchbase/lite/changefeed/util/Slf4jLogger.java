package com.couchbase.lite.changefeed.util;

import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link Logger}: every tag becomes an SLF4J logger named {@code couchbase.<tag>}.
 * VERBOSE maps to TRACE.
 */
public class Slf4jLogger implements Logger {

    private static final String PREFIX = "couchbase.";

    private final ConcurrentHashMap<String, org.slf4j.Logger> loggers =
            new ConcurrentHashMap<String, org.slf4j.Logger>();

    private org.slf4j.Logger logger(String tag) {
        org.slf4j.Logger logger = loggers.get(tag);
        if (logger == null) {
            logger = LoggerFactory.getLogger(PREFIX + tag);
            org.slf4j.Logger existing = loggers.putIfAbsent(tag, logger);
            if (existing != null) {
                logger = existing;
            }
        }
        return logger;
    }

    @Override
    public void v(String tag, String msg) {
        logger(tag).trace(msg);
    }

    @Override
    public void v(String tag, String msg, Throwable tr) {
        logger(tag).trace(msg, tr);
    }

    @Override
    public void d(String tag, String msg) {
        logger(tag).debug(msg);
    }

    @Override
    public void d(String tag, String msg, Throwable tr) {
        logger(tag).debug(msg, tr);
    }

    @Override
    public void i(String tag, String msg) {
        logger(tag).info(msg);
    }

    @Override
    public void i(String tag, String msg, Throwable tr) {
        logger(tag).info(msg, tr);
    }

    @Override
    public void w(String tag, String msg) {
        logger(tag).warn(msg);
    }

    @Override
    public void w(String tag, Throwable tr) {
        logger(tag).warn(tr.toString(), tr);
    }

    @Override
    public void w(String tag, String msg, Throwable tr) {
        logger(tag).warn(msg, tr);
    }

    @Override
    public void e(String tag, String msg) {
        logger(tag).error(msg);
    }

    @Override
    public void e(String tag, String msg, Throwable tr) {
        logger(tag).error(msg, tr);
    }
}
