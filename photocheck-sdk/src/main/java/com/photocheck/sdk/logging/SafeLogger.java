package com.photocheck.sdk.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tagged logger facade over SLF4J. Logger names are "PhotoCheck/&lt;tag&gt;".
 * - Raw landmark coordinate arrays are masked before output.
 * - Level filtering (debug included) is left to the backend configuration.
 */
public final class SafeLogger {

    private static final String SDK_TAG_PREFIX = "PhotoCheck/";
    private static final Map<String, Logger> LOGGERS = new ConcurrentHashMap<>();

    private SafeLogger() {}

    private static Logger logger(String tag) {
        return LOGGERS.computeIfAbsent(tag, t -> LoggerFactory.getLogger(SDK_TAG_PREFIX + t));
    }

    public static boolean isDebugEnabled(String tag) {
        return logger(tag).isDebugEnabled();
    }

    public static void d(String tag, String msg) {
        Logger log = logger(tag);
        if (log.isDebugEnabled()) log.debug(sanitize(msg));
    }

    public static void i(String tag, String msg) {
        logger(tag).info(sanitize(msg));
    }

    public static void w(String tag, String msg) {
        logger(tag).warn(sanitize(msg));
    }

    public static void e(String tag, String msg) {
        logger(tag).error(sanitize(msg));
    }

    public static void e(String tag, String msg, Throwable t) {
        logger(tag).error(sanitize(msg), t);
    }

    /** Masks numeric arrays such as [12.5, 30.25, ...] (landmark coordinates). */
    static String sanitize(String msg) {
        if (msg == null) return "(null)";
        return msg.replaceAll("\\[-?\\d+\\.\\d+(,\\s*-?\\d+\\.\\d+)+]", "[LANDMARKS_MASKED]");
    }
}
