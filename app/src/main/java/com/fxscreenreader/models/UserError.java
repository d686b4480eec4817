package com.fxscreenreader.models;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Error and event log entry point.
 * <p>
 * Call sites use the static {@link Log} facade with a per-class TAG. Output is routed through SLF4J
 * with one logger per TAG under the {@code fxreader} namespace.
 */
public class UserError {

    private static final String LOGGER_PREFIX = "fxreader.";

    private UserError() {
    }

    public static class Log {

        private static final ConcurrentHashMap<String, Logger> loggers = new ConcurrentHashMap<>();

        private static Logger logger(final String tag) {
            return loggers.computeIfAbsent(tag == null ? "unknown" : tag, t -> LoggerFactory.getLogger(LOGGER_PREFIX + t));
        }

        public static void d(final String tag, final String msg) {
            logger(tag).debug(msg);
        }

        public static void i(final String tag, final String msg) {
            logger(tag).info(msg);
        }

        public static void w(final String tag, final String msg) {
            logger(tag).warn(msg);
        }

        public static void e(final String tag, final String msg) {
            logger(tag).error(msg);
        }

        public static void e(final String tag, final String msg, final Throwable t) {
            logger(tag).error(msg, t);
        }

        // something that should never happen
        public static void wtf(final String tag, final String msg) {
            logger(tag).error("WTF: " + msg);
        }

        // user event, low priority
        public static void uel(final String tag, final String msg) {
            logger(tag).info("UE: " + msg);
        }
    }
}
