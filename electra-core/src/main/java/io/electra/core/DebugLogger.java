// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for wire-level tracing.
 *
 * <p>
 * Everything goes through the {@code io.electra.debug} SLF4J logger after
 * {@link LogSanitizer} has scrubbed it, so tracing can be routed or silenced
 * by the application's logging configuration. Whether a line is written at
 * all is decided by {@link ElectraDebug} for the method it concerns.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.electra.debug");

    private DebugLogger() {
    }

    /**
     * Traces a request or response of {@code method}.
     */
    public static void logRpc(final String method, final String message, final Object... args) {
        if (!ElectraDebug.shouldLogRpc(method)) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Traces a server push for the subscription {@code method}.
     */
    public static void logSubscription(final String method, final String message, final Object... args) {
        if (!ElectraDebug.shouldLogSubscription(method)) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
