// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Switches for wire-level tracing, read by {@link DebugLogger}.
 *
 * <p>
 * Request/response tracing and subscription tracing are toggled separately.
 * Either can be narrowed to some ElectrumX methods with {@link #traceOnly}:
 * an entry names a method ({@code blockchain.scripthash.get_balance}) or a
 * method family ({@code blockchain.scripthash}, matching every method below
 * it). With no entries every method is traced.
 *
 * <pre>{@code
 * ElectraDebug.setRpcLogging(true);
 * ElectraDebug.traceOnly("blockchain.scripthash", "server.version");
 * }</pre>
 */
public final class ElectraDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean subscriptionLogging = false;
    private static final Set<String> tracedMethods = new CopyOnWriteArraySet<>();

    private ElectraDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || subscriptionLogging;
    }

    /**
     * Turns both kinds of tracing on or off. Turning them off also clears the
     * method filter.
     */
    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        subscriptionLogging = enabled;
        if (!enabled) {
            tracedMethods.clear();
        }
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setSubscriptionLogging(final boolean enabled) {
        subscriptionLogging = enabled;
    }

    public static boolean isSubscriptionLoggingEnabled() {
        return subscriptionLogging;
    }

    /**
     * Restricts tracing to the given methods or method families, replacing
     * any earlier filter. No arguments removes the filter.
     */
    public static void traceOnly(final String... methods) {
        tracedMethods.clear();
        for (String method : methods) {
            if (method == null || method.isBlank()) {
                throw new IllegalArgumentException("method filter entries must not be blank");
            }
            tracedMethods.add(method.endsWith(".") ? method.substring(0, method.length() - 1) : method);
        }
    }

    public static Set<String> tracedMethods() {
        return Set.copyOf(tracedMethods);
    }

    /**
     * Whether {@code method} passes the method filter.
     */
    public static boolean isTraced(final String method) {
        if (tracedMethods.isEmpty()) {
            return true;
        }
        for (String entry : tracedMethods) {
            if (method.equals(entry) || (method.startsWith(entry) && method.charAt(entry.length()) == '.')) {
                return true;
            }
        }
        return false;
    }

    static boolean shouldLogRpc(final String method) {
        return rpcLogging && isTraced(method);
    }

    static boolean shouldLogSubscription(final String method) {
        return subscriptionLogging && isTraced(method);
    }
}
