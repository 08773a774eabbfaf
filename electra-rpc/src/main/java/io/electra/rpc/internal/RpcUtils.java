// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc.internal;

import java.util.Map;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Internal utility methods shared by the RPC layer.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper. Floats are read as {@link java.math.BigDecimal}
     * so fee rates keep their exact decimal value.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Flattens the {@code data} member of an error into a string.
     */
    public static @Nullable String extractErrorData(final @Nullable Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            for (Object value : map.values()) {
                String extracted = extractErrorData(value);
                if (extracted != null) {
                    return extracted;
                }
            }
            return dataValue.toString();
        }
        if (dataValue instanceof Iterable<?> iterable) {
            for (Object item : iterable) {
                String extracted = extractErrorData(item);
                if (extracted != null) {
                    return extracted;
                }
            }
            return dataValue.toString();
        }
        return dataValue.toString();
    }
}
