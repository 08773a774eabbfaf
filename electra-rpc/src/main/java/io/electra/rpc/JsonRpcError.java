// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * The {@code error} member of a response or notification.
 *
 * <p>
 * Some servers send a bare string instead of an error object; those arrive
 * here with {@link #UNKNOWN_CODE} and the string as the message.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcError(int code, String message, @Nullable Object data) {

    public static final int UNKNOWN_CODE = 0;

    @Override
    public String toString() {
        return data == null ? code + ": " + message : code + ": " + message + " (" + data + ")";
    }
}
