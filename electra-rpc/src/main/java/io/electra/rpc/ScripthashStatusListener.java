// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import org.jspecify.annotations.Nullable;

/**
 * Receives status changes of subscribed scripthashes.
 */
@FunctionalInterface
public interface ScripthashStatusListener {

    /**
     * @param address the identifier the caller registered for the scripthash
     * @param status  hash of the address history, or {@code null} if it has none
     */
    void onStatus(String address, @Nullable String status);
}
