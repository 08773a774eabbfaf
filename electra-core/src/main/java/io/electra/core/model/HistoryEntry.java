// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A transaction touching an address, either confirmed or in the mempool.
 *
 * <p>
 * ElectrumX reports mempool transactions with height {@code 0}, or {@code -1}
 * when one of their inputs is itself unconfirmed. The fee is only present for
 * mempool entries.
 *
 * @param address the caller's identifier for the scripthash that was queried
 * @param txHash  transaction id
 * @param height  block height, or 0 / -1 for mempool entries
 * @param fee     fee in satoshis, when the server reports it
 */
public record HistoryEntry(String address, String txHash, long height, @Nullable Long fee) {

    public HistoryEntry {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(txHash, "txHash");
    }

    public boolean isMempool() {
        return height <= 0;
    }
}
