// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.model;

import java.util.Objects;

/**
 * An unspent output paying to one address.
 *
 * @param address the caller's identifier for the scripthash that was queried
 * @param txHash  transaction id
 * @param txPos   output index
 * @param height  confirmation height, 0 while in the mempool
 * @param value   amount in satoshis
 */
public record UnspentOutput(String address, String txHash, int txPos, long height, long value) {

    public UnspentOutput {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(txHash, "txHash");
    }

    public boolean isConfirmed() {
        return height > 0;
    }
}
