// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.model;

import java.util.Objects;

/**
 * Balance of one address, in satoshis.
 *
 * @param address     the caller's identifier for the scripthash that was queried
 * @param confirmed   confirmed balance
 * @param unconfirmed mempool delta, may be negative
 */
public record AddressBalance(String address, long confirmed, long unconfirmed) {

    public AddressBalance {
        Objects.requireNonNull(address, "address");
    }

    public long total() {
        return confirmed + unconfirmed;
    }
}
