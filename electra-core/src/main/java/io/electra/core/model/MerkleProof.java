// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Merkle branch proving a transaction's inclusion in a block.
 *
 * @param txHash      the transaction the proof is for
 * @param blockHeight height of the containing block
 * @param merkle      sibling hashes from the leaf up
 * @param pos         index of the transaction in the block
 */
public record MerkleProof(String txHash, long blockHeight, List<String> merkle, int pos) {

    public MerkleProof {
        Objects.requireNonNull(txHash, "txHash");
        merkle = List.copyOf(merkle);
    }
}
