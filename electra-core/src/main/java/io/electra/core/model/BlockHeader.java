// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.model;

import java.util.Objects;

/**
 * A raw block header at a given height.
 *
 * @param height block height
 * @param hex    the 80-byte serialized header, hex encoded
 */
public record BlockHeader(long height, String hex) {

    public BlockHeader {
        Objects.requireNonNull(hex, "hex");
    }
}
