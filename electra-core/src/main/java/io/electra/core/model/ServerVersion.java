// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.model;

import java.util.Objects;

/**
 * Outcome of the {@code server.version} handshake.
 *
 * @param software        server software string, e.g. {@code ElectrumX 1.16.0}
 * @param protocolVersion negotiated protocol version
 */
public record ServerVersion(String software, String protocolVersion) {

    public ServerVersion {
        Objects.requireNonNull(software, "software");
        Objects.requireNonNull(protocolVersion, "protocolVersion");
    }
}
