// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A peer advertised by {@code server.peers.subscribe}.
 *
 * @param ip       IP address the server resolved the peer to
 * @param host     peer host name
 * @param features feature tokens such as {@code v1.4}, {@code s50002}, {@code t50001}
 */
public record PeerServer(String ip, String host, List<String> features) {

    public PeerServer {
        Objects.requireNonNull(ip, "ip");
        Objects.requireNonNull(host, "host");
        features = List.copyOf(features);
    }
}
