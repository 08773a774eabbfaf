// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.error;

import java.util.List;

/**
 * Raised when the number of distinct servers that failed during one failover
 * sequence reaches the configured maximum. The cause is the last failure.
 */
public final class FailoverExhaustedException extends ElectraException {

    private final List<String> failedHosts;

    public FailoverExhaustedException(final List<String> failedHosts, final Throwable cause) {
        super("Attempted to connect to " + failedHosts.size() + " servers but failed: " + failedHosts, cause);
        this.failedHosts = List.copyOf(failedHosts);
    }

    /**
     * Hosts in the order they failed.
     */
    public List<String> failedHosts() {
        return failedHosts;
    }
}
