// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.error;

import java.time.Duration;

/**
 * Raised when the responses of a batch did not all arrive within the request
 * timeout.
 */
public final class RequestTimeoutException extends TransportException {

    private final Duration timeout;

    public RequestTimeoutException(final String message, final Duration timeout) {
        super(message);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
