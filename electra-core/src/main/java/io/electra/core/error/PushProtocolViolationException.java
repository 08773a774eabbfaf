// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.error;

/**
 * A subscription notification, or the response to a subscribe request,
 * carried an {@code error}. The session that received it is unusable
 * afterwards and the client reports this exception from every later call.
 */
public final class PushProtocolViolationException extends ElectraException {

    private final String method;

    public PushProtocolViolationException(final String method, final String error) {
        super("Server sent an error on subscription " + method + ": " + error);
        this.method = method;
    }

    public String method() {
        return method;
    }
}
