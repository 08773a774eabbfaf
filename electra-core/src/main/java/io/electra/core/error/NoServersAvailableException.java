// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.error;

/**
 * No registered server is left to choose from.
 */
public final class NoServersAvailableException extends ElectraException {

    public NoServersAvailableException(final String message) {
        super(message);
    }
}
