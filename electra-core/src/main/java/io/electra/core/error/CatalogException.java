// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.error;

/**
 * The server catalog could not be read or parsed.
 */
public final class CatalogException extends ElectraException {

    public CatalogException(final String message) {
        super(message);
    }

    public CatalogException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
