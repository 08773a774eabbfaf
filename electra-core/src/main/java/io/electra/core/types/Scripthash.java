// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.types;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Objects;

import io.electra.core.util.Hex;

/**
 * The key ElectrumX indexes addresses by: the SHA-256 of the output script,
 * byte-reversed and hex encoded.
 *
 * @param value 64 lowercase hex characters
 */
public record Scripthash(String value) {

    private static final int LENGTH = 64;

    public Scripthash {
        Objects.requireNonNull(value, "value");
        if (value.length() != LENGTH || !Hex.isHex(value)) {
            throw new IllegalArgumentException("Scripthash must be 32 bytes of hex, got: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static Scripthash fromHex(final String hex) {
        return new Scripthash(hex);
    }

    /**
     * Derives the scripthash of an output script ({@code scriptPubKey}).
     */
    public static Scripthash fromScript(final byte[] scriptPubKey) {
        Objects.requireNonNull(scriptPubKey, "scriptPubKey");
        final byte[] digest = sha256(scriptPubKey);
        for (int i = 0, j = digest.length - 1; i < j; i++, j--) {
            final byte tmp = digest[i];
            digest[i] = digest[j];
            digest[j] = tmp;
        }
        return new Scripthash(Hex.encode(digest));
    }

    public static Scripthash fromScriptHex(final String scriptPubKeyHex) {
        return fromScript(Hex.decode(scriptPubKeyHex));
    }

    private static byte[] sha256(final byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
