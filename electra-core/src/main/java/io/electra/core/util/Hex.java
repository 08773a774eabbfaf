// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core.util;

/**
 * Utility methods for plain (unprefixed) hex encoding as used on the
 * ElectrumX wire.
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        for (int i = 0; i < NIBBLE_LOOKUP.length; i++) {
            NIBBLE_LOOKUP[i] = -1;
        }

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decode a hex string into bytes.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("Hex string cannot be null");
        }
        if ((hexString.length() & 1) == 1) {
            throw new IllegalArgumentException("Hex string must have an even length: " + hexString);
        }

        final byte[] result = new byte[hexString.length() / 2];
        for (int i = 0; i < result.length; i++) {
            final int high = toNibble(hexString.charAt(i * 2), hexString);
            final int low = toNibble(hexString.charAt(i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }
        return result;
    }

    /**
     * Encode bytes as a lowercase hex string.
     *
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }

        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Returns {@code true} if every character is a hex digit and the length is even.
     */
    public static boolean isHex(final String value) {
        if (value == null || (value.length() & 1) == 1) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
                return false;
            }
        }
        return true;
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("Invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
