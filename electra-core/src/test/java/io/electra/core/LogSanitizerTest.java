// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void redactsBroadcastTransaction() {
        String input = "{\"jsonrpc\":\"2.0\",\"method\":\"blockchain.transaction.broadcast\","
                + "\"params\":[\"0100000001abcdef\"],\"id\":7}";
        String sanitized = LogSanitizer.sanitize(input);

        assertEquals("{\"jsonrpc\":\"2.0\",\"method\":\"blockchain.transaction.broadcast\","
                + "\"params\":[\"***[REDACTED]***\"],\"id\":7}", sanitized);
    }

    @Test
    void leavesOtherMethodParamsUntouched() {
        String input = "{\"jsonrpc\":\"2.0\",\"method\":\"blockchain.transaction.get\",\"params\":[\"abcdef\"],\"id\":1}";
        assertEquals(input, LogSanitizer.sanitize(input));
    }

    @Test
    void truncatesLongData() {
        String longData = "a".repeat(2500);
        String input = "{\"result\":\"" + longData + "\"}";
        String sanitized = LogSanitizer.sanitize(input);

        assertTrue(sanitized.endsWith("...(truncated)"));
        assertEquals(2000, sanitized.length());
    }

    @Test
    void handlesNull() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }

    @Test
    void redactionHappensBeforeTruncation() {
        String rawTx = "ab".repeat(3000);
        String input = "{\"method\":\"blockchain.transaction.broadcast\",\"params\":[\"" + rawTx + "\"]}";
        String sanitized = LogSanitizer.sanitize(input);

        assertFalse(sanitized.contains("abab"));
        assertTrue(sanitized.contains(LogSanitizer.REDACTED));
    }
}
