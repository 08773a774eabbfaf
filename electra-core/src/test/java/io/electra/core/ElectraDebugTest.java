// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

class ElectraDebugTest {

    private Logger debugLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        debugLogger = (Logger) LoggerFactory.getLogger("io.electra.debug");
        appender = new ListAppender<>();
        appender.start();
        debugLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        debugLogger.detachAppender(appender);
        ElectraDebug.setEnabled(false);
    }

    @Test
    void rpcTracingIsSilentUntilEnabled() {
        ElectraDebug.setEnabled(false);
        DebugLogger.logRpc("server.ping", "[RPC] -> %s", "{}");
        assertTrue(appender.list.isEmpty());

        ElectraDebug.setRpcLogging(true);
        DebugLogger.logRpc("server.ping", "[RPC] -> %s", "{\"id\":1}");

        List<ILoggingEvent> events = appender.list;
        assertEquals(1, events.size());
        assertEquals("[RPC] -> {\"id\":1}", events.get(0).getFormattedMessage());
    }

    @Test
    void togglesAreIndependent() {
        ElectraDebug.setSubscriptionLogging(true);

        assertTrue(ElectraDebug.isEnabled());
        assertFalse(ElectraDebug.isRpcLoggingEnabled());

        DebugLogger.logRpc("server.ping", "rpc");
        DebugLogger.logSubscription("blockchain.headers.subscribe", "push %d", 1);

        assertEquals(1, appender.list.size());
        assertEquals("push 1", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void methodFilterMatchesMethodsAndFamilies() {
        ElectraDebug.traceOnly("blockchain.scripthash", "server.version");

        assertTrue(ElectraDebug.isTraced("blockchain.scripthash.get_balance"));
        assertTrue(ElectraDebug.isTraced("server.version"));
        assertFalse(ElectraDebug.isTraced("server.versions"));
        assertFalse(ElectraDebug.isTraced("blockchain.scripthashes"));
        assertFalse(ElectraDebug.isTraced("blockchain.headers.subscribe"));
    }

    @Test
    void filteredMethodsAreNotTraced() {
        ElectraDebug.setEnabled(true);
        ElectraDebug.traceOnly("blockchain.scripthash.");

        DebugLogger.logRpc("blockchain.estimatefee", "fee");
        DebugLogger.logRpc("blockchain.scripthash.listunspent", "unspent");
        DebugLogger.logSubscription("blockchain.headers.subscribe", "header");
        DebugLogger.logSubscription("blockchain.scripthash.subscribe", "status");

        assertEquals(List.of("unspent", "status"),
                appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList());
        assertEquals(Set.of("blockchain.scripthash"), ElectraDebug.tracedMethods());
    }

    @Test
    void emptyFilterTracesEverything() {
        ElectraDebug.setRpcLogging(true);
        ElectraDebug.traceOnly("server.banner");
        ElectraDebug.traceOnly();

        DebugLogger.logRpc("blockchain.relayfee", "relay");

        assertEquals(1, appender.list.size());
    }

    @Test
    void disablingClearsTheFilter() {
        ElectraDebug.traceOnly("server.banner");

        ElectraDebug.setEnabled(false);

        assertTrue(ElectraDebug.tracedMethods().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ElectraDebug.traceOnly(" "));
    }
}
