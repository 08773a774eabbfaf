// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.electra.core.error.ElectraException;
import io.electra.core.error.PushProtocolViolationException;
import io.electra.core.model.BlockHeader;
import io.electra.rpc.transport.Connection;
import io.electra.rpc.transport.ConnectionFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

class SubscriptionRegistryTest {

    private static final String SH_1 = "11".repeat(32);
    private static final String SH_2 = "22".repeat(32);

    private SubscriptionRegistry registry;
    private Connection connection;
    private Session session;
    private final List<ElectraException> sessionFailures = new ArrayList<>();
    private final List<String> statuses = new ArrayList<>();

    private Logger registryLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry(Runnable::run);
        connection = mock(Connection.class);
        session = openSession("a.example", connection);

        registryLogger = (Logger) LoggerFactory.getLogger(SubscriptionRegistry.class);
        appender = new ListAppender<>();
        appender.start();
        registryLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        registryLogger.detachAppender(appender);
    }

    private Session openSession(String host, Connection conn) {
        ConnectionFactory factory = mock(ConnectionFactory.class);
        when(factory.open(any(), anyBoolean(), any())).thenReturn(conn);
        Session opened = new Session(ServerDescriptor.tls(host, 50002), registry::dispatch, sessionFailures::add,
                ElectraMetrics.noop());
        opened.connect(factory, true);
        return opened;
    }

    private static List<String> framesSentOn(Connection conn) {
        ArgumentCaptor<String> frames = ArgumentCaptor.forClass(String.class);
        Mockito.verify(conn, Mockito.atLeast(0)).send(frames.capture());
        return frames.getAllValues();
    }

    private static String push(String method, String paramsJson) {
        return "{\"jsonrpc\":\"2.0\",\"method\":\"" + method + "\",\"params\":" + paramsJson + "}";
    }

    private static String response(long id, String resultJson) {
        return "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":" + resultJson + "}";
    }

    private ScripthashStatusListener recordingListener() {
        return (address, status) -> statuses.add(address + "=" + status);
    }

    @Test
    void subscribeResponseDeliversCurrentStatusWithAddress() {
        Map<String, String> wallet = new LinkedHashMap<>();
        wallet.put(SH_1, "addr-1");
        wallet.put(SH_2, "addr-2");

        List<Long> ids = registry.subscribeToScripthashes(session, wallet, recordingListener());
        session.onFrame(response(ids.get(1), "\"status-2\""));
        session.onFrame(response(ids.get(0), "null"));

        assertEquals(2, framesSentOn(connection).size());
        assertTrue(framesSentOn(connection).get(0).contains("\"params\":[\"" + SH_1 + "\"]"));
        assertEquals(List.of("addr-2=status-2", "addr-1=null"), statuses);
        assertEquals(2, registry.scripthashCount());
    }

    @Test
    void pushesReachTheListener() {
        registry.subscribeToScripthashes(session, Map.of(SH_1, "addr-1"), recordingListener());

        registry.dispatch(new JsonRpcNotification(SubscriptionRegistry.SCRIPTHASH_SUBSCRIBE,
                List.of(SH_1, "new-status"), null));

        assertEquals(List.of("addr-1=new-status"), statuses);
    }

    @Test
    void pushForUnknownScripthashIsDropped() {
        registry.subscribeToScripthashes(session, Map.of(SH_1, "addr-1"), recordingListener());

        session.onFrame(push(SubscriptionRegistry.SCRIPTHASH_SUBSCRIBE, "[\"" + SH_2 + "\",\"status\"]"));

        assertTrue(statuses.isEmpty());
        assertTrue(session.isOpen());
        assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
                && e.getFormattedMessage().contains("no subscription")));
    }

    @Test
    void errorPushIsAProtocolViolation() {
        JsonRpcNotification errored = new JsonRpcNotification(SubscriptionRegistry.SCRIPTHASH_SUBSCRIBE, List.of(),
                new JsonRpcError(-32600, "server fault", null));

        PushProtocolViolationException ex = assertThrows(PushProtocolViolationException.class,
                () -> registry.dispatch(errored));
        assertTrue(ex.getMessage().contains(SubscriptionRegistry.SCRIPTHASH_SUBSCRIBE));
    }

    @Test
    void errorPushFailsTheSession() {
        session.onFrame("{\"jsonrpc\":\"2.0\",\"method\":\"blockchain.headers.subscribe\",\"error\":\"bad\"}");

        assertFalse(session.isOpen());
        assertInstanceOf(PushProtocolViolationException.class, sessionFailures.get(0));
    }

    @Test
    void errorResponseToSubscribeFailsTheSession() {
        List<Long> ids = registry.subscribeToScripthashes(session, Map.of(SH_1, "addr-1"), recordingListener());

        session.onFrame("{\"jsonrpc\":\"2.0\",\"id\":" + ids.get(0)
                + ",\"error\":{\"code\":1,\"message\":\"unsupported\"}}");

        assertFalse(session.isOpen());
        assertInstanceOf(PushProtocolViolationException.class, sessionFailures.get(0));
        assertTrue(statuses.isEmpty());
    }

    @Test
    void failingListenerDoesNotStopDelivery() {
        registry.subscribeToScripthashes(session, Map.of(SH_1, "addr-1"), (address, status) -> {
            throw new IllegalStateException("listener bug");
        });
        registry.subscribeToScripthashes(session, Map.of(SH_2, "addr-2"), recordingListener());

        registry.dispatch(new JsonRpcNotification(SubscriptionRegistry.SCRIPTHASH_SUBSCRIBE, List.of(SH_1, "x"), null));
        registry.dispatch(new JsonRpcNotification(SubscriptionRegistry.SCRIPTHASH_SUBSCRIBE, List.of(SH_2, "y"), null));

        assertEquals(List.of("addr-2=y"), statuses);
        assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
                && e.getThrowableProxy() != null
                && e.getThrowableProxy().getMessage().equals("listener bug")));
    }

    @Test
    void headerPushesReachEveryListener() {
        List<BlockHeader> first = new ArrayList<>();
        List<BlockHeader> second = new ArrayList<>();
        long firstId = registry.subscribeToBlockHeaders(session, first::add);
        registry.subscribeToBlockHeaders(session, second::add);

        session.onFrame(response(firstId, "{\"height\":100,\"hex\":\"aa\"}"));
        session.onFrame(push(SubscriptionRegistry.HEADERS_SUBSCRIBE, "[{\"height\":101,\"hex\":\"bb\"}]"));

        assertEquals(List.of(new BlockHeader(100, "aa"), new BlockHeader(101, "bb")), first);
        assertEquals(List.of(new BlockHeader(101, "bb")), second);
        assertEquals(2, registry.headerListenerCount());
    }

    @Test
    void malformedHeaderPushIsDropped() {
        List<BlockHeader> headers = new ArrayList<>();
        registry.subscribeToBlockHeaders(session, headers::add);

        session.onFrame(push(SubscriptionRegistry.HEADERS_SUBSCRIBE, "[\"junk\"]"));

        assertTrue(headers.isEmpty());
        assertTrue(session.isOpen());
    }

    @Test
    void resubscribeRenewsEverySubscriptionOnNewSession() {
        registry.subscribeToScripthashes(session, Map.of(SH_1, "addr-1", SH_2, "addr-2"), recordingListener());
        registry.subscribeToBlockHeaders(session, header -> { });
        Connection replacementConnection = mock(Connection.class);
        Session replacement = openSession("b.example", replacementConnection);

        registry.resubscribe(replacement);

        List<String> frames = framesSentOn(replacementConnection);
        assertEquals(3, frames.size());
        assertEquals(2, frames.stream().filter(f -> f.contains(SubscriptionRegistry.SCRIPTHASH_SUBSCRIBE)).count());
        assertEquals(1, frames.stream().filter(f -> f.contains(SubscriptionRegistry.HEADERS_SUBSCRIBE)).count());
    }

    @Test
    void resubscribeWithoutSubscriptionsSendsNothing() {
        registry.resubscribe(session);

        assertTrue(framesSentOn(connection).isEmpty());
    }
}
