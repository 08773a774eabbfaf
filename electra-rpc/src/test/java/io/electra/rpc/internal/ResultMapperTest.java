// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc.internal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import io.electra.core.error.ElectraException;
import io.electra.core.model.HistoryEntry;
import io.electra.core.model.PeerServer;
import io.electra.core.model.ServerVersion;
import io.electra.core.model.UnspentOutput;
import org.junit.jupiter.api.Test;

class ResultMapperTest {

    @Test
    void mapsServerVersion() {
        assertEquals(new ServerVersion("ElectrumX 1.16.0", "1.4"),
                ResultMapper.toServerVersion(List.of("ElectrumX 1.16.0", "1.4")));
    }

    @Test
    void mapsUnspentOutputs() {
        List<UnspentOutput> outputs = ResultMapper.toUnspent("addr",
                List.of(Map.of("tx_hash", "aa", "tx_pos", 1, "height", 0, "value", 5000)));

        assertEquals(List.of(new UnspentOutput("addr", "aa", 1, 0, 5000)), outputs);
        assertFalse(outputs.get(0).isConfirmed());
    }

    @Test
    void mempoolEntriesCarryFee() {
        List<HistoryEntry> entries = ResultMapper.toHistory("addr",
                List.of(Map.of("tx_hash", "aa", "height", -1, "fee", 300), Map.of("tx_hash", "bb", "height", 12)),
                "blockchain.scripthash.get_history");

        assertEquals(300L, entries.get(0).fee());
        assertTrue(entries.get(0).isMempool());
        assertNull(entries.get(1).fee());
    }

    @Test
    void mapsPeers() {
        List<PeerServer> peers = ResultMapper.toPeers(
                List.of(List.of("1.2.3.4", "e.example", List.of("v1.4", "s50002"))));

        assertEquals(List.of(new PeerServer("1.2.3.4", "e.example", List.of("v1.4", "s50002"))), peers);
    }

    @Test
    void integersBecomeDecimals() {
        assertEquals(new BigDecimal("-1"), ResultMapper.toDecimal(-1, "blockchain.estimatefee"));
    }

    @Test
    void unexpectedShapesNameTheMethod() {
        ElectraException ex = assertThrows(ElectraException.class,
                () -> ResultMapper.toDecimal("cheap", "blockchain.relayfee"));
        assertTrue(ex.getMessage().contains("blockchain.relayfee"));
        assertThrows(ElectraException.class, () -> ResultMapper.toBalance("addr", Map.of("confirmed", "x")));
        assertThrows(ElectraException.class, () -> ResultMapper.toServerVersion(List.of("only-one")));
        assertThrows(ElectraException.class, () -> ResultMapper.toBlockHeader(null));
    }
}
