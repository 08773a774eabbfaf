// SPDX-License-Identifier: MIT OR Apache-2.0
package io.electra.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;
import java.util.Set;

import io.electra.core.error.NoServersAvailableException;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

class ServerRegistryTest {

    private static final List<ServerDescriptor> SERVERS = List.of(
            ServerDescriptor.tls("a.example", 50002),
            new ServerDescriptor("b.example", 50001, 50002, true),
            ServerDescriptor.plain("c.example", 50001),
            new ServerDescriptor("d.example", 50001, 50002, false));

    @Test
    void unusableServersAreNeverRegistered() {
        ServerRegistry registry = new ServerRegistry(SERVERS, true);

        assertEquals(Set.of("a.example", "b.example", "c.example"), registry.hosts());
    }

    @RepeatedTest(20)
    void neverPicksAnExcludedHost() {
        ServerRegistry registry = new ServerRegistry(SERVERS, true, new Random());

        ServerDescriptor picked = registry.pickRandom(Set.of("a.example"));

        assertEquals("b.example", picked.host());
    }

    @Test
    void serverWithoutPortForTheModeIsRemovedWhenPicked() {
        ServerRegistry registry = new ServerRegistry(
                List.of(ServerDescriptor.plain("c.example", 50001), ServerDescriptor.tls("a.example", 50002)),
                true,
                new FirstCandidateRandom());

        ServerDescriptor picked = registry.pickRandom(Set.of());

        assertEquals("a.example", picked.host());
        assertFalse(registry.hosts().contains("c.example"));
        assertEquals(1, registry.size());
    }

    @Test
    void plaintextModeUsesTcpPorts() {
        ServerRegistry registry = new ServerRegistry(SERVERS, false, new FirstCandidateRandom());

        ServerDescriptor picked = registry.pickRandom(Set.of("b.example"));

        // a.example has no TCP port and is dropped on the way
        assertEquals("c.example", picked.host());
        assertEquals(50001, picked.port(false));
        assertEquals(Set.of("b.example", "c.example"), registry.hosts());
    }

    @Test
    void allExcludedThrows() {
        ServerRegistry registry = new ServerRegistry(SERVERS, true);

        NoServersAvailableException ex = assertThrows(NoServersAvailableException.class,
                () -> registry.pickRandom(Set.of("a.example", "b.example", "c.example")));
        assertTrue(ex.getMessage().contains("excluded"));
        assertEquals(3, registry.size());
    }

    @Test
    void emptyRegistryThrows() {
        ServerRegistry registry = new ServerRegistry(List.of(), true);

        assertThrows(NoServersAvailableException.class, () -> registry.pickRandom(Set.of()));
    }

    @Test
    void registryWithOnlyPortlessServersEndsUpEmpty() {
        ServerRegistry registry = new ServerRegistry(
                List.of(ServerDescriptor.plain("c.example", 50001), ServerDescriptor.plain("e.example", 50001)),
                true);

        assertThrows(NoServersAvailableException.class, () -> registry.pickRandom(Set.of()));
        assertEquals(0, registry.size());
    }

    @Test
    void removeForgetsHost() {
        ServerRegistry registry = new ServerRegistry(SERVERS, true);

        assertTrue(registry.remove("a.example"));
        assertFalse(registry.remove("a.example"));
        assertEquals(2, registry.size());
    }
}
