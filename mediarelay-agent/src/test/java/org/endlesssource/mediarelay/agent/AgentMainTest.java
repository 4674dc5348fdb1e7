package org.endlesssource.mediarelay.agent;

import org.endlesssource.mediarelay.agent.store.FileCredentialStore;
import org.endlesssource.mediarelay.agent.store.TrustMaterial;
import org.endlesssource.mediarelay.spi.AgentControl;
import org.endlesssource.mediarelay.spi.PairingEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentMainTest {

    @TempDir
    Path dir;

    private final InProcessControlService control = new InProcessControlService();
    private final List<String> agentCalls = new ArrayList<>();

    private void pair(String identity) {
        try (FileCredentialStore store = FileCredentialStore.open(dir)) {
            store.put(identity, new TrustMaterial(new byte[32], "client " + identity, new byte[32]));
        }
    }

    private int run(String... args) {
        AgentMain main = new AgentMain();
        main.controlService = control;
        return new CommandLine(main).execute(args);
    }

    /**
     * Publishes a stand-in agent that knows one client, {@code aaaa}.
     */
    private void runAgent() throws Exception {
        control.export(new AgentControl() {
            @Override
            public String ping() {
                agentCalls.add("ping");
                return "running";
            }

            @Override
            public List<PairingEntry> listPairings() {
                agentCalls.add("list");
                return List.of(new PairingEntry("aaaa", "phone", Instant.parse("2024-05-01T10:15:30Z")));
            }

            @Override
            public boolean revokePairing(String identity) {
                agentCalls.add("revoke " + identity);
                return identity.equals("aaaa");
            }

            @Override
            public int resetPairings() {
                agentCalls.add("reset");
                return 1;
            }

            @Override
            public void quit() {
                agentCalls.add("quit");
            }
        });
    }

    @Test
    void revoke_removesOnlyThatClient() {
        pair("aaaa");
        pair("bbbb");

        assertEquals(0, run("--state-dir", dir.toString(), "pairings", "revoke", "aaaa"));
        assertEquals(1, run("--state-dir", dir.toString(), "pairings", "revoke", "aaaa"));

        try (FileCredentialStore store = FileCredentialStore.open(dir)) {
            assertTrue(store.get("aaaa").isEmpty());
            assertTrue(store.get("bbbb").isPresent());
        }
    }

    @Test
    void reset_removesEveryClient() {
        pair("aaaa");
        pair("bbbb");

        assertEquals(0, run("--state-dir", dir.toString(), "pairings", "list"));
        assertEquals(0, run("--state-dir", dir.toString(), "pairings", "reset"));

        try (FileCredentialStore store = FileCredentialStore.open(dir)) {
            assertTrue(store.list().isEmpty());
        }
    }

    @Test
    void pairingCommands_goThroughRunningAgent() throws Exception {
        pair("bbbb");
        runAgent();

        assertEquals(0, run("--state-dir", dir.toString(), "pairings", "list"));
        assertEquals(0, run("--state-dir", dir.toString(), "pairings", "revoke", "aaaa"));
        assertEquals(1, run("--state-dir", dir.toString(), "pairings", "revoke", "bbbb"));
        assertEquals(0, run("--state-dir", dir.toString(), "pairings", "reset"));

        assertEquals(List.of("list", "revoke aaaa", "revoke bbbb", "reset"), agentCalls);
        try (FileCredentialStore store = FileCredentialStore.open(dir)) {
            assertTrue(store.get("bbbb").isPresent());
        }
    }

    @Test
    void pairingCommands_workWhileAgentHoldsTheStore() throws Exception {
        runAgent();

        try (FileCredentialStore held = FileCredentialStore.open(dir)) {
            assertEquals(0, run("--state-dir", dir.toString(), "pairings", "revoke", "aaaa"));
        }
        assertEquals(List.of("revoke aaaa"), agentCalls);
    }

    @Test
    void statusAndStop_needARunningAgent() throws Exception {
        assertEquals(1, run("status"));
        assertEquals(1, run("stop"));

        runAgent();

        assertEquals(0, run("status"));
        assertEquals(0, run("stop"));
        assertEquals(List.of("ping", "quit"), agentCalls);
    }

    @Test
    void check_findsABus() {
        // the in-memory provider is always registered on the test classpath
        assertEquals(0, run("check"));
    }

    @Test
    void options_areMappedOntoAgentOptions() {
        AgentMain main = new AgentMain();
        new CommandLine(main).parseArgs("--state-dir", dir.toString(), "--relay-port", "7001",
                "--pairing-port", "7002", "--sas-digits", "8", "--pairing-timeout", "30", "--bind", "127.0.0.1");

        AgentOptions options = main.options();

        assertEquals(7001, options.getRelayPort());
        assertEquals(7002, options.getPairingPort());
        assertEquals(8, options.getSasDigits());
        assertEquals(Duration.ofSeconds(30), options.getPairingTimeout());
        assertEquals("127.0.0.1", options.getBindAddress());
        assertEquals(dir, options.getStateDirectory());
        assertTrue(options.isAdvertise());
    }

    @Test
    void noAdvertise_turnsAnnouncementOff() {
        AgentMain main = new AgentMain();
        new CommandLine(main).parseArgs("--no-advertise");

        assertFalse(main.options().isAdvertise());
    }
}
