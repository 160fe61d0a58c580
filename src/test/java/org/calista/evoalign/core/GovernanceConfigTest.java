package org.calista.evoalign.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.io.FileIO;
import org.calista.evoalign.secrecy.CorpusScanner;
import org.calista.evoalign.secrecy.SecrecyAudit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GovernanceConfigTest {

    private final ObjectMapper om = DataFiles.defaultJsonMapper();

    @Test
    void missingFileIsCreatedWithDefaults(@TempDir Path root) throws Exception {
        FileIO io = new FileIO(root);
        Path file = root.resolve("config/evoalign.json");

        GovernanceConfig cfg = GovernanceConfig.loadOrCreate(io, file, om);

        assertTrue(Files.exists(file));
        assertEquals("contracts/context_lattice", cfg.lattice.dir);
        assertEquals(CorpusScanner.DEFAULT_PROTECTED_PATHS, cfg.secrecy.protectedPaths);
        assertTrue(cfg.events.enabled);

        GovernanceConfig again = GovernanceConfig.loadOrCreate(io, file, om);
        assertEquals(cfg.secrecy.secretHashRegistry, again.secrecy.secretHashRegistry);
        assertEquals(cfg.scan.parallelism, again.scan.parallelism);
    }

    @Test
    void blankFileIsRecreated(@TempDir Path root) throws Exception {
        FileIO io = new FileIO(root);
        Path file = root.resolve("evoalign.json");
        Files.writeString(file, "  \n");

        GovernanceConfig cfg = GovernanceConfig.loadOrCreate(io, file, om);

        assertEquals(".evoalign", cfg.baseDir);
        assertFalse(Files.readString(file).isBlank());
    }

    @Test
    void partialFileIsNormalized(@TempDir Path root) throws Exception {
        FileIO io = new FileIO(root);
        Path file = root.resolve("evoalign.json");
        Files.writeString(file, "{\"baseDir\":\"\",\"lattice\":{\"dir\":\"lattice\",\"schema\":\" \"},"
                + "\"secrecy\":{\"protectedPaths\":[\"corpus/\",\"\"],\"supportedSchemes\":[]},"
                + "\"scan\":{\"parallelism\":-3,\"shutdownTimeoutMs\":1},"
                + "\"events\":null,\"unknown\":true}");

        GovernanceConfig cfg = GovernanceConfig.loadOrCreate(io, file, om);

        assertEquals(".evoalign", cfg.baseDir);
        assertEquals("lattice", cfg.lattice.dir);
        assertNull(cfg.lattice.schema);
        assertEquals(List.of("corpus/"), cfg.secrecy.protectedPaths);
        assertEquals(List.of("sha256-v1", "hmac-sha256-v1"), cfg.secrecy.supportedSchemes);
        assertEquals(0, cfg.scan.parallelism);
        assertEquals(250, cfg.scan.shutdownTimeoutMs);
        assertNotNull(cfg.events);
        assertEquals("invariant-events.jsonl", cfg.events.logFile);
        assertEquals("contracts/safety_contracts", cfg.governor.safetyContracts);
        assertEquals(GovernanceConfig.DEFAULT_REFERENCE_PATHS, cfg.lattice.referencePaths);
        assertTrue(cfg.events.lockWrites);
        assertEquals(3000, cfg.events.lockTimeoutMs);
    }

    @Test
    void auditSettingsFollowSecrecySection() {
        GovernanceConfig cfg = new GovernanceConfig();
        cfg.secrecy.protectedPaths = List.of("corpus/");
        cfg.secrecy.defaultKeyName = "MY_KEY";
        cfg.validate();

        SecrecyAudit.Settings s = cfg.secrecyAuditSettings();

        assertEquals(List.of("corpus/"), s.protectedPaths);
        assertEquals("MY_KEY", s.defaultKeyName);
        assertEquals(cfg.secrecy.suiteRegistry, s.suiteRegistry);
    }
}
