package org.calista.evoalign.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.evoalign.io.FileIO;
import org.calista.evoalign.secrecy.CorpusScanner;
import org.calista.evoalign.secrecy.SecrecyAudit;
import org.calista.evoalign.secrecy.SecrecyFingerprinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * GovernanceConfig: простой POJO конфиг:
 * - дефолты в полях (раскладка репозитория по умолчанию)
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 *
 * Все пути относительны корню репозитория.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GovernanceConfig {

    private static final Logger log = LoggerFactory.getLogger(GovernanceConfig.class);

    /** Runtime data dir (check-run event log), relative to repo root. */
    public String baseDir = ".evoalign";
    public Lattice lattice = new Lattice();
    public Secrecy secrecy = new Secrecy();
    public Scan scan = new Scan();
    public Governor governor = new Governor();
    public Provenance provenance = new Provenance();
    public Events events = new Events();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Lattice {
        public String dir = "contracts/context_lattice";
        /** Blank => lattice loaded without schema validation. */
        public String schema = "schemas/ContextLattice.schema.json";

        /** Trees scanned for {@code context_class} references to the lattice registry. */
        public List<String> referencePaths = new ArrayList<>(DEFAULT_REFERENCE_PATHS);
    }

    public static final List<String> DEFAULT_REFERENCE_PATHS = List.of(
            "contracts/safety_contracts",
            "control_plane/governor/risk_fits",
            "control_plane/governor/oversight_plans",
            "control_plane/governor/sweeps",
            "deployments",
            "aars");

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Secrecy {
        public String suiteRegistry = "control_plane/evals/suites/registry.json";
        public String secretHashRegistry = "control_plane/evals/suites/hash_registries/secret_suite_hashes_v1.json";
        public List<String> protectedPaths = new ArrayList<>(CorpusScanner.DEFAULT_PROTECTED_PATHS);
        public String defaultKeyName = SecrecyFingerprinter.DEFAULT_KEY_NAME;
        public List<String> supportedSchemes = new ArrayList<>(List.of("sha256-v1", "hmac-sha256-v1"));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Scan {
        /** 1 => sequential, 0 => auto (one worker per CPU). */
        public int parallelism = 1;

        /** Thread name prefix for observability. */
        public String threadNamePrefix = "corpus-scan-";

        /** Shutdown timeout for the owned pool on close. */
        public long shutdownTimeoutMs = 2500;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Governor {
        public String safetyContracts = "contracts/safety_contracts";
        public String riskFits = "control_plane/governor/risk_fits";
        public String oversightPlans = "control_plane/governor/oversight_plans";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Provenance {
        public String aars = "aars";
        public String lineage = "lineage";
        public String keys = "control_plane/keys";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public boolean enabled = true;
        public String logFile = "invariant-events.jsonl";

        /** File lock around appends; several CI jobs may share one log. */
        public boolean lockWrites = true;
        public long lockTimeoutMs = 3000;
        public boolean fsync = false;
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static GovernanceConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            GovernanceConfig created = new GovernanceConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            GovernanceConfig created = new GovernanceConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        GovernanceConfig cfg = mapper.readValue(json, GovernanceConfig.class);
        if (cfg == null) cfg = new GovernanceConfig();

        cfg.validate();
        return cfg;
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, GovernanceConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    /** Audit locations derived from the secrecy section. */
    public SecrecyAudit.Settings secrecyAuditSettings() {
        SecrecyAudit.Settings s = new SecrecyAudit.Settings();
        s.suiteRegistry = secrecy.suiteRegistry;
        s.secretHashRegistry = secrecy.secretHashRegistry;
        s.protectedPaths = List.copyOf(secrecy.protectedPaths);
        s.defaultKeyName = secrecy.defaultKeyName;
        return s;
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = ".evoalign";

        if (lattice == null) lattice = new Lattice();
        if (lattice.dir == null || lattice.dir.isBlank()) lattice.dir = "contracts/context_lattice";
        if (lattice.schema != null && lattice.schema.isBlank()) lattice.schema = null;
        if (lattice.referencePaths == null) lattice.referencePaths = new ArrayList<>(DEFAULT_REFERENCE_PATHS);
        lattice.referencePaths = new ArrayList<>(lattice.referencePaths);
        lattice.referencePaths.removeIf(p -> p == null || p.isBlank());

        if (secrecy == null) secrecy = new Secrecy();
        if (secrecy.suiteRegistry == null || secrecy.suiteRegistry.isBlank())
            secrecy.suiteRegistry = "control_plane/evals/suites/registry.json";
        if (secrecy.secretHashRegistry == null || secrecy.secretHashRegistry.isBlank())
            secrecy.secretHashRegistry = "control_plane/evals/suites/hash_registries/secret_suite_hashes_v1.json";
        if (secrecy.protectedPaths == null) secrecy.protectedPaths = new ArrayList<>(CorpusScanner.DEFAULT_PROTECTED_PATHS);
        secrecy.protectedPaths = new ArrayList<>(secrecy.protectedPaths);
        secrecy.protectedPaths.removeIf(p -> p == null || p.isBlank());
        if (secrecy.defaultKeyName == null || secrecy.defaultKeyName.isBlank())
            secrecy.defaultKeyName = SecrecyFingerprinter.DEFAULT_KEY_NAME;
        if (secrecy.supportedSchemes == null || secrecy.supportedSchemes.isEmpty())
            secrecy.supportedSchemes = new ArrayList<>(List.of("sha256-v1", "hmac-sha256-v1"));

        if (scan == null) scan = new Scan();
        if (scan.parallelism < 0) scan.parallelism = 0;
        if (scan.threadNamePrefix == null || scan.threadNamePrefix.isBlank()) scan.threadNamePrefix = "corpus-scan-";
        if (scan.shutdownTimeoutMs < 250) scan.shutdownTimeoutMs = 250;

        if (governor == null) governor = new Governor();
        if (governor.safetyContracts == null || governor.safetyContracts.isBlank())
            governor.safetyContracts = "contracts/safety_contracts";
        if (governor.riskFits == null || governor.riskFits.isBlank())
            governor.riskFits = "control_plane/governor/risk_fits";
        if (governor.oversightPlans == null || governor.oversightPlans.isBlank())
            governor.oversightPlans = "control_plane/governor/oversight_plans";

        if (provenance == null) provenance = new Provenance();
        if (provenance.aars == null || provenance.aars.isBlank()) provenance.aars = "aars";
        if (provenance.lineage == null || provenance.lineage.isBlank()) provenance.lineage = "lineage";
        if (provenance.keys == null || provenance.keys.isBlank()) provenance.keys = "control_plane/keys";

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "invariant-events.jsonl";
        if (events.lockTimeoutMs < 100) events.lockTimeoutMs = 100;
    }
}
