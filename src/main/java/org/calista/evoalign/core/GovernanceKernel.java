package org.calista.evoalign.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.evoalign.events.CheckEvent;
import org.calista.evoalign.events.CheckEventStore;
import org.calista.evoalign.invariant.GovernanceArtifacts;
import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantChecker;
import org.calista.evoalign.invariant.InvariantReport;
import org.calista.evoalign.invariant.InvariantResult;
import org.calista.evoalign.invariant.InvariantRunner;
import org.calista.evoalign.invariant.impl.BudgetSolvencyInvariant;
import org.calista.evoalign.invariant.impl.ContextLatticeGovernanceInvariant;
import org.calista.evoalign.invariant.impl.ContextRegistryInvariant;
import org.calista.evoalign.invariant.impl.SecrecyInvariant;
import org.calista.evoalign.invariant.impl.SecretRegistryIntegrityInvariant;
import org.calista.evoalign.invariant.impl.TamperEvidenceInvariant;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.io.FileIO;
import org.calista.evoalign.secrecy.CorpusScanner;
import org.calista.evoalign.secrecy.SecrecyAudit;
import org.calista.evoalign.secrecy.key.KeyProvider;
import org.calista.evoalign.secrecy.key.impl.EnvironmentKeyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * GovernanceKernel: instance-owned runtime container for one repository.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config + wire I/O, loaders, scanner, checks
 *   2) runInvariants()   -> run every check, log results as JSONL events
 *   3) close()           -> release the owned scan pool
 *
 * No static singletons: lifecycle is explicit.
 */
public final class GovernanceKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GovernanceKernel.class);

    private final FileIO io;
    private final DataFiles data;
    private final ObjectMapper mapper;
    private final GovernanceConfig cfg;
    private final GovernanceArtifacts artifacts;
    private final CorpusScanner scanner;
    private final SecrecyAudit secrecyAudit;
    private final InvariantRunner runner;
    private final CheckEventStore events; // null when disabled
    private final Clock clock;

    private GovernanceKernel(FileIO io,
                             DataFiles data,
                             ObjectMapper mapper,
                             GovernanceConfig cfg,
                             CorpusScanner scanner,
                             SecrecyAudit secrecyAudit,
                             GovernanceArtifacts artifacts,
                             List<InvariantChecker> checkers,
                             CheckEventStore events,
                             Clock clock) {
        this.io = Objects.requireNonNull(io, "io");
        this.data = Objects.requireNonNull(data, "data");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.secrecyAudit = Objects.requireNonNull(secrecyAudit, "secrecyAudit");
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
        this.runner = new InvariantRunner(checkers);
        this.events = events; // nullable allowed
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /** Repository root: every configured path resolves against it. */
        private Path repoRoot = Path.of(".");

        private ObjectMapper mapper;
        private KeyProvider keyProvider;
        private Clock clock = Clock.systemUTC();
        private final List<InvariantChecker> extraCheckers = new ArrayList<>();

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder repoRoot(Path repoRoot) {
            this.repoRoot = Objects.requireNonNull(repoRoot, "repoRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** HMAC key source; defaults to environment variables. */
        public Builder keyProvider(KeyProvider keyProvider) {
            this.keyProvider = Objects.requireNonNull(keyProvider, "keyProvider");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Runs after the built-in checks. */
        public Builder addChecker(InvariantChecker checker) {
            this.extraCheckers.add(Objects.requireNonNull(checker, "checker"));
            return this;
        }

        /**
         * Loads/creates config and wires the kernel. Reads no governance artifact yet.
         *
         * @param configFile absolute, or relative to the repo root
         */
        public GovernanceKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : DataFiles.defaultJsonMapper();

            FileIO repo = new FileIO(repoRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : repo.baseDir().resolve(configFile);

            GovernanceConfig cfg = GovernanceConfig.loadOrCreate(repo, cfgPath, om);

            DataFiles data = new DataFiles(repo, om);

            CorpusScanner scanner = CorpusScanner.builder(data)
                    .parallelism(cfg.scan.parallelism)
                    .threadNamePrefix(cfg.scan.threadNamePrefix)
                    .shutdownTimeoutMs(cfg.scan.shutdownTimeoutMs)
                    .build();

            KeyProvider keys = (this.keyProvider != null) ? this.keyProvider : new EnvironmentKeyProvider();
            SecrecyAudit audit = new SecrecyAudit(data, scanner, keys, cfg.secrecyAuditSettings());
            GovernanceArtifacts artifacts = new GovernanceArtifacts(data, cfg);

            List<InvariantChecker> checkers = new ArrayList<>();
            checkers.add(new BudgetSolvencyInvariant(artifacts));
            checkers.add(new SecrecyInvariant(audit));
            checkers.add(new SecretRegistryIntegrityInvariant(artifacts));
            checkers.add(new TamperEvidenceInvariant(artifacts));
            checkers.add(new ContextLatticeGovernanceInvariant(artifacts));
            checkers.add(new ContextRegistryInvariant(artifacts));
            checkers.addAll(extraCheckers);

            CheckEventStore events = null;
            if (cfg.events.enabled) {
                // runtime data dir (event log) lives under baseDir
                FileIO runtime = new FileIO(repo.resolve(cfg.baseDir), FileIO.Options.builder()
                        .charset(charset)
                        .lockWrites(cfg.events.lockWrites)
                        .lockTimeout(Duration.ofMillis(cfg.events.lockTimeoutMs))
                        .fsyncOnCommit(cfg.events.fsync)
                        .build());
                events = new CheckEventStore(runtime, om, runtime.resolve(cfg.events.logFile));
            }

            GovernanceKernel k = new GovernanceKernel(repo, data, om, cfg, scanner, audit, artifacts,
                    checkers, events, clock);
            k.logCreated(cfgPath);
            return k;
        }
    }

    // ---------------------------------------------------------------------
    // Run
    // ---------------------------------------------------------------------

    /**
     * Runs every registered check. Results are appended to the event log when enabled;
     * a failing append propagates, the report itself is already complete by then.
     */
    public InvariantReport runInvariants() throws IOException {
        String runId = UUID.randomUUID().toString();
        InvariantReport report = runner.run();

        log.info("Invariant run {}: {} check(s), pass={}, fail={}, warn={}, skip={}",
                runId, report.results().size(),
                report.count(InvariantResult.PASS), report.count(InvariantResult.FAIL),
                report.count(InvariantResult.WARN), report.count(InvariantResult.SKIP));

        if (events != null) {
            for (InvariantCheck r : report.results()) {
                events.append(CheckEvent.of(runId, r, clock.millis()));
            }
            events.append(CheckEvent.run(runId, report.allPassed(),
                    report.allPassed() ? "All invariants passed" : "Invariant check failed", clock.millis()));
        }
        return report;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public DataFiles data() { return data; }
    public ObjectMapper mapper() { return mapper; }
    public GovernanceConfig config() { return cfg; }
    public GovernanceArtifacts artifacts() { return artifacts; }
    public CorpusScanner scanner() { return scanner; }
    public SecrecyAudit secrecyAudit() { return secrecyAudit; }
    public List<InvariantChecker> checkers() { return runner.checkers(); }

    /** Null when the event log is disabled. */
    public CheckEventStore eventStore() { return events; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        scanner.close();
    }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("GovernanceKernel created: config={}, repoRoot={}, checks={}, events={}",
                cfgPath, io.baseDir(), runner.checkers().size(), events != null);
    }
}
