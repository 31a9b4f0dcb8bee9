package com.privguard.harness;

import com.privguard.blockchain.identity.IdentityRegistry;
import com.privguard.blockchain.identity.IdentityRegistry.ResolutionException;
import com.privguard.blockchain.topology.NodeTopology;
import com.privguard.core.domain.Identity;
import com.privguard.core.domain.Node;
import com.privguard.core.report.VerificationReport;
import com.privguard.harness.config.HarnessConfig;
import com.privguard.harness.orchestrator.TestOrchestrator;
import com.privguard.harness.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Probes the topology, resolves identities, runs the matrix and writes the report.
 */
@Component
public class HarnessRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(HarnessRunner.class);
    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_NOT_CLEAN = 1;
    public static final int EXIT_SETUP_FAILED = 2;

    private final NodeTopology topology;
    private final IdentityRegistry registry;
    private final TestOrchestrator orchestrator;
    private final ReportWriter reportWriter;
    private final HarnessConfig config;
    private volatile int exitCode = EXIT_CLEAN;
    private volatile VerificationReport lastReport;

    public HarnessRunner(NodeTopology topology, IdentityRegistry registry, TestOrchestrator orchestrator,
                         ReportWriter reportWriter, HarnessConfig config) {
        this.topology = topology;
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.reportWriter = reportWriter;
        this.config = config;
    }

    @Override
    public void run(String... args) {
        if (!config.isEnabled()) {
            log.info("Harness disabled, nothing to verify");
            return;
        }
        exitCode = execute();
    }

    /**
     * Runs one verification and returns its exit code.
     */
    public int execute() {
        List<Node> nodes = topology.initialize();
        log.info("Topology: {}", nodes);

        List<Identity> universe;
        try {
            universe = registry.resolveAll(config.identityDefinitions());
        } catch (ResolutionException e) {
            log.error("Identity resolution failed, aborting run: {}", e.getMessage());
            return EXIT_SETUP_FAILED;
        } catch (IllegalArgumentException e) {
            log.error("Invalid identity configuration, aborting run: {}", e.getMessage());
            return EXIT_SETUP_FAILED;
        }
        if (!registry.stranded().isEmpty()) {
            log.warn("Stranded identities: {}", registry.stranded());
        }

        VerificationReport report;
        try {
            report = orchestrator.run(config.groupDefinitions(), universe);
        } catch (IllegalArgumentException e) {
            log.error("Invalid group configuration, aborting run: {}", e.getMessage());
            return EXIT_SETUP_FAILED;
        }
        lastReport = report;
        reportWriter.logSummary(report);
        try {
            reportWriter.write(report, Path.of(config.getReportPath()));
        } catch (IOException e) {
            log.error("Cannot write report to {}", config.getReportPath(), e);
            return EXIT_SETUP_FAILED;
        }
        return report.isClean() ? EXIT_CLEAN : EXIT_NOT_CLEAN;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public VerificationReport getLastReport() {
        return lastReport;
    }
}
