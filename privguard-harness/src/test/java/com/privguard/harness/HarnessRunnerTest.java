package com.privguard.harness;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.privguard.harness.report.ReportWriter;
import com.privguard.harness.support.FakePaladinNetwork;
import com.privguard.harness.support.HarnessFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the run pipeline and its exit codes.
 */
class HarnessRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void execute_cleanRunExitsZeroAndWritesReport() throws Exception {
        // Given
        HarnessFixture fixture = fixture(new FakePaladinNetwork("node1", "node2"));
        Path report = tempDir.resolve("reports/privguard-report.json");
        fixture.harness.setReportPath(report.toString());
        HarnessRunner runner = fixture.runner(new ReportWriter());

        // When
        int exitCode = runner.execute();

        // Then
        assertThat(exitCode).isEqualTo(HarnessRunner.EXIT_CLEAN);
        assertThat(report).exists();
        JsonNode json = new ObjectMapper().readTree(Files.readString(report));
        assertThat(json.get("clean").asBoolean()).isTrue();
        assertThat(json.get("testCases").size()).isEqualTo(6);
        assertThat(runner.getLastReport().runId()).isEqualTo("nightly");
    }

    @Test
    void execute_breachExitsOne() {
        // Given
        HarnessFixture fixture = fixture(new FakePaladinNetwork("node1", "node2").leakToNonMembers());
        fixture.harness.setReportPath(tempDir.resolve("report.json").toString());

        // When
        int exitCode = fixture.runner(new ReportWriter()).execute();

        // Then
        assertThat(exitCode).isEqualTo(HarnessRunner.EXIT_NOT_CLEAN);
    }

    @Test
    void execute_resolutionFailureExitsTwoBeforeCreatingGroups() {
        // Given
        FakePaladinNetwork network = new FakePaladinNetwork("node1", "node2").unknownIdentity("bob@node2");
        HarnessFixture fixture = fixture(network);
        fixture.harness.setReportPath(tempDir.resolve("report.json").toString());

        // When
        int exitCode = fixture.runner(new ReportWriter()).execute();

        // Then
        assertThat(exitCode).isEqualTo(HarnessRunner.EXIT_SETUP_FAILED);
        assertThat(network.groupCount()).isZero();
        assertThat(tempDir.resolve("report.json")).doesNotExist();
    }

    @Test
    void execute_inconclusiveReadExitsOne() throws Exception {
        // Given
        HarnessFixture fixture = fixture(new FakePaladinNetwork("node1", "node2").faultyReadsFor("bob@node2"));
        Path report = tempDir.resolve("report.json");
        fixture.harness.setReportPath(report.toString());
        HarnessRunner runner = fixture.runner(new ReportWriter());

        // When
        int exitCode = runner.execute();

        // Then
        assertThat(exitCode).isEqualTo(HarnessRunner.EXIT_NOT_CLEAN);
        assertThat(runner.getLastReport().breaches()).isEmpty();
        assertThat(runner.getLastReport().inconclusive()).hasSize(1);
        JsonNode json = new ObjectMapper().readTree(Files.readString(report));
        assertThat(json.get("clean").asBoolean()).isFalse();
        assertThat(json.get("totals").get("INCONCLUSIVE").asInt()).isEqualTo(1);
    }

    @Test
    void execute_groupNamingUnknownIdentityExitsTwo() {
        // Given
        FakePaladinNetwork network = new FakePaladinNetwork("node1", "node2");
        HarnessFixture fixture = fixture(network).group("audit", "alice", "mallory");
        fixture.harness.setReportPath(tempDir.resolve("report.json").toString());

        // When
        int exitCode = fixture.runner(new ReportWriter()).execute();

        // Then
        assertThat(exitCode).isEqualTo(HarnessRunner.EXIT_SETUP_FAILED);
        assertThat(network.groupCount()).isZero();
        assertThat(tempDir.resolve("report.json")).doesNotExist();
    }

    @Test
    void execute_duplicateGroupNamesExitTwo() {
        // Given
        FakePaladinNetwork network = new FakePaladinNetwork("node1", "node2");
        HarnessFixture fixture = fixture(network).group("lending", "alice");
        fixture.harness.setReportPath(tempDir.resolve("report.json").toString());

        // When
        int exitCode = fixture.runner(new ReportWriter()).execute();

        // Then
        assertThat(exitCode).isEqualTo(HarnessRunner.EXIT_SETUP_FAILED);
        assertThat(network.groupCount()).isZero();
    }

    @Test
    void run_disabledHarnessDoesNothing() {
        // Given
        FakePaladinNetwork network = new FakePaladinNetwork("node1", "node2");
        HarnessFixture fixture = fixture(network);
        fixture.harness.setEnabled(false);
        HarnessRunner runner = fixture.runner(new ReportWriter());

        // When
        runner.run();

        // Then
        assertThat(runner.getExitCode()).isEqualTo(HarnessRunner.EXIT_CLEAN);
        assertThat(network.calls()).isEmpty();
    }

    private static HarnessFixture fixture(FakePaladinNetwork network) {
        HarnessFixture fixture = new HarnessFixture(network, "node1", "node2")
                .identity("alice", "node1")
                .identity("bob", "node2")
                .identity("zed", "node2")
                .group("lending", "alice", "bob");
        fixture.harness.setRunId("nightly");
        return fixture;
    }
}
