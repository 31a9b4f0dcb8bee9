package com.privguard.harness.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.privguard.core.domain.ActualOutcome;
import com.privguard.core.domain.Classification;
import com.privguard.core.domain.TestCase;
import com.privguard.core.report.ExcludedGroup;
import com.privguard.core.report.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the run report as JSON and logs a summary that names every breach and inconclusive case.
 */
@Component
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper;

    public ReportWriter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public Path write(VerificationReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(report));
        log.info("Report for run {} written to {}", report.runId(), target.toAbsolutePath());
        return target;
    }

    public String toJson(VerificationReport report) throws JsonProcessingException {
        return objectMapper.writeValueAsString(ReportView.of(report));
    }

    /**
     * Logs totals, then each breach at ERROR and each inconclusive case, unverified group and excluded
     * group at WARN.
     */
    public void logSummary(VerificationReport report) {
        log.info("Run {}: {} test cases, {} BREACH, {} INCONCLUSIVE, {} UNEXPECTED_DENIAL, {} PASS, {} excluded groups",
                report.runId(),
                report.testCases().size(),
                report.count(Classification.BREACH),
                report.count(Classification.INCONCLUSIVE),
                report.count(Classification.UNEXPECTED_DENIAL),
                report.count(Classification.PASS),
                report.excludedGroups().size());
        for (TestCase breach : report.breaches()) {
            log.error("BREACH {}: expected {}, got {} {}",
                    breach.label(), breach.expected(), breach.actual().describe(), breach.findings());
        }
        for (TestCase inconclusive : report.inconclusive()) {
            log.warn("INCONCLUSIVE {}: expected {}, got {} {}",
                    inconclusive.label(), inconclusive.expected(), inconclusive.actual().describe(),
                    inconclusive.findings());
        }
        for (TestCase denial : report.unexpectedDenials()) {
            log.warn("UNEXPECTED_DENIAL {}: {}", denial.label(), denial.actual().describe());
        }
        for (VerificationReport.GroupSummary group : report.unverifiedGroups()) {
            log.warn("UNVERIFIED {}: sentinel write did not commit, member reads were not checked against a written value",
                    group.groupName());
        }
        for (ExcludedGroup group : report.excludedGroups()) {
            log.warn("EXCLUDED {} ({}): {}", group.groupName(), group.reason(), group.detail());
        }
        if (report.isClean()) {
            log.info("Run {} is clean", report.runId());
        } else {
            log.error("Run {} is NOT clean", report.runId());
        }
    }

    // ==================== JSON views ====================

    record ReportView(
            String runId,
            Instant startedAt,
            Instant finishedAt,
            boolean clean,
            Map<String, Integer> totals,
            List<GroupView> groups,
            List<ExcludedView> excludedGroups,
            List<TestCaseView> testCases
    ) {
        static ReportView of(VerificationReport report) {
            return new ReportView(
                    report.runId(),
                    report.startedAt(),
                    report.finishedAt(),
                    report.isClean(),
                    ordered(report.totals()),
                    report.groups().stream().map(GroupView::of).toList(),
                    report.excludedGroups().stream().map(ExcludedView::of).toList(),
                    report.testCases().stream().map(TestCaseView::of).toList());
        }
    }

    record GroupView(String groupId, String groupName, int total, boolean clean, boolean sentinelEstablished,
                     Map<String, Integer> counts) {
        static GroupView of(VerificationReport.GroupSummary summary) {
            return new GroupView(summary.groupId(), summary.groupName(), summary.total(),
                    summary.isClean(), summary.sentinelEstablished(), ordered(summary.counts()));
        }
    }

    record ExcludedView(String groupName, String groupId, List<String> members, String reason, String detail) {
        static ExcludedView of(ExcludedGroup group) {
            return new ExcludedView(group.groupName(), group.groupId(), group.members(),
                    group.reason().name(), group.detail());
        }
    }

    record TestCaseView(
            String group,
            String groupId,
            String identity,
            String operation,
            String expected,
            String actual,
            String value,
            String detail,
            String classification,
            List<String> findings
    ) {
        static TestCaseView of(TestCase testCase) {
            ActualOutcome actual = testCase.actual();
            String kind;
            String value = null;
            String detail = null;
            if (actual instanceof ActualOutcome.Success success) {
                kind = "SUCCESS";
                value = success.hasValue() ? success.value().toString() : null;
            } else if (actual instanceof ActualOutcome.Denied denied) {
                kind = "DENIED";
                detail = denied.reason();
            } else {
                kind = "TRANSPORT_ERROR";
                detail = ((ActualOutcome.TransportError) actual).reason();
            }
            return new TestCaseView(testCase.groupName(), testCase.groupId(), testCase.identityName(),
                    testCase.operation().name(), testCase.expected().name(), kind, value, detail,
                    testCase.classification().name(), testCase.findings());
        }
    }

    private static Map<String, Integer> ordered(Map<Classification, Integer> counts) {
        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (Classification classification : Classification.values()) {
            ordered.put(classification.name(), counts.getOrDefault(classification, 0));
        }
        return ordered;
    }
}
