package com.privguard.core.report;

import com.privguard.core.domain.Classification;
import com.privguard.core.domain.TestCase;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one verification run.
 *
 * <p>Test cases are ordered breaches first. Every breach and every inconclusive case is
 * listed individually; a run is only clean when there are none of either and no group worker
 * was aborted.</p>
 */
public record VerificationReport(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        List<TestCase> testCases,
        List<GroupSummary> groups,
        List<ExcludedGroup> excludedGroups,
        Map<Classification, Integer> totals
) {
    private static final Comparator<TestCase> REPORT_ORDER = Comparator
            .comparing(TestCase::classification)
            .thenComparing(TestCase::groupName, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(TestCase::identityName)
            .thenComparing(TestCase::operation);

    public VerificationReport {
        Objects.requireNonNull(runId, "Run ID cannot be null");
        testCases = List.copyOf(testCases);
        groups = List.copyOf(groups);
        excludedGroups = List.copyOf(excludedGroups);
        totals = Map.copyOf(totals);
    }

    public static VerificationReport of(String runId, Instant startedAt, Instant finishedAt,
                                        List<TestCase> cases, List<ExcludedGroup> excluded) {
        List<TestCase> ordered = new ArrayList<>(cases);
        ordered.sort(REPORT_ORDER);

        Map<String, List<TestCase>> byGroup = new LinkedHashMap<>();
        for (TestCase testCase : ordered) {
            byGroup.computeIfAbsent(testCase.groupId(), k -> new ArrayList<>()).add(testCase);
        }
        List<GroupSummary> summaries = new ArrayList<>();
        byGroup.forEach((groupId, groupCases) -> summaries.add(GroupSummary.of(groupId, groupCases)));
        summaries.sort(Comparator.comparing(GroupSummary::groupName, Comparator.nullsLast(Comparator.naturalOrder())));

        return new VerificationReport(runId, startedAt, finishedAt, ordered, summaries, excluded, count(ordered));
    }

    public boolean isClean() {
        return count(Classification.BREACH) == 0
                && count(Classification.INCONCLUSIVE) == 0
                && excludedGroups.stream().noneMatch(group -> group.reason() == ExcludedGroup.Reason.ABORTED);
    }

    public int count(Classification classification) {
        return totals.getOrDefault(classification, 0);
    }

    public List<TestCase> breaches() {
        return filter(Classification.BREACH);
    }

    public List<TestCase> inconclusive() {
        return filter(Classification.INCONCLUSIVE);
    }

    public List<TestCase> unexpectedDenials() {
        return filter(Classification.UNEXPECTED_DENIAL);
    }

    /**
     * Groups whose sentinel never committed, so no member read there was checked against a
     * written value. These do not make a run unclean on their own.
     */
    public List<GroupSummary> unverifiedGroups() {
        return groups.stream().filter(group -> !group.sentinelEstablished()).toList();
    }

    private List<TestCase> filter(Classification classification) {
        return testCases.stream()
                .filter(testCase -> testCase.classification() == classification)
                .toList();
    }

    private static Map<Classification, Integer> count(List<TestCase> cases) {
        Map<Classification, Integer> counts = new EnumMap<>(Classification.class);
        for (Classification classification : Classification.values()) {
            counts.put(classification, 0);
        }
        for (TestCase testCase : cases) {
            counts.merge(testCase.classification(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Per-group counts.
     */
    public record GroupSummary(String groupId, String groupName, int total, Map<Classification, Integer> counts,
                               boolean sentinelEstablished) {

        public GroupSummary {
            counts = Map.copyOf(counts);
        }

        static GroupSummary of(String groupId, List<TestCase> cases) {
            boolean established = cases.stream()
                    .noneMatch(testCase -> testCase.findings().contains(BreachDetector.SENTINEL_NOT_COMMITTED));
            return new GroupSummary(groupId, cases.get(0).groupName(), cases.size(), count(cases), established);
        }

        public boolean isClean() {
            return counts.getOrDefault(Classification.BREACH, 0) == 0
                    && counts.getOrDefault(Classification.INCONCLUSIVE, 0) == 0;
        }
    }
}
