package com.privguard.harness.orchestrator;

import com.privguard.blockchain.contract.ContractInvocationProxy;
import com.privguard.blockchain.group.PrivacyGroupManager;
import com.privguard.blockchain.group.PrivacyGroupManager.ConfirmationTimeoutException;
import com.privguard.blockchain.group.PrivacyGroupManager.GroupCreationException;
import com.privguard.blockchain.group.PrivacyGroupManager.ProbeDeploymentException;
import com.privguard.blockchain.identity.IdentityRegistry;
import com.privguard.blockchain.topology.NodeTopology.TopologyException;
import com.privguard.core.domain.ActualOutcome;
import com.privguard.core.domain.Identity;
import com.privguard.core.domain.Operation;
import com.privguard.core.domain.PrivacyGroup;
import com.privguard.core.domain.SentinelTable;
import com.privguard.core.oracle.AuthorizationOracle;
import com.privguard.core.report.BreachDetector;
import com.privguard.core.report.ExcludedGroup;
import com.privguard.core.report.ProbeResult;
import com.privguard.core.report.ProbeRole;
import com.privguard.core.report.VerificationReport;
import com.privguard.harness.config.HarnessConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the (group x identity x operation) matrix.
 *
 * <p>Each group is handled by one worker on a fixed pool: create, await readiness, write the
 * sentinel, fan reads out over a separate read pool, then issue the write probes one at a time.
 * Workers only hand back their own observations; classification happens once all of them
 * finished, so every sentinel is known when leakage is checked.</p>
 */
@Service
public class TestOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TestOrchestrator.class);

    private final PrivacyGroupManager groupManager;
    private final IdentityRegistry registry;
    private final ContractInvocationProxy proxy;
    private final AuthorizationOracle oracle;
    private final HarnessConfig config;
    private final BreachDetector detector;

    public TestOrchestrator(PrivacyGroupManager groupManager, IdentityRegistry registry,
                            ContractInvocationProxy proxy, AuthorizationOracle oracle, HarnessConfig config) {
        this.groupManager = groupManager;
        this.registry = registry;
        this.proxy = proxy;
        this.oracle = oracle;
        this.config = config;
        this.detector = new BreachDetector();
    }

    /**
     * Creates every declared group and runs the matrix against the resolved universe.
     */
    public VerificationReport run(List<GroupDefinition> definitions, List<Identity> universe) {
        String runId = config.getRunId() != null && !config.getRunId().isBlank()
                ? config.getRunId()
                : UUID.randomUUID().toString().substring(0, 8);
        return run(runId, definitions, universe);
    }

    public VerificationReport run(String runId, List<GroupDefinition> definitions, List<Identity> universe) {
        validate(definitions);
        log.info("Run {}: {} groups, {} identities", runId, definitions.size(), universe.size());
        return execute(runId, definitions, definition -> setUpAndProbe(runId, definition, universe), universe);
    }

    /**
     * Runs the matrix again against groups that are already READY, with fresh sentinels.
     */
    public VerificationReport verify(String runId, List<PrivacyGroup> groups, List<Identity> universe) {
        List<PrivacyGroup> testable = groups.stream().filter(PrivacyGroup::isTestable).toList();
        log.info("Run {}: re-verifying {} ready groups, {} identities", runId, testable.size(), universe.size());
        return execute(runId, testable, group -> probe(group, membersOf(group, universe), universe), universe);
    }

    private <T> VerificationReport execute(String runId, List<T> work,
                                           Function<T, GroupWorker> task,
                                           List<Identity> universe) {
        Instant startedAt = Instant.now();
        SentinelTable sentinels = new SentinelTable();
        ExecutorService groupPool = Executors.newFixedThreadPool(Math.max(1, config.getWorkers()));
        ExecutorService readPool = Executors.newFixedThreadPool(Math.max(1, config.getReadConcurrency()));
        try {
            List<CompletableFuture<WorkerResult>> workers = new ArrayList<>();
            for (T item : work) {
                GroupWorker worker = task.apply(item);
                workers.add(CompletableFuture
                        .supplyAsync(() -> worker.run(sentinels, readPool), groupPool)
                        .handle((result, error) -> error == null ? result : aborted(item, error)));
            }

            List<ProbeResult> probes = new ArrayList<>();
            List<ExcludedGroup> excluded = new ArrayList<>();
            for (CompletableFuture<WorkerResult> worker : workers) {
                WorkerResult result = worker.join();
                probes.addAll(result.probes());
                if (result.excluded() != null) {
                    excluded.add(result.excluded());
                }
            }

            VerificationReport report = VerificationReport.of(
                    runId, startedAt, Instant.now(), detector.evaluateAll(probes, sentinels), excluded);
            log.info("Run {} finished: {} test cases, {} excluded groups, universe of {}",
                    runId, report.testCases().size(), excluded.size(), universe.size());
            return report;
        } finally {
            groupPool.shutdownNow();
            readPool.shutdownNow();
        }
    }

    // ==================== Group worker ====================

    private GroupWorker setUpAndProbe(String runId, GroupDefinition definition, List<Identity> universe) {
        return (sentinels, reads) -> {
            String groupName = definition.name() + "-" + runId;
            List<Identity> members;
            try {
                members = registry.members(definition.members());
            } catch (TopologyException e) {
                return excluded(groupName, null, definition.members(), ExcludedGroup.Reason.TOPOLOGY, e);
            }

            PrivacyGroup group;
            try {
                group = groupManager.create(groupName, members);
            } catch (TopologyException e) {
                return excluded(groupName, null, definition.members(), ExcludedGroup.Reason.TOPOLOGY, e);
            } catch (GroupCreationException e) {
                return excluded(groupName, null, definition.members(), ExcludedGroup.Reason.CREATION_FAILED, e);
            }

            try {
                groupManager.awaitReady(group);
            } catch (ConfirmationTimeoutException e) {
                return excluded(groupName, group.id(), definition.members(), ExcludedGroup.Reason.CONFIRMATION_TIMEOUT, e);
            } catch (ProbeDeploymentException e) {
                return excluded(groupName, group.id(), definition.members(), ExcludedGroup.Reason.DEPLOYMENT_FAILED, e);
            } catch (GroupCreationException e) {
                return excluded(groupName, group.id(), definition.members(), ExcludedGroup.Reason.CREATION_FAILED, e);
            }

            return probe(group, members, universe).run(sentinels, reads);
        };
    }

    private GroupWorker probe(PrivacyGroup group, List<Identity> members, List<Identity> universe) {
        return (sentinels, reads) -> {
            List<ProbeResult> probes = new ArrayList<>();

            // Sentinel write: the first declared member establishes the group's value.
            Identity writer = members.get(0);
            BigInteger sentinel = sentinels.assign(group.id());
            ActualOutcome written = proxy.write(group, writer, sentinel);
            if (written instanceof ActualOutcome.Success) {
                sentinels.confirm(group.id());
                log.info("Group {}: sentinel established by {}", group.name(), writer.name());
            } else {
                log.warn("Group {}: sentinel write by {} did not commit, member reads will not be value-checked: {}",
                        group.name(), writer.name(), written.describe());
            }
            probes.add(ProbeResult.single(group.id(), group.name(), writer.name(), Operation.WRITE,
                    ProbeRole.SENTINEL_WRITE, oracle.expect(group, writer, Operation.WRITE), written));

            // Read fan-out across the whole universe.
            List<CompletableFuture<ProbeResult>> pending = universe.stream()
                    .map(identity -> CompletableFuture.supplyAsync(() -> readProbe(group, identity), reads))
                    .toList();
            for (CompletableFuture<ProbeResult> read : pending) {
                probes.add(joinUnchecked(read));
            }

            // Write probes only start once every read has returned.
            for (Identity identity : universe) {
                if (identity.name().equals(writer.name())) {
                    continue;
                }
                ActualOutcome outcome = proxy.write(group, identity, sentinels.newThrowaway());
                probes.add(ProbeResult.single(group.id(), group.name(), identity.name(), Operation.WRITE,
                        ProbeRole.WRITE_PROBE, oracle.expect(group, identity, Operation.WRITE), outcome));
            }

            log.info("Group {}: {} observations recorded", group.name(), probes.size());
            return new WorkerResult(probes, null);
        };
    }

    private ProbeResult readProbe(PrivacyGroup group, Identity identity) {
        int repetitions = Math.max(1, config.getReadRepetitions());
        List<ActualOutcome> outcomes = new ArrayList<>(repetitions);
        for (int i = 0; i < repetitions; i++) {
            outcomes.add(proxy.read(group, identity));
        }
        log.debug("Group {}: {} read {}", group.name(), identity.name(), outcomes);
        return new ProbeResult(group.id(), group.name(), identity.name(), Operation.READ,
                ProbeRole.READ, oracle.expect(group, identity, Operation.READ), outcomes);
    }

    // ==================== Helpers ====================

    private void validate(List<GroupDefinition> definitions) {
        Set<String> names = definitions.stream().map(GroupDefinition::name).collect(Collectors.toSet());
        if (names.size() != definitions.size()) {
            throw new IllegalArgumentException("Group names must be unique");
        }
        Set<String> stranded = registry.stranded();
        for (GroupDefinition definition : definitions) {
            for (String member : definition.members()) {
                if (registry.identity(member).isEmpty() && !stranded.contains(member)) {
                    throw new IllegalArgumentException(
                            "Group " + definition.name() + " names unknown identity " + member);
                }
            }
        }
    }

    private static List<Identity> membersOf(PrivacyGroup group, List<Identity> universe) {
        Map<String, Identity> byName = universe.stream()
                .collect(Collectors.toMap(Identity::name, Function.identity()));
        List<Identity> members = new ArrayList<>();
        for (String name : group.members()) {
            Identity identity = byName.get(name);
            if (identity == null) {
                throw new IllegalArgumentException("Member " + name + " of " + group.name() + " is not in the universe");
            }
            members.add(identity);
        }
        return members;
    }

    private static WorkerResult excluded(String groupName, String groupId, List<String> members,
                                         ExcludedGroup.Reason reason, Exception cause) {
        log.warn("Group {} excluded ({}): {}", groupName, reason, cause.getMessage());
        return new WorkerResult(List.of(), new ExcludedGroup(groupName, groupId, members, reason, cause.getMessage()));
    }

    private static WorkerResult aborted(Object item, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String groupName;
        String groupId = null;
        List<String> members;
        if (item instanceof PrivacyGroup group) {
            groupName = group.name();
            groupId = group.id();
            members = List.copyOf(group.members());
        } else {
            GroupDefinition definition = (GroupDefinition) item;
            groupName = definition.name();
            members = definition.members();
        }
        log.error("Group {} worker aborted", groupName, cause);
        return new WorkerResult(List.of(),
                new ExcludedGroup(groupName, groupId, members, ExcludedGroup.Reason.ABORTED, String.valueOf(cause.getMessage())));
    }

    private static <T> T joinUnchecked(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    @FunctionalInterface
    private interface GroupWorker {
        WorkerResult run(SentinelTable sentinels, ExecutorService reads);
    }

    private record WorkerResult(List<ProbeResult> probes, ExcludedGroup excluded) {}
}
