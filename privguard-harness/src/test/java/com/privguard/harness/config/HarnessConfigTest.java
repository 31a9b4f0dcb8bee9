package com.privguard.harness.config;

import com.privguard.blockchain.identity.IdentityDefinition;
import com.privguard.harness.orchestrator.GroupDefinition;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for binding {@code privguard.harness.*}.
 */
class HarnessConfigTest {

    @Test
    void bind_readsIdentitiesGroupsAndSettings() {
        // Given
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "privguard.harness.identities[0].name", "alice",
                "privguard.harness.identities[0].node", "node1",
                "privguard.harness.identities[1].name", "bob",
                "privguard.harness.identities[1].node", "node2",
                "privguard.harness.identities[1].lookup", "borrower@node2",
                "privguard.harness.groups[0].name", "lending",
                "privguard.harness.groups[0].members", "alice,bob",
                "privguard.harness.read-repetitions", "3",
                "privguard.harness.run-id", "nightly"));

        // When
        HarnessConfig config = new Binder(source)
                .bind("privguard.harness", Bindable.ofInstance(new HarnessConfig()))
                .get();

        // Then
        assertThat(config.identityDefinitions()).containsExactly(
                new IdentityDefinition("alice", "node1", "alice@node1"),
                new IdentityDefinition("bob", "node2", "borrower@node2"));
        assertThat(config.groupDefinitions()).containsExactly(new GroupDefinition("lending", List.of("alice", "bob")));
        assertThat(config.getReadRepetitions()).isEqualTo(3);
        assertThat(config.getRunId()).isEqualTo("nightly");
        assertThat(config.getWorkers()).isEqualTo(4);
        assertThat(config.getReportPath()).isEqualTo("target/privguard-report.json");
    }
}
