package com.privguard.harness.config;

import com.privguard.blockchain.identity.IdentityDefinition;
import com.privguard.core.oracle.AuthorizationOracle;
import com.privguard.core.oracle.MembershipAuthorizationOracle;
import com.privguard.harness.orchestrator.GroupDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Identity universe, group definitions and execution settings for a verification run.
 */
@Configuration
@ConfigurationProperties(prefix = "privguard.harness")
public class HarnessConfig {

    private List<IdentityEntry> identities = new ArrayList<>();
    private List<GroupEntry> groups = new ArrayList<>();
    private int workers = 4;
    private int readConcurrency = 8;
    private int readRepetitions = 2;
    private String runId;
    private String reportPath = "target/privguard-report.json";
    private boolean enabled = true;

    public List<IdentityEntry> getIdentities() { return identities; }
    public void setIdentities(List<IdentityEntry> identities) { this.identities = identities; }
    public List<GroupEntry> getGroups() { return groups; }
    public void setGroups(List<GroupEntry> groups) { this.groups = groups; }
    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }
    public int getReadConcurrency() { return readConcurrency; }
    public void setReadConcurrency(int readConcurrency) { this.readConcurrency = readConcurrency; }
    public int getReadRepetitions() { return readRepetitions; }
    public void setReadRepetitions(int readRepetitions) { this.readRepetitions = readRepetitions; }
    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }
    public String getReportPath() { return reportPath; }
    public void setReportPath(String reportPath) { this.reportPath = reportPath; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    @Bean
    public AuthorizationOracle authorizationOracle() {
        return new MembershipAuthorizationOracle();
    }

    public List<IdentityDefinition> identityDefinitions() {
        return identities.stream()
                .map(entry -> new IdentityDefinition(entry.getName(), entry.getNode(), entry.getLookup()))
                .toList();
    }

    public List<GroupDefinition> groupDefinitions() {
        return groups.stream()
                .map(entry -> new GroupDefinition(entry.getName(), entry.getMembers()))
                .toList();
    }

    public static class IdentityEntry {
        private String name;
        private String node;
        private String lookup;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getNode() { return node; }
        public void setNode(String node) { this.node = node; }
        public String getLookup() { return lookup; }
        public void setLookup(String lookup) { this.lookup = lookup; }
    }

    public static class GroupEntry {
        private String name;
        private List<String> members = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public List<String> getMembers() { return members; }
        public void setMembers(List<String> members) { this.members = members; }
    }
}
