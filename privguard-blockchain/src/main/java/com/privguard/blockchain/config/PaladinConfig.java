package com.privguard.blockchain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connectivity and protocol settings for the Paladin nodes under test.
 */
@Configuration
@ConfigurationProperties(prefix = "privguard.paladin")
public class PaladinConfig {

    private String domain = "pente";
    private List<NodeEndpoint> nodes = new ArrayList<>();
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(30);
    private int transportRetries = 1;
    private Duration retryBackoff = Duration.ofMillis(500);
    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration groupReadyTimeout = Duration.ofSeconds(45);
    private Duration receiptTimeout = Duration.ofSeconds(30);
    private String evmVersion = "shanghai";
    private String endorsementType = "group_scoped_identities";
    private boolean externalCallsEnabled = false;
    private MemberReference memberReference = MemberReference.LOOKUP;
    private List<Integer> structuredDenialCodes = new ArrayList<>();
    private List<String> extraDenialPhrases = new ArrayList<>();
    private Probe probe = new Probe();

    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }
    public List<NodeEndpoint> getNodes() { return nodes; }
    public void setNodes(List<NodeEndpoint> nodes) { this.nodes = nodes; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    public int getTransportRetries() { return transportRetries; }
    public void setTransportRetries(int transportRetries) { this.transportRetries = transportRetries; }
    public Duration getRetryBackoff() { return retryBackoff; }
    public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public Duration getGroupReadyTimeout() { return groupReadyTimeout; }
    public void setGroupReadyTimeout(Duration groupReadyTimeout) { this.groupReadyTimeout = groupReadyTimeout; }
    public Duration getReceiptTimeout() { return receiptTimeout; }
    public void setReceiptTimeout(Duration receiptTimeout) { this.receiptTimeout = receiptTimeout; }
    public String getEvmVersion() { return evmVersion; }
    public void setEvmVersion(String evmVersion) { this.evmVersion = evmVersion; }
    public String getEndorsementType() { return endorsementType; }
    public void setEndorsementType(String endorsementType) { this.endorsementType = endorsementType; }
    public boolean isExternalCallsEnabled() { return externalCallsEnabled; }
    public void setExternalCallsEnabled(boolean enabled) { this.externalCallsEnabled = enabled; }
    public MemberReference getMemberReference() { return memberReference; }
    public void setMemberReference(MemberReference memberReference) { this.memberReference = memberReference; }
    public List<Integer> getStructuredDenialCodes() { return structuredDenialCodes; }
    public void setStructuredDenialCodes(List<Integer> codes) { this.structuredDenialCodes = codes; }
    public List<String> getExtraDenialPhrases() { return extraDenialPhrases; }
    public void setExtraDenialPhrases(List<String> phrases) { this.extraDenialPhrases = phrases; }
    public Probe getProbe() { return probe; }
    public void setProbe(Probe probe) { this.probe = probe; }

    /**
     * How members are named in a group creation request.
     */
    public enum MemberReference {
        /** Identity lookup string, e.g. {@code alice@node1}. */
        LOOKUP,
        /** Resolved on-chain address. */
        ADDRESS
    }

    public static class NodeEndpoint {
        private String id;
        private String url;

        public NodeEndpoint() {}

        public NodeEndpoint(String id, String url) {
            this.id = id;
            this.url = url;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }

    /**
     * Storage contract deployed into every group: {@code store(uint256)} and {@code retrieve()}.
     */
    public static class Probe {
        private String bytecode;
        private String storeFunction = "store";
        private String retrieveFunction = "retrieve";
        private String valueParameter = "num";

        public String getBytecode() { return bytecode; }
        public void setBytecode(String bytecode) { this.bytecode = bytecode; }
        public String getStoreFunction() { return storeFunction; }
        public void setStoreFunction(String storeFunction) { this.storeFunction = storeFunction; }
        public String getRetrieveFunction() { return retrieveFunction; }
        public void setRetrieveFunction(String retrieveFunction) { this.retrieveFunction = retrieveFunction; }
        public String getValueParameter() { return valueParameter; }
        public void setValueParameter(String valueParameter) { this.valueParameter = valueParameter; }
    }
}
