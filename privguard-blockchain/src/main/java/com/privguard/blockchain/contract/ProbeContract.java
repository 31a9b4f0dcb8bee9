package com.privguard.blockchain.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.privguard.blockchain.config.PaladinConfig;
import org.web3j.protocol.ObjectMapperFactory;
import org.web3j.protocol.core.methods.response.AbiDefinition;
import org.web3j.protocol.core.methods.response.AbiDefinition.NamedType;

import java.util.List;
import java.util.Optional;

/**
 * ABI surface of the storage contract deployed into every group: a mutating {@code store(uint256)}
 * and a view {@code retrieve() returns (uint256)}. Nothing else is needed to tell a write denial
 * from a read denial.
 */
public class ProbeContract {

    private static final ObjectMapper MAPPER = ObjectMapperFactory.getObjectMapper();

    private final String bytecode;
    private final String valueParameter;
    private final AbiDefinition constructor;
    private final AbiDefinition store;
    private final AbiDefinition retrieve;

    public ProbeContract(String bytecode, String storeFunction, String retrieveFunction, String valueParameter) {
        this.bytecode = bytecode;
        this.valueParameter = valueParameter;
        this.constructor = entry(null, "constructor", List.of(), List.of(), "nonpayable");
        this.store = entry(storeFunction, "function",
                List.of(new NamedType(valueParameter, "uint256")), List.of(), "nonpayable");
        this.retrieve = entry(retrieveFunction, "function",
                List.of(), List.of(new NamedType("", "uint256")), "view");
    }

    public static ProbeContract from(PaladinConfig.Probe probe) {
        return new ProbeContract(probe.getBytecode(), probe.getStoreFunction(),
                probe.getRetrieveFunction(), probe.getValueParameter());
    }

    public Optional<String> bytecode() {
        return Optional.ofNullable(bytecode).filter(code -> !code.isBlank());
    }

    public String valueParameter() {
        return valueParameter;
    }

    public JsonNode constructorAbi() {
        return MAPPER.valueToTree(constructor);
    }

    public JsonNode storeAbi() {
        return MAPPER.valueToTree(store);
    }

    public JsonNode retrieveAbi() {
        return MAPPER.valueToTree(retrieve);
    }

    public String storeFunction() {
        return store.getName();
    }

    public String retrieveFunction() {
        return retrieve.getName();
    }

    private static AbiDefinition entry(String name, String type, List<NamedType> inputs,
                                       List<NamedType> outputs, String stateMutability) {
        AbiDefinition definition = new AbiDefinition();
        definition.setName(name);
        definition.setType(type);
        definition.setInputs(inputs);
        definition.setOutputs(outputs);
        definition.setConstant("view".equals(stateMutability));
        definition.setPayable(false);
        definition.setStateMutability(stateMutability);
        return definition;
    }
}
