package com.privguard.blockchain.topology;

import com.privguard.blockchain.config.PaladinConfig.NodeEndpoint;
import org.web3j.protocol.Web3jService;

/**
 * Creates the JSON-RPC transport for a configured node.
 */
@FunctionalInterface
public interface ServiceFactory {

    Web3jService create(NodeEndpoint endpoint);
}
