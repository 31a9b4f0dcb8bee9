package com.privguard.blockchain.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import org.web3j.protocol.core.Response;

/**
 * JSON-RPC response whose result is kept as a raw JSON tree. Paladin results are strings for
 * some methods and objects for others, so decoding is left to the caller.
 */
public class PaladinResponse extends Response<JsonNode> {
}
