package io.x402.schemes.evm;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.x402.codec.Json;
import io.x402.model.ExactEvmPayload;
import org.web3j.crypto.StructuredDataEncoder;

import java.io.IOException;

/** EIP-712 digest of an EIP-3009 {@code TransferWithAuthorization} message. */
final class TransferAuthorizationTypedData {

    static final String PRIMARY_TYPE = "TransferWithAuthorization";

    private TransferAuthorizationTypedData() {}

    /**
     * @param name              token's EIP-712 domain name
     * @param version           token's EIP-712 domain version
     * @param chainId           chain id of the network
     * @param verifyingContract token contract address
     */
    static byte[] digest(String name, String version, long chainId, String verifyingContract,
                         ExactEvmPayload.Authorization authorization) throws IOException {
        ObjectNode root = Json.MAPPER.createObjectNode();

        ObjectNode types = root.putObject("types");
        ArrayNode domainType = types.putArray("EIP712Domain");
        field(domainType, "name", "string");
        field(domainType, "version", "string");
        field(domainType, "chainId", "uint256");
        field(domainType, "verifyingContract", "address");
        ArrayNode transferType = types.putArray(PRIMARY_TYPE);
        field(transferType, "from", "address");
        field(transferType, "to", "address");
        field(transferType, "value", "uint256");
        field(transferType, "validAfter", "uint256");
        field(transferType, "validBefore", "uint256");
        field(transferType, "nonce", "bytes32");

        root.put("primaryType", PRIMARY_TYPE);

        ObjectNode domain = root.putObject("domain");
        domain.put("name", name);
        domain.put("version", version);
        domain.put("chainId", chainId);
        domain.put("verifyingContract", verifyingContract);

        ObjectNode message = root.putObject("message");
        message.put("from", authorization.from);
        message.put("to", authorization.to);
        message.put("value", authorization.value);
        message.put("validAfter", authorization.validAfter);
        message.put("validBefore", authorization.validBefore);
        message.put("nonce", authorization.nonce);

        return new StructuredDataEncoder(Json.MAPPER.writeValueAsString(root)).hashStructuredData();
    }

    private static void field(ArrayNode type, String name, String solidityType) {
        type.addObject().put("name", name).put("type", solidityType);
    }
}
