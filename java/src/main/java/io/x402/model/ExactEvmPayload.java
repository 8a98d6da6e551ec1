package io.x402.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Payload of the EVM family: an EIP-3009 authorization and its EIP-712 signature. */
@JsonPropertyOrder({"signature", "authorization"})
public class ExactEvmPayload {
    /** 65-byte r||s||v signature, 0x-prefixed hex. */
    public String signature;
    public Authorization authorization;

    /** Default constructor for Jackson. */
    public ExactEvmPayload() {}

    public ExactEvmPayload(String signature, Authorization authorization) {
        this.signature = signature;
        this.authorization = authorization;
    }

    /** The {@code TransferWithAuthorization} message. Integers are decimal strings. */
    @JsonPropertyOrder({"from", "to", "value", "validAfter", "validBefore", "nonce"})
    public static class Authorization {
        public String from;
        public String to;
        public String value;
        public String validAfter;
        public String validBefore;
        public String nonce;   // bytes32, 0x-prefixed hex
    }
}
