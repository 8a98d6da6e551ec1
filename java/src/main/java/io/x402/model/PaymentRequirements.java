package io.x402.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.x402.exception.FeePayerRequiredException;

import java.util.Map;

/** Defines one acceptable way to pay for a resource. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"scheme", "network", "maxAmountRequired", "resource", "description", "mimeType",
        "outputSchema", "payTo", "maxTimeoutSeconds", "asset", "extra"})
public class PaymentRequirements {
    public String scheme;              // e.g. "exact"
    public String network;             // e.g. "hedera-testnet"
    public String maxAmountRequired;   // smallest indivisible unit, decimal string
    public String resource;            // URL of the protected resource
    public String description;
    public String mimeType;
    public Map<String, Object> outputSchema; // optional JSON schema
    public String payTo;               // recipient, family-specific format
    public int maxTimeoutSeconds;
    public String asset;               // token id / contract / mint, or a native sentinel
    public PaymentExtra extra;         // scheme-specific

    /**
     * Returns the fee payer the resource server agreed on with its facilitator.
     *
     * @throws FeePayerRequiredException if {@code extra.feePayer} is absent or blank
     */
    public String requireFeePayer() throws FeePayerRequiredException {
        if (extra == null || extra.feePayer == null || extra.feePayer.isBlank()) {
            throw new FeePayerRequiredException(network);
        }
        return extra.feePayer;
    }

    /** Fee payer if present, otherwise {@code null}. */
    public String feePayerOrNull() {
        return extra == null ? null : extra.feePayer;
    }
}
