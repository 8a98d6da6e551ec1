package io.x402.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.x402.codec.PaymentCodec;

/**
 * Settlement response header that gets base64-encoded into X-PAYMENT-RESPONSE.
 */
@JsonInclude(JsonInclude.Include.ALWAYS) // Always include all fields, even nulls
@JsonPropertyOrder({"success", "transaction", "network", "payer"})
public class SettlementResponseHeader {
    /** Whether the settlement was successful. */
    public boolean success;

    /** Ledger transaction id of the settled payment. */
    public String transaction;

    /** Network where the settlement occurred. */
    public String network;

    /** Account that made the payment (can be null). */
    public String payer;

    /** Default constructor for Jackson. */
    public SettlementResponseHeader() {}

    public SettlementResponseHeader(boolean success, String transaction, String network, String payer) {
        this.success = success;
        this.transaction = transaction;
        this.network = network;
        this.payer = payer;
    }

    /** Base64 header value. */
    public String encode() {
        return PaymentCodec.encodeSettlement(this);
    }
}
