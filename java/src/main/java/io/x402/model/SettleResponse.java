package io.x402.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** JSON returned by POST /settle on the facilitator. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "errorReason", "transaction", "network", "payer"})
public class SettleResponse {
    /** Whether the payment settlement succeeded. */
    public boolean success;

    /** Reason for settlement failure (if success is false). */
    public ErrorReason errorReason;

    /** Ledger transaction id, empty when nothing was settled. */
    public String transaction = "";

    /** Network the settlement was attempted on. */
    public String network;

    /** Paying account as derived by the facilitator. */
    public String payer;

    /** Default constructor for Jackson. */
    public SettleResponse() {}

    public static SettleResponse success(String transaction, String network, String payer) {
        SettleResponse response = new SettleResponse();
        response.success = true;
        response.transaction = transaction;
        response.network = network;
        response.payer = payer;
        return response;
    }

    public static SettleResponse failure(ErrorReason reason, String network, String payer) {
        SettleResponse response = new SettleResponse();
        response.success = false;
        response.errorReason = reason;
        response.transaction = "";
        response.network = network;
        response.payer = payer == null ? "" : payer;
        return response;
    }

    /** Value of the {@code X-PAYMENT-RESPONSE} header for this settlement. */
    public SettlementResponseHeader toHeader() {
        return new SettlementResponseHeader(success, transaction, network, payer);
    }

    @Override
    public String toString() {
        return success ? "SettleResponse{success, transaction=" + transaction + ", network=" + network + "}"
                : "SettleResponse{failure, reason=" + errorReason + ", network=" + network + "}";
    }
}
