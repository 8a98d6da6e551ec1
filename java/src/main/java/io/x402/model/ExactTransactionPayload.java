package io.x402.model;

/**
 * Payload of the transaction-based families (Hedera, Solana): a base64
 * serialized transaction already signed by the payer.
 */
public class ExactTransactionPayload {
    public String transaction;

    /** Default constructor for Jackson. */
    public ExactTransactionPayload() {}

    public ExactTransactionPayload(String transaction) {
        this.transaction = transaction;
    }
}
