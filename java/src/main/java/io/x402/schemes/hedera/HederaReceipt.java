package io.x402.schemes.hedera;

import com.hedera.hashgraph.sdk.Status;

/** Final status of a submitted Hedera transaction. */
public final class HederaReceipt {
    private final String transactionId;
    private final Status status;

    public HederaReceipt(String transactionId, Status status) {
        this.transactionId = transactionId;
        this.status = status;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public Status getStatus() {
        return status;
    }
}
