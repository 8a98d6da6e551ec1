package io.x402.schemes.evm;

/** Mined outcome of a settlement transaction. */
public final class EvmReceipt {
    private final String transactionHash;
    private final boolean success;

    public EvmReceipt(String transactionHash, boolean success) {
        this.transactionHash = transactionHash;
        this.success = success;
    }

    public String getTransactionHash() {
        return transactionHash;
    }

    public boolean isSuccess() {
        return success;
    }
}
