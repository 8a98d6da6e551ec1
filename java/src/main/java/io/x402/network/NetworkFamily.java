package io.x402.network;

/** Structural class of ledger a network belongs to. Used only as a dispatch key. */
public enum NetworkFamily {
    /** Account model, EVM-compatible chains. */
    EVM("evm"),
    /** Account model, Solana-style ledgers. */
    SVM("svm"),
    /** Consensus-node ledgers (Hedera). */
    HEDERA("hedera");

    private final String id;

    NetworkFamily(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
