package io.x402.schemes.svm;

/** An account an instruction touches, with its access flags. */
public final class AccountMeta {
    private final SolanaPublicKey key;
    private final boolean signer;
    private final boolean writable;

    public AccountMeta(SolanaPublicKey key, boolean signer, boolean writable) {
        this.key = key;
        this.signer = signer;
        this.writable = writable;
    }

    public SolanaPublicKey getKey() {
        return key;
    }

    public boolean isSigner() {
        return signer;
    }

    public boolean isWritable() {
        return writable;
    }
}
