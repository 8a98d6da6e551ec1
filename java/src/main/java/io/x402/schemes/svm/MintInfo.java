package io.x402.schemes.svm;

/** What a payment needs to know about an SPL mint. */
public final class MintInfo {
    private final SolanaPublicKey tokenProgram;
    private final int decimals;

    public MintInfo(SolanaPublicKey tokenProgram, int decimals) {
        this.tokenProgram = tokenProgram;
        this.decimals = decimals;
    }

    /** Program that owns the mint account, classic Token or Token-2022. */
    public SolanaPublicKey getTokenProgram() {
        return tokenProgram;
    }

    public int getDecimals() {
        return decimals;
    }
}
