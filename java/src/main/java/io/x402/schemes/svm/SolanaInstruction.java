package io.x402.schemes.svm;

import java.util.List;

/** An uncompiled instruction: program, accounts by key, opaque data. */
public final class SolanaInstruction {
    private final SolanaPublicKey programId;
    private final List<AccountMeta> accounts;
    private final byte[] data;

    public SolanaInstruction(SolanaPublicKey programId, List<AccountMeta> accounts, byte[] data) {
        this.programId = programId;
        this.accounts = List.copyOf(accounts);
        this.data = data.clone();
    }

    public SolanaPublicKey getProgramId() {
        return programId;
    }

    public List<AccountMeta> getAccounts() {
        return accounts;
    }

    public byte[] getData() {
        return data.clone();
    }
}
