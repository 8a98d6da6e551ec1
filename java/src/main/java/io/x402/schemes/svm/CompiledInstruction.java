package io.x402.schemes.svm;

/** An instruction as it appears in a message: accounts referenced by index into the key list. */
public final class CompiledInstruction {
    private final int programIdIndex;
    private final int[] accountIndexes;
    private final byte[] data;

    public CompiledInstruction(int programIdIndex, int[] accountIndexes, byte[] data) {
        this.programIdIndex = programIdIndex;
        this.accountIndexes = accountIndexes.clone();
        this.data = data.clone();
    }

    public int getProgramIdIndex() {
        return programIdIndex;
    }

    public int[] getAccountIndexes() {
        return accountIndexes.clone();
    }

    public int accountCount() {
        return accountIndexes.length;
    }

    public int accountIndex(int position) {
        return accountIndexes[position];
    }

    public byte[] getData() {
        return data.clone();
    }
}
