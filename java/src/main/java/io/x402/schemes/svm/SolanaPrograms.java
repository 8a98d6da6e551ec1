package io.x402.schemes.svm;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/** Program ids and instruction layouts used by exact payments. */
public final class SolanaPrograms {

    public static final SolanaPublicKey SYSTEM_PROGRAM = SolanaPublicKey.of("11111111111111111111111111111111");
    public static final SolanaPublicKey TOKEN_PROGRAM = SolanaPublicKey.of("TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA");
    public static final SolanaPublicKey TOKEN_2022_PROGRAM = SolanaPublicKey.of("TokenzQdBNbLqP5VEhdkAS6EPFLC1PHnBqCXEpPxuEb");
    public static final SolanaPublicKey ASSOCIATED_TOKEN_PROGRAM = SolanaPublicKey.of("ATokenGPvbdGVxr1b2hvZbsiqW5xWH25efTNsLJA8knL");
    public static final SolanaPublicKey COMPUTE_BUDGET_PROGRAM = SolanaPublicKey.of("ComputeBudget111111111111111111111111111111");

    static final int SYSTEM_TRANSFER = 2;
    static final int TOKEN_TRANSFER_CHECKED = 12;
    static final int SET_COMPUTE_UNIT_LIMIT = 2;
    static final int SET_COMPUTE_UNIT_PRICE = 3;

    private SolanaPrograms() {}

    public static boolean isTokenProgram(SolanaPublicKey program) {
        return TOKEN_PROGRAM.equals(program) || TOKEN_2022_PROGRAM.equals(program);
    }

    public static SolanaInstruction systemTransfer(SolanaPublicKey from, SolanaPublicKey to, long lamports) {
        byte[] data = le(12).putInt(SYSTEM_TRANSFER).putLong(lamports).array();
        return new SolanaInstruction(SYSTEM_PROGRAM, List.of(
                new AccountMeta(from, true, true),
                new AccountMeta(to, false, true)), data);
    }

    public static SolanaInstruction transferChecked(SolanaPublicKey tokenProgram, SolanaPublicKey source,
                                                    SolanaPublicKey mint, SolanaPublicKey destination,
                                                    SolanaPublicKey owner, long amount, int decimals) {
        byte[] data = le(10).put((byte) TOKEN_TRANSFER_CHECKED).putLong(amount).put((byte) decimals).array();
        return new SolanaInstruction(tokenProgram, List.of(
                new AccountMeta(source, false, true),
                new AccountMeta(mint, false, false),
                new AccountMeta(destination, false, true),
                new AccountMeta(owner, true, false)), data);
    }

    public static SolanaInstruction setComputeUnitLimit(int units) {
        byte[] data = le(5).put((byte) SET_COMPUTE_UNIT_LIMIT).putInt(units).array();
        return new SolanaInstruction(COMPUTE_BUDGET_PROGRAM, List.of(), data);
    }

    public static SolanaInstruction setComputeUnitPrice(long microLamports) {
        byte[] data = le(9).put((byte) SET_COMPUTE_UNIT_PRICE).putLong(microLamports).array();
        return new SolanaInstruction(COMPUTE_BUDGET_PROGRAM, List.of(), data);
    }

    /** Associated token account of {@code owner} for {@code mint} under the given token program. */
    public static SolanaPublicKey associatedTokenAddress(SolanaPublicKey owner, SolanaPublicKey mint,
                                                         SolanaPublicKey tokenProgram) {
        return SolanaPublicKey.findProgramAddress(
                List.of(owner.toByteArray(), tokenProgram.toByteArray(), mint.toByteArray()),
                ASSOCIATED_TOKEN_PROGRAM);
    }

    static ByteBuffer le(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }
}
