package io.x402.schemes.svm;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The signed part of a transaction: header, account keys, recent blockhash and
 * compiled instructions. Legacy and v0 messages are read; v0 messages that load
 * accounts from address lookup tables are rejected.
 */
public final class SolanaMessage {

    /** Version marker of a legacy message. */
    public static final int LEGACY = -1;

    private static final int VERSION_PREFIX = 0x80;

    private final int version;
    private final int numRequiredSignatures;
    private final int numReadonlySigned;
    private final int numReadonlyUnsigned;
    private final List<SolanaPublicKey> accountKeys;
    private final byte[] recentBlockhash;
    private final List<CompiledInstruction> instructions;

    public SolanaMessage(int version, int numRequiredSignatures, int numReadonlySigned, int numReadonlyUnsigned,
                         List<SolanaPublicKey> accountKeys, byte[] recentBlockhash,
                         List<CompiledInstruction> instructions) {
        if (version != LEGACY && version != 0) {
            throw new IllegalArgumentException("unsupported message version " + version);
        }
        if (recentBlockhash.length != 32) {
            throw new IllegalArgumentException("blockhash must be 32 bytes");
        }
        if (numRequiredSignatures > accountKeys.size()
                || numReadonlySigned > numRequiredSignatures
                || numReadonlyUnsigned > accountKeys.size() - numRequiredSignatures) {
            throw new IllegalArgumentException("message header does not fit the account keys");
        }
        for (CompiledInstruction instruction : instructions) {
            checkIndex(instruction.getProgramIdIndex(), accountKeys.size());
            for (int index : instruction.getAccountIndexes()) {
                checkIndex(index, accountKeys.size());
            }
        }
        this.version = version;
        this.numRequiredSignatures = numRequiredSignatures;
        this.numReadonlySigned = numReadonlySigned;
        this.numReadonlyUnsigned = numReadonlyUnsigned;
        this.accountKeys = List.copyOf(accountKeys);
        this.recentBlockhash = recentBlockhash.clone();
        this.instructions = List.copyOf(instructions);
    }

    /**
     * Compiles a legacy message. Accounts are ordered writable signers first
     * (fee payer at index 0), then read-only signers, writable non-signers and
     * read-only non-signers.
     */
    public static SolanaMessage compile(SolanaPublicKey feePayer, byte[] recentBlockhash,
                                        List<SolanaInstruction> instructions) {
        Map<SolanaPublicKey, boolean[]> flags = new LinkedHashMap<>();
        flags.put(feePayer, new boolean[]{true, true});
        for (SolanaInstruction instruction : instructions) {
            for (AccountMeta meta : instruction.getAccounts()) {
                boolean[] f = flags.computeIfAbsent(meta.getKey(), k -> new boolean[2]);
                f[0] |= meta.isSigner();
                f[1] |= meta.isWritable();
            }
            flags.computeIfAbsent(instruction.getProgramId(), k -> new boolean[2]);
        }

        List<SolanaPublicKey> writableSigners = new ArrayList<>();
        List<SolanaPublicKey> readonlySigners = new ArrayList<>();
        List<SolanaPublicKey> writable = new ArrayList<>();
        List<SolanaPublicKey> readonly = new ArrayList<>();
        flags.forEach((key, f) -> {
            if (f[0] && f[1]) {
                writableSigners.add(key);
            } else if (f[0]) {
                readonlySigners.add(key);
            } else if (f[1]) {
                writable.add(key);
            } else {
                readonly.add(key);
            }
        });
        List<SolanaPublicKey> keys = new ArrayList<>(writableSigners);
        keys.addAll(readonlySigners);
        keys.addAll(writable);
        keys.addAll(readonly);

        List<CompiledInstruction> compiled = new ArrayList<>();
        for (SolanaInstruction instruction : instructions) {
            List<AccountMeta> metas = instruction.getAccounts();
            int[] indexes = new int[metas.size()];
            for (int i = 0; i < indexes.length; i++) {
                indexes[i] = keys.indexOf(metas.get(i).getKey());
            }
            compiled.add(new CompiledInstruction(keys.indexOf(instruction.getProgramId()), indexes,
                    instruction.getData()));
        }
        return new SolanaMessage(LEGACY, writableSigners.size() + readonlySigners.size(), readonlySigners.size(),
                readonly.size(), keys, recentBlockhash, compiled);
    }

    /**
     * Reads a message and requires that it spans the buffer's remaining bytes.
     *
     * @throws IllegalArgumentException on malformed or unsupported input
     */
    public static SolanaMessage deserialize(ByteBuffer in) {
        try {
            int first = in.get() & 0xff;
            int version = LEGACY;
            int numRequiredSignatures = first;
            if ((first & VERSION_PREFIX) != 0) {
                version = first & 0x7f;
                if (version != 0) {
                    throw new IllegalArgumentException("unsupported message version " + version);
                }
                numRequiredSignatures = in.get() & 0xff;
            }
            int numReadonlySigned = in.get() & 0xff;
            int numReadonlyUnsigned = in.get() & 0xff;

            int keyCount = ShortVec.read(in);
            List<SolanaPublicKey> keys = new ArrayList<>(keyCount);
            for (int i = 0; i < keyCount; i++) {
                byte[] key = new byte[SolanaPublicKey.LENGTH];
                in.get(key);
                keys.add(new SolanaPublicKey(key));
            }
            byte[] blockhash = new byte[32];
            in.get(blockhash);

            int instructionCount = ShortVec.read(in);
            List<CompiledInstruction> instructions = new ArrayList<>(instructionCount);
            for (int i = 0; i < instructionCount; i++) {
                int programIdIndex = in.get() & 0xff;
                int[] accounts = new int[ShortVec.read(in)];
                for (int j = 0; j < accounts.length; j++) {
                    accounts[j] = in.get() & 0xff;
                }
                byte[] data = new byte[ShortVec.read(in)];
                in.get(data);
                instructions.add(new CompiledInstruction(programIdIndex, accounts, data));
            }
            if (version == 0 && ShortVec.read(in) != 0) {
                throw new IllegalArgumentException("address lookup tables are not supported");
            }
            if (in.hasRemaining()) {
                throw new IllegalArgumentException("trailing bytes after message");
            }
            return new SolanaMessage(version, numRequiredSignatures, numReadonlySigned, numReadonlyUnsigned,
                    keys, blockhash, instructions);
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("truncated message", e);
        }
    }

    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (version != LEGACY) {
            out.write(VERSION_PREFIX | version);
        }
        out.write(numRequiredSignatures);
        out.write(numReadonlySigned);
        out.write(numReadonlyUnsigned);
        ShortVec.write(out, accountKeys.size());
        for (SolanaPublicKey key : accountKeys) {
            out.writeBytes(key.toByteArray());
        }
        out.writeBytes(recentBlockhash);
        ShortVec.write(out, instructions.size());
        for (CompiledInstruction instruction : instructions) {
            out.write(instruction.getProgramIdIndex());
            ShortVec.write(out, instruction.accountCount());
            for (int index : instruction.getAccountIndexes()) {
                out.write(index);
            }
            byte[] data = instruction.getData();
            ShortVec.write(out, data.length);
            out.writeBytes(data);
        }
        if (version != LEGACY) {
            ShortVec.write(out, 0);
        }
        return out.toByteArray();
    }

    public boolean isSigner(int index) {
        return index < numRequiredSignatures;
    }

    public boolean isWritable(int index) {
        if (index < numRequiredSignatures) {
            return index < numRequiredSignatures - numReadonlySigned;
        }
        return index < accountKeys.size() - numReadonlyUnsigned;
    }

    public int getVersion() {
        return version;
    }

    public int getNumRequiredSignatures() {
        return numRequiredSignatures;
    }

    public List<SolanaPublicKey> getAccountKeys() {
        return accountKeys;
    }

    public SolanaPublicKey feePayer() {
        return accountKeys.get(0);
    }

    public byte[] getRecentBlockhash() {
        return recentBlockhash.clone();
    }

    public List<CompiledInstruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    private static void checkIndex(int index, int size) {
        if (index >= size) {
            throw new IllegalArgumentException("account index " + index + " out of range");
        }
    }
}
