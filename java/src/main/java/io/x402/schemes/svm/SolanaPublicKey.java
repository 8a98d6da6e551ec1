package io.x402.schemes.svm;

import io.github.novacrypto.base58.Base58;
import org.bouncycastle.math.ec.rfc8032.Ed25519;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;

/** 32-byte account address, shown in base58. */
public final class SolanaPublicKey {

    public static final int LENGTH = 32;

    private static final byte[] PDA_MARKER = "ProgramDerivedAddress".getBytes(StandardCharsets.UTF_8);

    private final byte[] bytes;

    public SolanaPublicKey(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("public key must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    /**
     * @throws IllegalArgumentException if the value is not base58 of 32 bytes
     */
    public static SolanaPublicKey of(String base58) {
        if (base58 == null || base58.isEmpty()) {
            throw new IllegalArgumentException("address is empty");
        }
        byte[] decoded;
        try {
            decoded = Base58.base58Decode(base58);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("address is not base58: " + base58, e);
        }
        return new SolanaPublicKey(decoded);
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    public String toBase58() {
        return Base58.base58Encode(bytes);
    }

    public boolean isOnCurve() {
        return Ed25519.validatePublicKeyPartial(bytes, 0);
    }

    /**
     * Finds the program-derived address for {@code seeds}, trying bump seeds
     * from 255 down until the derived point lies off the Ed25519 curve.
     */
    public static SolanaPublicKey findProgramAddress(List<byte[]> seeds, SolanaPublicKey programId) {
        for (int bump = 255; bump >= 0; bump--) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            for (byte[] seed : seeds) {
                buffer.writeBytes(seed);
            }
            buffer.write(bump);
            buffer.writeBytes(programId.bytes);
            buffer.writeBytes(PDA_MARKER);
            SolanaPublicKey candidate = new SolanaPublicKey(sha256(buffer.toByteArray()));
            if (!candidate.isOnCurve()) {
                return candidate;
            }
        }
        throw new IllegalStateException("no viable bump seed for program " + programId);
    }

    private static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SolanaPublicKey)) return false;
        return Arrays.equals(bytes, ((SolanaPublicKey) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toBase58();
    }
}
