package io.x402.schemes.svm;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** A message plus one signature slot per required signer. Empty slots are all zeros. */
public final class SolanaTransaction {

    public static final int SIGNATURE_LENGTH = 64;

    private final SolanaMessage message;
    private final byte[] messageBytes;
    private final List<byte[]> signatures;

    private SolanaTransaction(SolanaMessage message, byte[] messageBytes, List<byte[]> signatures) {
        this.message = message;
        this.messageBytes = messageBytes;
        this.signatures = signatures;
    }

    public static SolanaTransaction unsigned(SolanaMessage message) {
        List<byte[]> signatures = new ArrayList<>();
        for (int i = 0; i < message.getNumRequiredSignatures(); i++) {
            signatures.add(new byte[SIGNATURE_LENGTH]);
        }
        return new SolanaTransaction(message, message.serialize(), signatures);
    }

    /**
     * @throws IllegalArgumentException on malformed wire bytes or a signature count
     *                                  that differs from the message header
     */
    public static SolanaTransaction fromBytes(byte[] wire) {
        ByteBuffer in = ByteBuffer.wrap(wire);
        try {
            int count = ShortVec.read(in);
            List<byte[]> signatures = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                byte[] signature = new byte[SIGNATURE_LENGTH];
                in.get(signature);
                signatures.add(signature);
            }
            byte[] messageBytes = Arrays.copyOfRange(wire, in.position(), wire.length);
            SolanaMessage message = SolanaMessage.deserialize(ByteBuffer.wrap(messageBytes));
            if (message.getNumRequiredSignatures() != count) {
                throw new IllegalArgumentException("expected " + message.getNumRequiredSignatures()
                        + " signatures, found " + count);
            }
            return new SolanaTransaction(message, messageBytes, signatures);
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("truncated transaction", e);
        }
    }

    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ShortVec.write(out, signatures.size());
        for (byte[] signature : signatures) {
            out.writeBytes(signature);
        }
        out.writeBytes(messageBytes);
        return out.toByteArray();
    }

    /** Fills the slot of the signer's key. */
    public void sign(SvmSigner signer) {
        int index = message.getAccountKeys().indexOf(signer.publicKey());
        if (index < 0 || !message.isSigner(index)) {
            throw new IllegalArgumentException(signer.address() + " is not a required signer");
        }
        signatures.set(index, signer.sign(messageBytes));
    }

    /** Whether slot {@code index} holds a valid Ed25519 signature of its key over the message. */
    public boolean verifySignature(int index) {
        byte[] signature = signatures.get(index);
        Ed25519PublicKeyParameters key;
        try {
            key = new Ed25519PublicKeyParameters(message.getAccountKeys().get(index).toByteArray(), 0);
        } catch (IllegalArgumentException e) {
            return false;
        }
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, key);
        verifier.update(messageBytes, 0, messageBytes.length);
        return verifier.verifySignature(signature);
    }

    public SolanaMessage getMessage() {
        return message;
    }

    public byte[] getMessageBytes() {
        return messageBytes.clone();
    }

    public byte[] getSignature(int index) {
        return signatures.get(index).clone();
    }
}
