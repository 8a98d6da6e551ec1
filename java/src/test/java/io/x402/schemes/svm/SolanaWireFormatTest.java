package io.x402.schemes.svm;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SolanaWireFormatTest {

    static final byte[] BLOCKHASH = filled(32, 7);

    static byte[] filled(int size, int value) {
        byte[] bytes = new byte[size];
        Arrays.fill(bytes, (byte) value);
        return bytes;
    }

    static SolanaPublicKey key(int value) {
        return new SolanaPublicKey(filled(32, value));
    }

    private static byte[] shortVec(int value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ShortVec.write(out, value);
        return out.toByteArray();
    }

    @Test
    void shortVecUsesSevenBitGroups() {
        assertArrayEquals(new byte[]{0x00}, shortVec(0));
        assertArrayEquals(new byte[]{0x7f}, shortVec(127));
        assertArrayEquals(new byte[]{(byte) 0x80, 0x01}, shortVec(128));
        assertArrayEquals(new byte[]{(byte) 0xff, (byte) 0xff, 0x03}, shortVec(0xffff));

        assertEquals(0x3fff, ShortVec.read(ByteBuffer.wrap(new byte[]{(byte) 0xff, 0x7f})));
        assertThrows(IllegalArgumentException.class, () -> shortVec(0x10000));
    }

    @Test
    void shortVecRejectsNonCanonicalAndOverlongInput() {
        assertThrows(IllegalArgumentException.class,
                () -> ShortVec.read(ByteBuffer.wrap(new byte[]{(byte) 0x80, 0x00})));
        assertThrows(IllegalArgumentException.class,
                () -> ShortVec.read(ByteBuffer.wrap(new byte[]{(byte) 0x80, (byte) 0x80, (byte) 0x80, 0x01})));
        assertThrows(IllegalArgumentException.class,
                () -> ShortVec.read(ByteBuffer.wrap(new byte[]{(byte) 0xff, (byte) 0xff, 0x07})));
    }

    @Test
    void compileOrdersAccountsBySignerAndWritability() {
        SolanaPublicKey feePayer = key(1);
        SolanaPublicKey owner = key(2);
        SolanaPublicKey source = key(3);
        SolanaPublicKey mint = key(4);
        SolanaPublicKey destination = key(5);

        SolanaMessage message = SolanaMessage.compile(feePayer, BLOCKHASH, List.of(
                SolanaPrograms.setComputeUnitLimit(20_000),
                SolanaPrograms.transferChecked(SolanaPrograms.TOKEN_PROGRAM, source, mint, destination,
                        owner, 1_000, 6)));

        assertEquals(List.of(feePayer, owner, source, destination,
                        SolanaPrograms.COMPUTE_BUDGET_PROGRAM, mint, SolanaPrograms.TOKEN_PROGRAM),
                message.getAccountKeys());
        assertEquals(2, message.getNumRequiredSignatures());
        assertTrue(message.isSigner(1));
        assertFalse(message.isWritable(1));
        assertTrue(message.isWritable(0));
        assertTrue(message.isWritable(3));
        assertFalse(message.isWritable(5));

        CompiledInstruction transfer = message.getInstructions().get(1);
        assertEquals(6, transfer.getProgramIdIndex());
        assertArrayEquals(new int[]{2, 5, 3, 1}, transfer.getAccountIndexes());
        assertArrayEquals(new byte[]{12, (byte) 0xe8, 0x03, 0, 0, 0, 0, 0, 0, 6}, transfer.getData());
    }

    @Test
    void legacyMessageSurvivesTheWire() {
        SolanaMessage message = SolanaMessage.compile(key(1), BLOCKHASH, List.of(
                SolanaPrograms.systemTransfer(key(2), key(3), 5_000)));

        byte[] wire = message.serialize();
        SolanaMessage read = SolanaMessage.deserialize(ByteBuffer.wrap(wire));

        assertEquals(SolanaMessage.LEGACY, read.getVersion());
        assertEquals(message.getAccountKeys(), read.getAccountKeys());
        assertArrayEquals(BLOCKHASH, read.getRecentBlockhash());
        assertArrayEquals(wire, read.serialize());
    }

    @Test
    void versionZeroMessageWithoutLookupsIsAccepted() {
        SolanaMessage legacy = SolanaMessage.compile(key(1), BLOCKHASH, List.of(
                SolanaPrograms.systemTransfer(key(2), key(3), 5_000)));
        byte[] body = legacy.serialize();
        ByteBuffer wire = ByteBuffer.allocate(body.length + 2);
        wire.put((byte) 0x80).put(body).put((byte) 0).flip();

        SolanaMessage read = SolanaMessage.deserialize(wire);

        assertEquals(0, read.getVersion());
        assertEquals(legacy.getAccountKeys(), read.getAccountKeys());
        assertEquals((byte) 0x80, read.serialize()[0]);
    }

    @Test
    void addressLookupTablesAreRejected() {
        byte[] body = SolanaMessage.compile(key(1), BLOCKHASH, List.of(
                SolanaPrograms.systemTransfer(key(2), key(3), 5_000))).serialize();
        ByteBuffer wire = ByteBuffer.allocate(body.length + 2);
        wire.put((byte) 0x80).put(body).put((byte) 1).flip();

        assertThrows(IllegalArgumentException.class, () -> SolanaMessage.deserialize(wire));
    }

    @Test
    void trailingAndMissingBytesAreRejected() {
        byte[] body = SolanaMessage.compile(key(1), BLOCKHASH, List.of(
                SolanaPrograms.systemTransfer(key(2), key(3), 5_000))).serialize();

        byte[] longer = Arrays.copyOf(body, body.length + 1);
        byte[] shorter = Arrays.copyOf(body, body.length - 1);

        assertThrows(IllegalArgumentException.class, () -> SolanaMessage.deserialize(ByteBuffer.wrap(longer)));
        assertThrows(IllegalArgumentException.class, () -> SolanaMessage.deserialize(ByteBuffer.wrap(shorter)));
    }

    @Test
    void signedTransactionSurvivesTheWire() {
        SvmSigner payer = SvmSigner.generate(null);
        SolanaMessage message = SolanaMessage.compile(key(1), BLOCKHASH, List.of(
                SolanaPrograms.systemTransfer(payer.publicKey(), key(3), 5_000)));
        SolanaTransaction transaction = SolanaTransaction.unsigned(message);
        transaction.sign(payer);

        SolanaTransaction read = SolanaTransaction.fromBytes(transaction.serialize());

        assertArrayEquals(new byte[SolanaTransaction.SIGNATURE_LENGTH], read.getSignature(0));
        assertTrue(read.verifySignature(1));
        assertFalse(read.verifySignature(0));
    }

    @Test
    void signatureCountMustMatchHeader() {
        SolanaMessage message = SolanaMessage.compile(key(1), BLOCKHASH, List.of(
                SolanaPrograms.systemTransfer(key(2), key(3), 5_000)));
        byte[] body = message.serialize();
        ByteBuffer wire = ByteBuffer.allocate(1 + SolanaTransaction.SIGNATURE_LENGTH + body.length);
        wire.put((byte) 1).put(new byte[SolanaTransaction.SIGNATURE_LENGTH]).put(body);

        assertThrows(IllegalArgumentException.class, () -> SolanaTransaction.fromBytes(wire.array()));
    }

    @Test
    void signingWithNonSignerFails() {
        SolanaMessage message = SolanaMessage.compile(key(1), BLOCKHASH, List.of(
                SolanaPrograms.systemTransfer(key(2), key(3), 5_000)));

        assertThrows(IllegalArgumentException.class,
                () -> SolanaTransaction.unsigned(message).sign(SvmSigner.generate(null)));
    }

    @Test
    void associatedTokenAddressIsDerivedOffCurve() {
        SolanaPublicKey owner = SolanaPublicKey.of("9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM");
        SolanaPublicKey mint = SolanaPublicKey.of("EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v");

        SolanaPublicKey ata = SolanaPrograms.associatedTokenAddress(owner, mint, SolanaPrograms.TOKEN_PROGRAM);

        assertFalse(ata.isOnCurve());
        assertEquals(ata, SolanaPrograms.associatedTokenAddress(owner, mint, SolanaPrograms.TOKEN_PROGRAM));
        assertNotEquals(ata, SolanaPrograms.associatedTokenAddress(owner, mint, SolanaPrograms.TOKEN_2022_PROGRAM));
    }

    @Test
    void publicKeysRoundTripThroughBase58() {
        SolanaPublicKey system = SolanaPublicKey.of("11111111111111111111111111111111");

        assertArrayEquals(new byte[32], system.toByteArray());
        assertEquals("11111111111111111111111111111111", system.toBase58());
        assertThrows(IllegalArgumentException.class, () -> SolanaPublicKey.of("abc"));
        assertThrows(IllegalArgumentException.class, () -> SolanaPublicKey.of("0OIl"));
    }
}
