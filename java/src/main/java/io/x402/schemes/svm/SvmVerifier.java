package io.x402.schemes.svm;

import io.x402.model.ErrorReason;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.VerifyResponse;
import io.x402.network.NetworkFamily;
import io.x402.network.NetworkRegistry;
import io.x402.schemes.Amounts;
import io.x402.schemes.AssetClass;
import io.x402.schemes.PayloadChecks;
import io.x402.schemes.VerificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Verifies a partially signed Solana transfer. Besides one transfer the
 * transaction may only carry compute-budget instructions, and the fee payer
 * at account index 0 must be this facilitator.
 */
public final class SvmVerifier {

    private static final Logger log = LoggerFactory.getLogger(SvmVerifier.class);

    static final long MAX_COMPUTE_UNIT_PRICE_MICRO_LAMPORTS = 50_000;
    static final long MAX_COMPUTE_UNIT_LIMIT = 200_000;

    private final NetworkRegistry registry;

    public SvmVerifier(NetworkRegistry registry) {
        this.registry = registry;
    }

    public VerifyResponse verify(SvmSigner facilitator, PaymentPayload payload, PaymentRequirements requirements) {
        try {
            PayloadChecks.checkSchemeAndNetwork(payload, requirements, registry, NetworkFamily.SVM);
            SolanaTransaction transaction = decode(payload);
            Transfer transfer = transfer(transaction.getMessage());
            checkFeePayer(facilitator, transaction.getMessage(), requirements);
            checkTransfer(transfer, transaction.getMessage(), requirements);
            checkSignatures(transaction, transfer.authority.toBase58());
            return VerifyResponse.valid(transfer.authority.toBase58());
        } catch (VerificationException e) {
            log.debug("Rejected svm payment on {}: {}", requirements.network, e.getReason());
            return VerifyResponse.invalid(e.getReason(), e.getPayer());
        } catch (RuntimeException e) {
            log.error("Unexpected error verifying svm payment", e);
            return VerifyResponse.invalid(ErrorReason.UNEXPECTED_VERIFY_ERROR, "");
        }
    }

    SolanaTransaction decode(PaymentPayload payload) throws VerificationException {
        byte[] bytes = PayloadChecks.transactionBytes(payload);
        try {
            return SolanaTransaction.fromBytes(bytes);
        } catch (IllegalArgumentException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION, "", e);
        }
    }

    /** The single transfer of the transaction; everything else must be a compute-budget setting. */
    private static Transfer transfer(SolanaMessage message) throws VerificationException {
        Transfer transfer = null;
        boolean limitSeen = false;
        boolean priceSeen = false;
        for (CompiledInstruction instruction : message.getInstructions()) {
            SolanaPublicKey program = message.getAccountKeys().get(instruction.getProgramIdIndex());
            byte[] data = instruction.getData();
            if (SolanaPrograms.COMPUTE_BUDGET_PROGRAM.equals(program)) {
                if (instruction.accountCount() != 0 || data.length == 0) {
                    throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
                }
                ByteBuffer in = ByteBuffer.wrap(data, 1, data.length - 1).order(ByteOrder.LITTLE_ENDIAN);
                if (data[0] == SolanaPrograms.SET_COMPUTE_UNIT_LIMIT && data.length == 5 && !limitSeen) {
                    limitSeen = true;
                    if (Integer.toUnsignedLong(in.getInt()) > MAX_COMPUTE_UNIT_LIMIT) {
                        throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
                    }
                } else if (data[0] == SolanaPrograms.SET_COMPUTE_UNIT_PRICE && data.length == 9 && !priceSeen) {
                    priceSeen = true;
                    if (Long.compareUnsigned(in.getLong(), MAX_COMPUTE_UNIT_PRICE_MICRO_LAMPORTS) > 0) {
                        throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
                    }
                } else {
                    throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
                }
            } else if (transfer == null) {
                transfer = Transfer.parse(program, instruction, message);
            } else {
                throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
            }
        }
        if (transfer == null) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
        }
        return transfer;
    }

    private static void checkFeePayer(SvmSigner facilitator, SolanaMessage message, PaymentRequirements requirements)
            throws VerificationException {
        SolanaPublicKey feePayer = message.feePayer();
        if (!feePayer.equals(facilitator.publicKey())) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE);
        }
        if (!feePayer.toBase58().equals(requirements.feePayerOrNull())) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE);
        }
    }

    private static void checkTransfer(Transfer transfer, SolanaMessage message, PaymentRequirements requirements)
            throws VerificationException {
        String payer = transfer.authority.toBase58();
        AssetClass assetClass;
        try {
            assetClass = SvmAssets.classify(requirements.asset);
        } catch (IllegalArgumentException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH, payer, e);
        }
        SolanaPublicKey recipient;
        if (assetClass == AssetClass.NATIVE) {
            if (transfer.mint != null) {
                throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH, payer);
            }
            recipient = publicKey(requirements.payTo, payer);
        } else {
            SolanaPublicKey mint;
            try {
                mint = SolanaPublicKey.of(requirements.asset);
            } catch (IllegalArgumentException e) {
                throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH, payer, e);
            }
            if (!mint.equals(transfer.mint)) {
                throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH, payer);
            }
            recipient = SolanaPrograms.associatedTokenAddress(
                    publicKey(requirements.payTo, payer), mint, transfer.program);
        }

        SolanaPublicKey feePayer = message.feePayer();
        if (transfer.touches(feePayer)) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION, payer);
        }
        if (!recipient.equals(transfer.destination)) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_RECIPIENT_MISMATCH, payer);
        }
        long required;
        try {
            required = Amounts.parseUint64(requirements.maxAmountRequired);
        } catch (IllegalArgumentException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_AMOUNT_MISMATCH, payer, e);
        }
        if (transfer.amount != required) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_AMOUNT_MISMATCH, payer);
        }
    }

    /** Every signer other than the fee payer must already have signed. */
    private static void checkSignatures(SolanaTransaction transaction, String payer) throws VerificationException {
        for (int i = 1; i < transaction.getMessage().getNumRequiredSignatures(); i++) {
            if (!transaction.verifySignature(i)) {
                throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE, payer);
            }
        }
    }

    private static SolanaPublicKey publicKey(String value, String payer) throws VerificationException {
        try {
            return SolanaPublicKey.of(value);
        } catch (IllegalArgumentException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_RECIPIENT_MISMATCH, payer, e);
        }
    }

    /** A System {@code Transfer} or SPL {@code TransferChecked}, resolved to account keys. */
    static final class Transfer {
        final SolanaPublicKey program;
        final SolanaPublicKey authority;
        final SolanaPublicKey source;
        final SolanaPublicKey destination;
        final SolanaPublicKey mint;   // null for SOL
        final long amount;

        private Transfer(SolanaPublicKey program, SolanaPublicKey authority, SolanaPublicKey source,
                         SolanaPublicKey destination, SolanaPublicKey mint, long amount) {
            this.program = program;
            this.authority = authority;
            this.source = source;
            this.destination = destination;
            this.mint = mint;
            this.amount = amount;
        }

        static Transfer parse(SolanaPublicKey program, CompiledInstruction instruction, SolanaMessage message)
                throws VerificationException {
            byte[] data = instruction.getData();
            ByteBuffer in = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
            if (SolanaPrograms.SYSTEM_PROGRAM.equals(program)) {
                if (data.length != 12 || in.getInt() != SolanaPrograms.SYSTEM_TRANSFER || instruction.accountCount() != 2) {
                    throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
                }
                int from = instruction.accountIndex(0);
                if (!message.isSigner(from)) {
                    throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
                }
                SolanaPublicKey sender = message.getAccountKeys().get(from);
                return new Transfer(program, sender, sender,
                        message.getAccountKeys().get(instruction.accountIndex(1)), null, in.getLong());
            }
            if (SolanaPrograms.isTokenProgram(program)) {
                if (data.length != 10 || in.get() != SolanaPrograms.TOKEN_TRANSFER_CHECKED
                        || instruction.accountCount() != 4) {
                    throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
                }
                int owner = instruction.accountIndex(3);
                if (!message.isSigner(owner)) {
                    throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
                }
                long amount = in.getLong();
                return new Transfer(program,
                        message.getAccountKeys().get(owner),
                        message.getAccountKeys().get(instruction.accountIndex(0)),
                        message.getAccountKeys().get(instruction.accountIndex(2)),
                        message.getAccountKeys().get(instruction.accountIndex(1)),
                        amount);
            }
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
        }

        boolean touches(SolanaPublicKey key) {
            return key.equals(authority) || key.equals(source) || key.equals(destination);
        }
    }
}
