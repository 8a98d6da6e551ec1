package io.x402.schemes.svm;

import io.github.novacrypto.base58.Base58;
import io.x402.exception.PaymentCreationException;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.schemes.Amounts;
import io.x402.schemes.AssetClass;
import io.x402.schemes.ExactScheme;
import io.x402.schemes.PayloadChecks;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a partially signed transfer whose fee payer is the facilitator named in
 * {@code extra.feePayer}. The payer fills its own signature slot; the fee payer's
 * slot is left empty for the facilitator to fill at settlement.
 */
public final class SvmPaymentBuilder {

    static final int COMPUTE_UNIT_LIMIT = 20_000;
    static final long COMPUTE_UNIT_PRICE_MICRO_LAMPORTS = 1;

    public PaymentPayload build(SvmSigner signer, int x402Version, PaymentRequirements requirements)
            throws PaymentCreationException {
        SolanaPublicKey feePayer = key(requirements.requireFeePayer(), "feePayer");
        SolanaPublicKey payTo = key(requirements.payTo, "payTo");
        if (feePayer.equals(signer.publicKey())) {
            throw new PaymentCreationException("The payer cannot also be the fee payer");
        }
        long amount;
        AssetClass assetClass;
        try {
            amount = Amounts.parseUint64(requirements.maxAmountRequired);
            assetClass = SvmAssets.classify(requirements.asset);
        } catch (IllegalArgumentException e) {
            throw new PaymentCreationException(e.getMessage(), e);
        }

        List<SolanaInstruction> instructions = new ArrayList<>();
        instructions.add(SolanaPrograms.setComputeUnitLimit(COMPUTE_UNIT_LIMIT));
        instructions.add(SolanaPrograms.setComputeUnitPrice(COMPUTE_UNIT_PRICE_MICRO_LAMPORTS));
        byte[] blockhash;
        try {
            if (assetClass == AssetClass.NATIVE) {
                instructions.add(SolanaPrograms.systemTransfer(signer.publicKey(), payTo, amount));
            } else {
                instructions.add(tokenTransfer(signer, requirements.asset, payTo, amount));
            }
            blockhash = Base58.base58Decode(signer.getRpc().getLatestBlockhash());
        } catch (IOException e) {
            throw new PaymentCreationException("Solana RPC failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PaymentCreationException("Interrupted while building payment", e);
        }

        SolanaTransaction transaction;
        try {
            transaction = SolanaTransaction.unsigned(SolanaMessage.compile(feePayer, blockhash, instructions));
        } catch (IllegalArgumentException e) {
            throw new PaymentCreationException("Cannot compile transfer: " + e.getMessage(), e);
        }
        transaction.sign(signer);

        return new PaymentPayload(x402Version, ExactScheme.SCHEME, requirements.network,
                PayloadChecks.transactionPayload(transaction.serialize()));
    }

    private static SolanaInstruction tokenTransfer(SvmSigner signer, String asset, SolanaPublicKey payTo, long amount)
            throws IOException, InterruptedException, PaymentCreationException {
        SolanaPublicKey mint = key(asset, "asset");
        MintInfo info = signer.getRpc().getMint(asset);
        SolanaPublicKey program = info.getTokenProgram();
        if (!SolanaPrograms.isTokenProgram(program)) {
            throw new PaymentCreationException(asset + " is not owned by a token program");
        }
        return SolanaPrograms.transferChecked(program,
                SolanaPrograms.associatedTokenAddress(signer.publicKey(), mint, program),
                mint,
                SolanaPrograms.associatedTokenAddress(payTo, mint, program),
                signer.publicKey(), amount, info.getDecimals());
    }

    private static SolanaPublicKey key(String value, String field) throws PaymentCreationException {
        try {
            return SolanaPublicKey.of(value);
        } catch (IllegalArgumentException e) {
            throw new PaymentCreationException("Invalid Solana address for " + field + ": " + value, e);
        }
    }
}
