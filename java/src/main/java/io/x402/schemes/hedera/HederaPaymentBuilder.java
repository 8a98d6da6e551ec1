package io.x402.schemes.hedera;

import com.hedera.hashgraph.sdk.AccountId;
import com.hedera.hashgraph.sdk.Hbar;
import com.hedera.hashgraph.sdk.TokenId;
import com.hedera.hashgraph.sdk.TransactionId;
import com.hedera.hashgraph.sdk.TransferTransaction;
import io.x402.exception.PaymentCreationException;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.schemes.Amounts;
import io.x402.schemes.ExactScheme;
import io.x402.schemes.PayloadChecks;

import java.time.Duration;

/**
 * Builds the payer-signed {@link TransferTransaction} for an exact payment.
 * The transaction id is generated from the facilitator's account, which pays
 * the fees and adds its own signature at settlement.
 */
public final class HederaPaymentBuilder {

    /** Shortest transaction valid duration the network accepts. */
    static final Duration MIN_VALID_DURATION = Duration.ofSeconds(15);

    /** Longest transaction valid duration the network accepts. */
    static final Duration MAX_VALID_DURATION = Duration.ofSeconds(180);

    public PaymentPayload build(HederaSigner signer, int x402Version, PaymentRequirements requirements)
            throws PaymentCreationException {
        AccountId feePayer = account(requirements.requireFeePayer(), "feePayer");
        AccountId payTo = account(requirements.payTo, "payTo");
        long amount;
        try {
            amount = Amounts.parseInt64(requirements.maxAmountRequired);
        } catch (IllegalArgumentException e) {
            throw new PaymentCreationException(e.getMessage(), e);
        }

        TransferTransaction transaction = new TransferTransaction()
                .setTransactionId(TransactionId.generate(feePayer));
        if (requirements.maxTimeoutSeconds > 0) {
            transaction.setTransactionValidDuration(validDuration(requirements.maxTimeoutSeconds));
        }

        boolean hbar;
        try {
            hbar = HederaAssets.isHbar(requirements.asset);
        } catch (IllegalArgumentException e) {
            throw new PaymentCreationException("asset is required", e);
        }
        if (hbar) {
            Hbar value = Hbar.fromTinybars(amount);
            transaction.addHbarTransfer(signer.getAccountId(), value.negated())
                    .addHbarTransfer(payTo, value);
        } else {
            TokenId token;
            try {
                token = HederaAssets.parseToken(requirements.asset);
            } catch (RuntimeException e) {
                throw new PaymentCreationException("Invalid Hedera token id: " + requirements.asset, e);
            }
            transaction.addTokenTransfer(token, signer.getAccountId(), -amount)
                    .addTokenTransfer(token, payTo, amount);
        }

        transaction.freezeWith(signer.getClient());
        transaction.sign(signer.getPrivateKey());

        return new PaymentPayload(x402Version, ExactScheme.SCHEME, requirements.network,
                PayloadChecks.transactionPayload(transaction.toBytes()));
    }

    static Duration validDuration(int maxTimeoutSeconds) {
        Duration window = Duration.ofSeconds(maxTimeoutSeconds);
        if (window.compareTo(MIN_VALID_DURATION) < 0) {
            return MIN_VALID_DURATION;
        }
        return window.compareTo(MAX_VALID_DURATION) > 0 ? MAX_VALID_DURATION : window;
    }

    private static AccountId account(String value, String field) throws PaymentCreationException {
        try {
            return AccountId.fromString(value);
        } catch (RuntimeException e) {
            throw new PaymentCreationException("Invalid Hedera account id for " + field + ": " + value, e);
        }
    }
}
