package io.x402.schemes.hedera;

import com.hedera.hashgraph.sdk.Status;
import com.hedera.hashgraph.sdk.TransferTransaction;
import io.x402.model.ErrorReason;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Adds the facilitator's fee-payer signature to a verified transfer, submits it
 * and waits for the receipt. A timed-out settlement is reported, never retried.
 */
public final class HederaSettler {

    private static final Logger log = LoggerFactory.getLogger(HederaSettler.class);

    private final HederaVerifier verifier;
    private final Duration timeout;

    public HederaSettler(HederaVerifier verifier, Duration timeout) {
        this.verifier = verifier;
        this.timeout = timeout;
    }

    public SettleResponse settle(HederaSigner facilitator, PaymentPayload payload, PaymentRequirements requirements) {
        VerifyResponse verification = verifier.verify(facilitator, payload, requirements);
        if (!verification.isValid) {
            return SettleResponse.failure(verification.invalidReason, payload.network, verification.payer);
        }
        String payer = verification.payer;
        try {
            TransferTransaction transaction = verifier.decode(payload);
            transaction.sign(facilitator.getPrivateKey());

            HederaReceipt receipt = facilitator.getLedger().submit(transaction, timeout);
            if (receipt.getStatus() == Status.SUCCESS) {
                log.info("Settled hedera payment {} on {}", receipt.getTransactionId(), payload.network);
                return SettleResponse.success(receipt.getTransactionId(), payload.network, payer);
            }
            log.warn("Hedera transaction {} failed with status {}", receipt.getTransactionId(), receipt.getStatus());
            return SettleResponse.failure(reasonFor(receipt.getStatus()), payload.network, payer);
        } catch (TimeoutException e) {
            log.warn("Hedera settlement on {} not confirmed within {}", payload.network, timeout);
            return SettleResponse.failure(ErrorReason.CONFIRMATION_TIMEOUT, payload.network, payer);
        } catch (Exception e) {
            log.error("Unexpected error during hedera settlement", e);
            return SettleResponse.failure(ErrorReason.UNEXPECTED_SETTLE_ERROR, payload.network, payer);
        }
    }

    static ErrorReason reasonFor(Status status) {
        switch (status) {
            case INSUFFICIENT_ACCOUNT_BALANCE:
            case INSUFFICIENT_PAYER_BALANCE:
            case INSUFFICIENT_TOKEN_BALANCE:
                return ErrorReason.INSUFFICIENT_BALANCE;
            default:
                return ErrorReason.TRANSACTION_FAILED;
        }
    }
}
