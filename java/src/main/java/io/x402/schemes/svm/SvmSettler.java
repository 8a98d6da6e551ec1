package io.x402.schemes.svm;

import io.x402.model.ErrorReason;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;
import io.x402.schemes.LedgerRejectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

/**
 * Fills the fee payer's signature, submits the transaction and polls its
 * status until it is confirmed, fails or the timeout elapses.
 */
public final class SvmSettler {

    private static final Logger log = LoggerFactory.getLogger(SvmSettler.class);

    private final SvmVerifier verifier;
    private final Duration timeout;
    private final Duration pollInterval;

    public SvmSettler(SvmVerifier verifier, Duration timeout, Duration pollInterval) {
        this.verifier = verifier;
        this.timeout = timeout;
        this.pollInterval = pollInterval;
    }

    public SettleResponse settle(SvmSigner facilitator, PaymentPayload payload, PaymentRequirements requirements) {
        VerifyResponse verification = verifier.verify(facilitator, payload, requirements);
        if (!verification.isValid) {
            return SettleResponse.failure(verification.invalidReason, payload.network, verification.payer);
        }
        String payer = verification.payer;
        try {
            SolanaTransaction transaction = verifier.decode(payload);
            transaction.sign(facilitator);
            String signature = facilitator.getRpc()
                    .sendTransaction(Base64.getEncoder().encodeToString(transaction.serialize()));
            return awaitConfirmation(facilitator.getRpc(), signature, payload.network, payer);
        } catch (LedgerRejectionException e) {
            log.warn("Solana node rejected settlement on {}: {}", payload.network, e.getMessage());
            ErrorReason reason = e.isInsufficientBalance()
                    ? ErrorReason.INSUFFICIENT_BALANCE
                    : ErrorReason.TRANSACTION_FAILED;
            return SettleResponse.failure(reason, payload.network, payer);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while settling on {}", payload.network);
            return SettleResponse.failure(ErrorReason.UNEXPECTED_SETTLE_ERROR, payload.network, payer);
        } catch (Exception e) {
            log.error("Unexpected error during svm settlement", e);
            return SettleResponse.failure(ErrorReason.UNEXPECTED_SETTLE_ERROR, payload.network, payer);
        }
    }

    private SettleResponse awaitConfirmation(SvmRpc rpc, String signature, String network, String payer)
            throws Exception {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<SignatureStatus> status = rpc.getSignatureStatus(signature);
            if (status.isPresent() && status.get().isFailed()) {
                String error = status.get().getError();
                log.warn("Solana transaction {} failed: {}", signature, error);
                ErrorReason reason = LedgerRejectionException.indicatesInsufficientBalance(error)
                        ? ErrorReason.INSUFFICIENT_BALANCE
                        : ErrorReason.TRANSACTION_FAILED;
                return SettleResponse.failure(reason, network, payer);
            }
            if (status.isPresent() && status.get().isConfirmed()) {
                log.info("Settled svm payment {} on {}", signature, network);
                return SettleResponse.success(signature, network, payer);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Solana settlement {} on {} not confirmed within {}", signature, network, timeout);
                return SettleResponse.failure(ErrorReason.CONFIRMATION_TIMEOUT, network, payer);
            }
            Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
        }
    }
}
