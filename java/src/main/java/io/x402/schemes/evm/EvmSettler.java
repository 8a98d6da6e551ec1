package io.x402.schemes.evm;

import io.x402.model.ErrorReason;
import io.x402.model.ExactEvmPayload;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;
import io.x402.schemes.LedgerRejectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/** Relays a verified authorization to the token contract and waits for the receipt. */
public final class EvmSettler {

    private static final Logger log = LoggerFactory.getLogger(EvmSettler.class);

    private final EvmVerifier verifier;
    private final Duration timeout;

    public EvmSettler(EvmVerifier verifier, Duration timeout) {
        this.verifier = verifier;
        this.timeout = timeout;
    }

    public SettleResponse settle(EvmSigner facilitator, PaymentPayload payload, PaymentRequirements requirements) {
        VerifyResponse verification = verifier.verify(facilitator, payload, requirements);
        if (!verification.isValid) {
            return SettleResponse.failure(verification.invalidReason, payload.network, verification.payer);
        }
        String payer = verification.payer;
        try {
            ExactEvmPayload evm = verifier.decode(payload);
            EvmReceipt receipt = facilitator.getLedger().transferWithAuthorization(requirements.asset, evm, timeout);
            if (receipt.isSuccess()) {
                log.info("Settled evm payment {} on {}", receipt.getTransactionHash(), payload.network);
                return SettleResponse.success(receipt.getTransactionHash(), payload.network, payer);
            }
            log.warn("Settlement transaction {} reverted on {}", receipt.getTransactionHash(), payload.network);
            return SettleResponse.failure(ErrorReason.TRANSACTION_FAILED, payload.network, payer);
        } catch (TimeoutException e) {
            log.warn("EVM settlement on {} not confirmed within {}", payload.network, timeout);
            return SettleResponse.failure(ErrorReason.CONFIRMATION_TIMEOUT, payload.network, payer);
        } catch (LedgerRejectionException e) {
            log.warn("Node rejected settlement on {}: {}", payload.network, e.getMessage());
            ErrorReason reason = e.isInsufficientBalance()
                    ? ErrorReason.INSUFFICIENT_BALANCE
                    : ErrorReason.TRANSACTION_FAILED;
            return SettleResponse.failure(reason, payload.network, payer);
        } catch (Exception e) {
            log.error("Unexpected error during evm settlement", e);
            return SettleResponse.failure(ErrorReason.UNEXPECTED_SETTLE_ERROR, payload.network, payer);
        }
    }
}
