package io.x402.schemes;

import io.x402.exception.PaymentCreationException;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;
import io.x402.network.NetworkFamily;
import io.x402.signer.Signer;

import java.util.Map;

/**
 * The "exact amount" payment scheme on one network family: build on the
 * client side, verify and settle on the facilitator side.
 *
 * @param <S> signer type of the family
 */
public interface ExactScheme<S extends Signer> {

    String SCHEME = "exact";

    NetworkFamily family();

    Class<S> signerType();

    /**
     * Builds and signs a payment instrument for the requirements.
     *
     * @throws PaymentCreationException if no instrument can be produced
     */
    PaymentPayload createPayment(S signer, int x402Version, PaymentRequirements requirements)
            throws PaymentCreationException;

    /** Checks the payload against the requirements without touching ledger state. Never throws. */
    VerifyResponse verify(S signer, PaymentPayload payload, PaymentRequirements requirements);

    /** Re-verifies, then submits the payload and waits for the outcome. Never throws. */
    SettleResponse settle(S signer, PaymentPayload payload, PaymentRequirements requirements);

    /** Extra fields advertised for this family by {@code /supported}. */
    default Map<String, Object> supportedExtra(S signer) {
        return Map.of();
    }
}
