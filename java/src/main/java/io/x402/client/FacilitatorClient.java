package io.x402.client;

import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;

import java.io.IOException;
import java.util.Set;

/** Contract for calling an x402 facilitator (HTTP, in-process, mock, etc.). */
public interface FacilitatorClient {
    /**
     * Verifies a payment payload against the given requirements.
     *
     * @param paymentPayload the payment payload to verify
     * @param req the payment requirements to validate against
     * @return verification response indicating if payment is valid
     * @throws IOException if the facilitator cannot be reached or answers with a non-200 status
     * @throws InterruptedException if the request is interrupted
     */
    VerifyResponse verify(PaymentPayload paymentPayload, PaymentRequirements req)
            throws IOException, InterruptedException;

    /**
     * Settles a verified payment on its ledger.
     *
     * @param paymentPayload the payment payload to settle
     * @param req the payment requirements for settlement
     * @return settlement response with the ledger transaction id if successful
     * @throws IOException if the facilitator cannot be reached or answers with a non-200 status
     * @throws InterruptedException if the request is interrupted
     */
    SettleResponse settle(PaymentPayload paymentPayload, PaymentRequirements req)
            throws IOException, InterruptedException;

    /**
     * Retrieves the set of payment kinds supported by this facilitator.
     *
     * @return set of supported payment kinds (scheme/network combinations)
     * @throws IOException if the facilitator cannot be reached or answers with a non-200 status
     * @throws InterruptedException if the request is interrupted
     */
    Set<Kind> supported() throws IOException, InterruptedException;
}
