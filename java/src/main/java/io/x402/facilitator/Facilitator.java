package io.x402.facilitator;

import io.x402.client.FacilitatorClient;
import io.x402.client.Kind;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;
import io.x402.signer.MultiNetworkSigner;

import java.util.LinkedHashSet;
import java.util.Set;

/** In-process facilitator: the strategy dispatcher bound to the facilitator's own signers. */
public final class Facilitator implements FacilitatorClient {

    public static final int X402_VERSION = 1;

    private final PaymentStrategy strategy;
    private final MultiNetworkSigner signers;

    public Facilitator(PaymentStrategy strategy, MultiNetworkSigner signers) {
        this.strategy = strategy;
        this.signers = signers;
    }

    @Override
    public VerifyResponse verify(PaymentPayload paymentPayload, PaymentRequirements req) {
        return strategy.verify(signers, paymentPayload, req);
    }

    @Override
    public SettleResponse settle(PaymentPayload paymentPayload, PaymentRequirements req) {
        return strategy.settle(signers, paymentPayload, req);
    }

    @Override
    public Set<Kind> supported() {
        return new LinkedHashSet<>(strategy.supported(X402_VERSION, signers));
    }
}
