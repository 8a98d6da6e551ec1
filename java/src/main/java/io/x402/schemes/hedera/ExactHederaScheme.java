package io.x402.schemes.hedera;

import io.x402.exception.PaymentCreationException;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;
import io.x402.network.NetworkFamily;
import io.x402.network.NetworkRegistry;
import io.x402.schemes.ExactScheme;

import java.time.Duration;
import java.util.Map;

/** Exact payments on Hedera: an HBAR or HTS token transfer whose fees the facilitator pays. */
public final class ExactHederaScheme implements ExactScheme<HederaSigner> {

    private final HederaPaymentBuilder builder;
    private final HederaVerifier verifier;
    private final HederaSettler settler;

    public ExactHederaScheme(NetworkRegistry registry, Duration settlementTimeout) {
        this.builder = new HederaPaymentBuilder();
        this.verifier = new HederaVerifier(registry);
        this.settler = new HederaSettler(verifier, settlementTimeout);
    }

    @Override
    public NetworkFamily family() {
        return NetworkFamily.HEDERA;
    }

    @Override
    public Class<HederaSigner> signerType() {
        return HederaSigner.class;
    }

    @Override
    public PaymentPayload createPayment(HederaSigner signer, int x402Version, PaymentRequirements requirements)
            throws PaymentCreationException {
        return builder.build(signer, x402Version, requirements);
    }

    @Override
    public VerifyResponse verify(HederaSigner signer, PaymentPayload payload, PaymentRequirements requirements) {
        return verifier.verify(signer, payload, requirements);
    }

    @Override
    public SettleResponse settle(HederaSigner signer, PaymentPayload payload, PaymentRequirements requirements) {
        return settler.settle(signer, payload, requirements);
    }

    @Override
    public Map<String, Object> supportedExtra(HederaSigner signer) {
        return Map.of("feePayer", signer.address());
    }
}
