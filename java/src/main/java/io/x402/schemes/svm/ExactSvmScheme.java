package io.x402.schemes.svm;

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

/** Exact payments on Solana: a SOL or SPL token transfer whose fees the facilitator pays. */
public final class ExactSvmScheme implements ExactScheme<SvmSigner> {

    private final SvmPaymentBuilder builder;
    private final SvmVerifier verifier;
    private final SvmSettler settler;

    public ExactSvmScheme(NetworkRegistry registry, Duration settlementTimeout, Duration pollInterval) {
        this.builder = new SvmPaymentBuilder();
        this.verifier = new SvmVerifier(registry);
        this.settler = new SvmSettler(verifier, settlementTimeout, pollInterval);
    }

    @Override
    public NetworkFamily family() {
        return NetworkFamily.SVM;
    }

    @Override
    public Class<SvmSigner> signerType() {
        return SvmSigner.class;
    }

    @Override
    public PaymentPayload createPayment(SvmSigner signer, int x402Version, PaymentRequirements requirements)
            throws PaymentCreationException {
        return builder.build(signer, x402Version, requirements);
    }

    @Override
    public VerifyResponse verify(SvmSigner signer, PaymentPayload payload, PaymentRequirements requirements) {
        return verifier.verify(signer, payload, requirements);
    }

    @Override
    public SettleResponse settle(SvmSigner signer, PaymentPayload payload, PaymentRequirements requirements) {
        return settler.settle(signer, payload, requirements);
    }

    @Override
    public Map<String, Object> supportedExtra(SvmSigner signer) {
        return Map.of("feePayer", signer.address());
    }
}
