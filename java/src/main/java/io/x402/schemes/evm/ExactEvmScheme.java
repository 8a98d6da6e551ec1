package io.x402.schemes.evm;

import io.x402.exception.PaymentCreationException;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;
import io.x402.network.NetworkFamily;
import io.x402.network.NetworkRegistry;
import io.x402.schemes.ExactScheme;

import java.time.Clock;
import java.time.Duration;

/** Exact payments on EVM chains via EIP-3009 {@code transferWithAuthorization}. */
public final class ExactEvmScheme implements ExactScheme<EvmSigner> {

    private final EvmPaymentBuilder builder;
    private final EvmVerifier verifier;
    private final EvmSettler settler;

    public ExactEvmScheme(NetworkRegistry registry, Duration settlementTimeout) {
        this(registry, settlementTimeout, Clock.systemUTC());
    }

    public ExactEvmScheme(NetworkRegistry registry, Duration settlementTimeout, Clock clock) {
        this.builder = new EvmPaymentBuilder(registry, clock);
        this.verifier = new EvmVerifier(registry, clock);
        this.settler = new EvmSettler(verifier, settlementTimeout);
    }

    @Override
    public NetworkFamily family() {
        return NetworkFamily.EVM;
    }

    @Override
    public Class<EvmSigner> signerType() {
        return EvmSigner.class;
    }

    @Override
    public PaymentPayload createPayment(EvmSigner signer, int x402Version, PaymentRequirements requirements)
            throws PaymentCreationException {
        return builder.build(signer, x402Version, requirements);
    }

    @Override
    public VerifyResponse verify(EvmSigner signer, PaymentPayload payload, PaymentRequirements requirements) {
        return verifier.verify(signer, payload, requirements);
    }

    @Override
    public SettleResponse settle(EvmSigner signer, PaymentPayload payload, PaymentRequirements requirements) {
        return settler.settle(signer, payload, requirements);
    }
}
