package io.x402.schemes.evm;

import io.x402.codec.Json;
import io.x402.codec.PaymentCodec;
import io.x402.exception.PaymentCreationException;
import io.x402.model.ExactEvmPayload;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.network.NetworkRegistry;
import io.x402.schemes.Amounts;
import io.x402.schemes.AssetClass;
import io.x402.schemes.ExactScheme;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;

/**
 * Signs an EIP-3009 transfer authorization for an exact payment. Nothing is
 * submitted; the facilitator relays the authorization and pays the gas.
 */
public final class EvmPaymentBuilder {

    /** Back-dating of {@code validAfter} that absorbs clock drift between client and chain. */
    static final long VALID_AFTER_SKEW_SECONDS = 600;

    private final NetworkRegistry registry;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public EvmPaymentBuilder(NetworkRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public PaymentPayload build(EvmSigner signer, int x402Version, PaymentRequirements requirements)
            throws PaymentCreationException {
        if (requirements.asset == null || EvmAssets.classify(requirements.asset) == AssetClass.NATIVE) {
            throw new PaymentCreationException(
                    "Native currency cannot be paid with a transfer authorization on " + requirements.network);
        }
        if (!EvmAssets.isAddress(requirements.asset)) {
            throw new PaymentCreationException("Invalid token contract address: " + requirements.asset);
        }
        if (!EvmAssets.isAddress(requirements.payTo)) {
            throw new PaymentCreationException("Invalid payTo address: " + requirements.payTo);
        }
        BigInteger value;
        try {
            value = Amounts.parse(requirements.maxAmountRequired);
        } catch (IllegalArgumentException e) {
            throw new PaymentCreationException(e.getMessage(), e);
        }
        if (requirements.extra == null || requirements.extra.name == null || requirements.extra.version == null) {
            throw new PaymentCreationException(
                    "extra.name and extra.version (the token's EIP-712 domain) are required on " + requirements.network);
        }

        long now = clock.instant().getEpochSecond();
        byte[] nonce = new byte[32];
        random.nextBytes(nonce);

        ExactEvmPayload.Authorization authorization = new ExactEvmPayload.Authorization();
        authorization.from = signer.address();
        authorization.to = requirements.payTo;
        authorization.value = value.toString();
        authorization.validAfter = Long.toString(now - VALID_AFTER_SKEW_SECONDS);
        authorization.validBefore = Long.toString(now + requirements.maxTimeoutSeconds);
        authorization.nonce = Numeric.toHexString(nonce);

        byte[] digest;
        try {
            digest = TransferAuthorizationTypedData.digest(requirements.extra.name, requirements.extra.version,
                    registry.chainId(requirements.network), requirements.asset, authorization);
        } catch (IOException | RuntimeException e) {
            throw new PaymentCreationException("Cannot hash transfer authorization: " + e.getMessage(), e);
        }
        String signature = EvmSignatures.sign(digest, signer.getCredentials().getEcKeyPair());

        return new PaymentPayload(x402Version, ExactScheme.SCHEME, requirements.network,
                Json.MAPPER.convertValue(new ExactEvmPayload(signature, authorization), PaymentCodec.PAYLOAD_MAP));
    }
}
