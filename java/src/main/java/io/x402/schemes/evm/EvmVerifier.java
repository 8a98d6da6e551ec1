package io.x402.schemes.evm;

import io.x402.codec.Json;
import io.x402.model.ErrorReason;
import io.x402.model.ExactEvmPayload;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.VerifyResponse;
import io.x402.network.NetworkFamily;
import io.x402.network.NetworkRegistry;
import io.x402.schemes.Amounts;
import io.x402.schemes.AssetClass;
import io.x402.schemes.PayloadChecks;
import io.x402.schemes.VerificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SignatureException;
import java.time.Clock;

/**
 * Verifies an EIP-3009 authorization: the signature, its terms against the
 * requirements, its validity window and the payer's token balance.
 */
public final class EvmVerifier {

    private static final Logger log = LoggerFactory.getLogger(EvmVerifier.class);

    /** An authorization must stay valid at least this long for settlement to land. */
    static final long MIN_VALIDITY_SECONDS = 6;

    private final NetworkRegistry registry;
    private final Clock clock;

    public EvmVerifier(NetworkRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public VerifyResponse verify(EvmSigner facilitator, PaymentPayload payload, PaymentRequirements requirements) {
        String payer = "";
        try {
            PayloadChecks.checkSchemeAndNetwork(payload, requirements, registry, NetworkFamily.EVM);
            ExactEvmPayload evm = decode(payload);
            payer = evm.authorization.from;
            checkAsset(requirements);
            checkSignature(evm, requirements);
            checkTerms(evm.authorization, requirements);
            checkBalance(facilitator, requirements.asset, evm.authorization);
            return VerifyResponse.valid(payer);
        } catch (VerificationException e) {
            log.debug("Rejected evm payment on {}: {}", requirements.network, e.getReason());
            return VerifyResponse.invalid(e.getReason(), e.getPayer().isEmpty() ? payer : e.getPayer());
        } catch (IOException e) {
            log.error("Balance lookup failed on {}", requirements.network, e);
            return VerifyResponse.invalid(ErrorReason.UNEXPECTED_VERIFY_ERROR, payer);
        } catch (RuntimeException e) {
            log.error("Unexpected error verifying evm payment", e);
            return VerifyResponse.invalid(ErrorReason.UNEXPECTED_VERIFY_ERROR, payer);
        }
    }

    /** Typed view of the payload; every authorization field must be present. */
    ExactEvmPayload decode(PaymentPayload payload) throws VerificationException {
        if (payload.payload == null) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
        }
        ExactEvmPayload evm;
        try {
            evm = Json.MAPPER.convertValue(payload.payload, ExactEvmPayload.class);
        } catch (IllegalArgumentException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION, "", e);
        }
        ExactEvmPayload.Authorization a = evm.authorization;
        if (evm.signature == null || a == null || a.from == null || a.to == null || a.value == null
                || a.validAfter == null || a.validBefore == null || a.nonce == null) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
        }
        if (!EvmAssets.isAddress(a.from)) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
        }
        return evm;
    }

    private static void checkAsset(PaymentRequirements requirements) throws VerificationException {
        if (requirements.asset == null
                || EvmAssets.classify(requirements.asset) == AssetClass.NATIVE
                || !EvmAssets.isAddress(requirements.asset)) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH);
        }
    }

    private void checkSignature(ExactEvmPayload evm, PaymentRequirements requirements) throws VerificationException {
        if (requirements.extra == null || requirements.extra.name == null || requirements.extra.version == null) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE);
        }
        String signer;
        try {
            byte[] digest = TransferAuthorizationTypedData.digest(requirements.extra.name, requirements.extra.version,
                    registry.chainId(requirements.network), requirements.asset, evm.authorization);
            signer = EvmSignatures.recoverAddress(digest, EvmSignatures.parse(evm.signature));
        } catch (IOException | SignatureException | RuntimeException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE, "", e);
        }
        if (!signer.equalsIgnoreCase(evm.authorization.from)) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE);
        }
    }

    private void checkTerms(ExactEvmPayload.Authorization authorization, PaymentRequirements requirements)
            throws VerificationException {
        if (requirements.payTo == null || !requirements.payTo.equalsIgnoreCase(authorization.to)) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_RECIPIENT_MISMATCH);
        }
        BigInteger validAfter = number(authorization.validAfter);
        BigInteger validBefore = number(authorization.validBefore);
        BigInteger now = BigInteger.valueOf(clock.instant().getEpochSecond());
        if (validBefore.compareTo(now.add(BigInteger.valueOf(MIN_VALIDITY_SECONDS))) < 0) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_AUTHORIZATION_VALID_BEFORE);
        }
        if (validAfter.compareTo(now) > 0) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_AUTHORIZATION_VALID_AFTER);
        }
        BigInteger required;
        try {
            required = Amounts.parse(requirements.maxAmountRequired);
        } catch (IllegalArgumentException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_AMOUNT_MISMATCH, "", e);
        }
        if (!required.equals(number(authorization.value))) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_AMOUNT_MISMATCH);
        }
    }

    private static void checkBalance(EvmSigner facilitator, String asset, ExactEvmPayload.Authorization authorization)
            throws VerificationException, IOException {
        BigInteger balance = facilitator.getLedger().balanceOf(asset, authorization.from);
        if (balance.compareTo(new BigInteger(authorization.value)) < 0) {
            throw new VerificationException(ErrorReason.INSUFFICIENT_BALANCE);
        }
    }

    private static BigInteger number(String value) throws VerificationException {
        try {
            return Amounts.parse(value);
        } catch (IllegalArgumentException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION, "", e);
        }
    }
}
