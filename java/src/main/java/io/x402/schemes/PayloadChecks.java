package io.x402.schemes;

import io.x402.codec.Json;
import io.x402.codec.PaymentCodec;
import io.x402.model.ErrorReason;
import io.x402.model.ExactTransactionPayload;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.network.NetworkFamily;
import io.x402.network.NetworkRegistry;

import java.util.Base64;
import java.util.Map;

/** Verification steps shared by every family. */
public final class PayloadChecks {

    private PayloadChecks() {}

    /**
     * Both sides must use the exact scheme, the payload must target the required
     * network, and that network must belong to {@code family}.
     */
    public static void checkSchemeAndNetwork(PaymentPayload payload, PaymentRequirements requirements,
                                             NetworkRegistry registry, NetworkFamily family)
            throws VerificationException {
        if (!ExactScheme.SCHEME.equals(payload.scheme) || !ExactScheme.SCHEME.equals(requirements.scheme)) {
            throw new VerificationException(ErrorReason.UNSUPPORTED_SCHEME);
        }
        if (payload.network == null
                || !payload.network.equals(requirements.network)
                || !registry.isNetworkOf(family, requirements.network)) {
            throw new VerificationException(ErrorReason.INVALID_NETWORK);
        }
    }

    /** Raw bytes of the serialized transaction carried by a Hedera or Solana payload. */
    public static byte[] transactionBytes(PaymentPayload payload) throws VerificationException {
        if (payload.payload == null) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
        }
        ExactTransactionPayload body;
        try {
            body = Json.MAPPER.convertValue(payload.payload, ExactTransactionPayload.class);
        } catch (IllegalArgumentException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION, "", e);
        }
        if (body.transaction == null || body.transaction.isEmpty()) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
        }
        try {
            return Base64.getDecoder().decode(body.transaction);
        } catch (IllegalArgumentException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION, "", e);
        }
    }

    /** Payload body of a transaction-based family. */
    public static Map<String, Object> transactionPayload(byte[] signedTransaction) {
        ExactTransactionPayload body = new ExactTransactionPayload(Base64.getEncoder().encodeToString(signedTransaction));
        return Json.MAPPER.convertValue(body, PaymentCodec.PAYLOAD_MAP);
    }
}
