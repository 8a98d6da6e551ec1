package io.x402.schemes.hedera;

import com.hedera.hashgraph.sdk.AccountId;
import com.hedera.hashgraph.sdk.Hbar;
import com.hedera.hashgraph.sdk.PublicKey;
import com.hedera.hashgraph.sdk.TokenId;
import com.hedera.hashgraph.sdk.Transaction;
import com.hedera.hashgraph.sdk.TransactionId;
import com.hedera.hashgraph.sdk.TransferTransaction;
import io.x402.model.ErrorReason;
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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verifies a payer-signed Hedera transfer against the requirements. The
 * transaction is decoded in full: its transaction id must belong to this
 * facilitator and every transfer leg is checked against payTo, asset and amount.
 */
public final class HederaVerifier {

    private static final Logger log = LoggerFactory.getLogger(HederaVerifier.class);

    private final NetworkRegistry registry;

    public HederaVerifier(NetworkRegistry registry) {
        this.registry = registry;
    }

    public VerifyResponse verify(HederaSigner facilitator, PaymentPayload payload, PaymentRequirements requirements) {
        try {
            PayloadChecks.checkSchemeAndNetwork(payload, requirements, registry, NetworkFamily.HEDERA);
            TransferTransaction transaction = decode(payload);
            AccountId payer = introspect(facilitator, transaction, requirements);
            return VerifyResponse.valid(payer.toString());
        } catch (VerificationException e) {
            log.debug("Rejected hedera payment on {}: {}", requirements.network, e.getReason());
            return VerifyResponse.invalid(e.getReason(), e.getPayer());
        } catch (RuntimeException e) {
            log.error("Unexpected error verifying hedera payment", e);
            return VerifyResponse.invalid(ErrorReason.UNEXPECTED_VERIFY_ERROR, "");
        }
    }

    /** Deserializes the payload's transaction, which must be a crypto transfer. */
    TransferTransaction decode(PaymentPayload payload) throws VerificationException {
        byte[] bytes = PayloadChecks.transactionBytes(payload);
        Transaction<?> transaction;
        try {
            transaction = Transaction.fromBytes(bytes);
        } catch (Exception e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION, "", e);
        }
        if (!(transaction instanceof TransferTransaction)) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
        }
        return (TransferTransaction) transaction;
    }

    private AccountId introspect(HederaSigner facilitator, TransferTransaction transaction,
                                 PaymentRequirements requirements) throws VerificationException {
        AccountId feePayer = facilitator.getAccountId();
        if (!feePayer.equals(transactionAccount(transaction))) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE);
        }
        if (!feePayer.equals(agreedFeePayer(requirements))) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE);
        }

        if (!transaction.getTokenNftTransfers().isEmpty()) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH);
        }
        Map<AccountId, Long> legs;
        if (assetClass(requirements) == AssetClass.NATIVE) {
            if (!transaction.getTokenTransfers().isEmpty()) {
                throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH);
            }
            legs = tinybars(transaction.getHbarTransfers());
        } else {
            TokenId token = token(requirements);
            Map<TokenId, Map<AccountId, Long>> tokenTransfers = transaction.getTokenTransfers();
            if (!transaction.getHbarTransfers().isEmpty()
                    || tokenTransfers.size() != 1
                    || !tokenTransfers.containsKey(token)) {
                throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH);
            }
            legs = tokenTransfers.get(token);
        }
        AccountId payer = checkLegs(legs, requirements, feePayer);
        checkSigned(transaction, payer.toString());
        return payer;
    }

    /**
     * The payer's key is not known here, so only the presence of a signature
     * on every node body is checked; the ledger validates it at settlement.
     */
    private static void checkSigned(TransferTransaction transaction, String payer) throws VerificationException {
        Map<AccountId, Map<PublicKey, byte[]>> signatures;
        try {
            signatures = transaction.getSignatures();
        } catch (IllegalStateException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION, payer, e);
        }
        if (signatures.isEmpty() || signatures.values().stream().anyMatch(Map::isEmpty)) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE, payer);
        }
    }

    /**
     * A valid transfer has exactly two legs: {@code payTo} credited with the
     * required amount and the payer debited by the same amount. The fee payer
     * may not be the debited account, since its settlement signature would
     * authorize that debit.
     */
    private static AccountId checkLegs(Map<AccountId, Long> legs, PaymentRequirements requirements,
                                       AccountId feePayer) throws VerificationException {
        long amount;
        try {
            amount = Amounts.parseInt64(requirements.maxAmountRequired);
        } catch (IllegalArgumentException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_AMOUNT_MISMATCH, "", e);
        }
        AccountId payTo;
        try {
            payTo = AccountId.fromString(requirements.payTo);
        } catch (RuntimeException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_RECIPIENT_MISMATCH, "", e);
        }
        if (legs.size() != 2) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
        }
        Long credit = legs.get(payTo);
        if (credit == null) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_RECIPIENT_MISMATCH);
        }
        AccountId payer = null;
        for (AccountId account : legs.keySet()) {
            if (!account.equals(payTo)) {
                payer = account;
            }
        }
        String payerId = payer.toString();
        if (credit != amount || legs.get(payer) != -amount) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_AMOUNT_MISMATCH, payerId);
        }
        if (payer.equals(feePayer)) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION, payerId);
        }
        return payer;
    }

    private static AccountId transactionAccount(TransferTransaction transaction) throws VerificationException {
        TransactionId transactionId;
        try {
            transactionId = transaction.getTransactionId();
        } catch (IllegalStateException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION, "", e);
        }
        if (transactionId == null || transactionId.accountId == null) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION);
        }
        return transactionId.accountId;
    }

    private static AccountId agreedFeePayer(PaymentRequirements requirements) throws VerificationException {
        String feePayer = requirements.feePayerOrNull();
        if (feePayer == null) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE);
        }
        try {
            return AccountId.fromString(feePayer);
        } catch (RuntimeException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE, "", e);
        }
    }

    private static AssetClass assetClass(PaymentRequirements requirements) throws VerificationException {
        try {
            return HederaAssets.classify(requirements.asset);
        } catch (IllegalArgumentException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH, "", e);
        }
    }

    private static TokenId token(PaymentRequirements requirements) throws VerificationException {
        try {
            return HederaAssets.parseToken(requirements.asset);
        } catch (RuntimeException e) {
            throw new VerificationException(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH, "", e);
        }
    }

    private static Map<AccountId, Long> tinybars(Map<AccountId, Hbar> transfers) {
        Map<AccountId, Long> legs = new LinkedHashMap<>();
        transfers.forEach((account, hbar) -> legs.put(account, hbar.toTinybars()));
        return legs;
    }
}
