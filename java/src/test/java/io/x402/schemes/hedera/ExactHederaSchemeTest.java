package io.x402.schemes.hedera;

import com.hedera.hashgraph.sdk.AccountId;
import com.hedera.hashgraph.sdk.Client;
import com.hedera.hashgraph.sdk.Hbar;
import com.hedera.hashgraph.sdk.PrivateKey;
import com.hedera.hashgraph.sdk.Status;
import com.hedera.hashgraph.sdk.Transaction;
import com.hedera.hashgraph.sdk.TransactionId;
import com.hedera.hashgraph.sdk.TransferTransaction;
import io.x402.exception.FeePayerRequiredException;
import io.x402.model.ErrorReason;
import io.x402.model.PaymentExtra;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;
import io.x402.network.NetworkRegistry;
import io.x402.schemes.PayloadChecks;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ExactHederaSchemeTest {

    static final AccountId PAYER = AccountId.fromString("0.0.123456");
    static final AccountId FACILITATOR = AccountId.fromString("0.0.999999");
    static final String PAY_TO = "0.0.789012";

    static Client client;

    FakeLedger ledger;
    HederaSigner payer;
    HederaSigner facilitator;
    ExactHederaScheme scheme;

    /** Records submissions instead of talking to consensus nodes. */
    static class FakeLedger implements HederaLedger {
        Status status = Status.SUCCESS;
        boolean timesOut;
        int submissions;

        @Override
        public HederaReceipt submit(Transaction<?> transaction, Duration timeout) throws TimeoutException {
            submissions++;
            if (timesOut) {
                throw new TimeoutException("no receipt within " + timeout);
            }
            return new HederaReceipt(transaction.getTransactionId().toString(), status);
        }
    }

    @BeforeAll
    static void createClient() {
        // a fixed address book so nothing is fetched from a mirror node
        client = Client.forNetwork(Map.of("127.0.0.1:50211", AccountId.fromString("0.0.3")));
    }

    @AfterAll
    static void closeClient() throws Exception {
        client.close();
    }

    @BeforeEach
    void setUp() {
        ledger = new FakeLedger();
        payer = new HederaSigner(client, PAYER, PrivateKey.generateECDSA(), ledger);
        facilitator = new HederaSigner(client, FACILITATOR, PrivateKey.generateECDSA(), ledger);
        scheme = new ExactHederaScheme(NetworkRegistry.defaults(), Duration.ofSeconds(30));
    }

    private static PaymentRequirements requirements(String asset) {
        PaymentRequirements req = new PaymentRequirements();
        req.scheme = "exact";
        req.network = "hedera-testnet";
        req.asset = asset;
        req.maxAmountRequired = "50000000";
        req.payTo = PAY_TO;
        req.resource = "https://api.example.com/premium";
        req.maxTimeoutSeconds = 60;
        req.extra = PaymentExtra.feePayer(FACILITATOR.toString());
        return req;
    }

    private PaymentPayload pay(PaymentRequirements req) throws Exception {
        return scheme.createPayment(payer, 1, req);
    }

    @Test
    void hbarPaymentVerifiesAndSettles() throws Exception {
        PaymentRequirements req = requirements("hbar");
        PaymentPayload payload = pay(req);

        assertEquals("exact", payload.scheme);
        assertEquals("hedera-testnet", payload.network);

        VerifyResponse verified = scheme.verify(facilitator, payload, req);
        assertTrue(verified.isValid, () -> "rejected: " + verified.invalidReason);
        assertEquals("0.0.123456", verified.payer);

        SettleResponse settled = scheme.settle(facilitator, payload, req);
        assertTrue(settled.success);
        assertFalse(settled.transaction.isEmpty());
        assertTrue(settled.transaction.startsWith("0.0.999999@"));
        assertEquals("hedera-testnet", settled.network);
        assertEquals("0.0.123456", settled.payer);
        assertEquals(1, ledger.submissions);
    }

    @Test
    void builtTransactionIsPaidByFeePayer() throws Exception {
        PaymentPayload payload = pay(requirements("HBAR"));

        TransferTransaction transaction = (TransferTransaction) Transaction.fromBytes(
                PayloadChecks.transactionBytes(payload));
        TransactionId id = transaction.getTransactionId();
        assertEquals(FACILITATOR, id.accountId);
        Map<AccountId, Hbar> legs = transaction.getHbarTransfers();
        assertEquals(2, legs.size());
        assertEquals(-50_000_000L, legs.get(PAYER).toTinybars());
        assertEquals(50_000_000L, legs.get(AccountId.fromString(PAY_TO)).toTinybars());
    }

    @Test
    void validDurationIsClampedToNetworkLimits() throws Exception {
        PaymentRequirements req = requirements("hbar");

        req.maxTimeoutSeconds = 5;
        TransferTransaction raisedToMinimum = (TransferTransaction) Transaction.fromBytes(
                PayloadChecks.transactionBytes(pay(req)));
        assertEquals(Duration.ofSeconds(15), raisedToMinimum.getTransactionValidDuration());

        req.maxTimeoutSeconds = 600;
        TransferTransaction cappedAtMaximum = (TransferTransaction) Transaction.fromBytes(
                PayloadChecks.transactionBytes(pay(req)));
        assertEquals(Duration.ofSeconds(180), cappedAtMaximum.getTransactionValidDuration());

        req.maxTimeoutSeconds = 60;
        TransferTransaction within = (TransferTransaction) Transaction.fromBytes(
                PayloadChecks.transactionBytes(pay(req)));
        assertEquals(Duration.ofSeconds(60), within.getTransactionValidDuration());
    }

    @Test
    void tokenPaymentVerifies() throws Exception {
        PaymentRequirements req = requirements("0.0.456858");
        PaymentPayload payload = pay(req);

        VerifyResponse verified = scheme.verify(facilitator, payload, req);
        assertTrue(verified.isValid, () -> "rejected: " + verified.invalidReason);
        assertEquals("0.0.123456", verified.payer);
    }

    @Test
    void missingFeePayerFailsBeforeSigning() {
        PaymentRequirements req = requirements("hbar");
        req.extra = null;

        assertThrows(FeePayerRequiredException.class, () -> pay(req));

        req.extra = PaymentExtra.feePayer("  ");
        assertThrows(FeePayerRequiredException.class, () -> pay(req));
    }

    @Test
    void malformedAmountIsRejectedByBuilder() {
        PaymentRequirements req = requirements("hbar");
        req.maxAmountRequired = "0.5";

        assertThrows(Exception.class, () -> pay(req));
    }

    @Test
    void networkMismatchIsInvalidNetwork() throws Exception {
        PaymentPayload payload = pay(requirements("hbar"));
        PaymentRequirements mainnet = requirements("hbar");
        mainnet.network = "hedera-mainnet";

        VerifyResponse response = scheme.verify(facilitator, payload, mainnet);

        assertFalse(response.isValid);
        assertEquals(ErrorReason.INVALID_NETWORK, response.invalidReason);
    }

    @Test
    void nonHederaNetworkIsInvalidNetwork() throws Exception {
        PaymentPayload payload = pay(requirements("hbar"));
        payload.network = "base";
        PaymentRequirements req = requirements("hbar");
        req.network = "base";

        assertEquals(ErrorReason.INVALID_NETWORK, scheme.verify(facilitator, payload, req).invalidReason);
    }

    @Test
    void otherSchemeIsUnsupported() throws Exception {
        PaymentRequirements req = requirements("hbar");
        PaymentPayload payload = pay(req);
        payload.scheme = "upto";

        assertEquals(ErrorReason.UNSUPPORTED_SCHEME, scheme.verify(facilitator, payload, req).invalidReason);
    }

    @Test
    void agreedFeePayerMustMatch() throws Exception {
        PaymentRequirements req = requirements("hbar");
        PaymentPayload payload = pay(req);
        req.extra = PaymentExtra.feePayer("0.0.555555");

        VerifyResponse response = scheme.verify(facilitator, payload, req);

        assertFalse(response.isValid);
        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE, response.invalidReason);
    }

    @Test
    void anotherFacilitatorCannotSettle() throws Exception {
        PaymentRequirements req = requirements("hbar");
        PaymentPayload payload = pay(req);
        HederaSigner stranger = new HederaSigner(client, AccountId.fromString("0.0.555555"),
                PrivateKey.generateECDSA(), ledger);

        SettleResponse response = scheme.settle(stranger, payload, req);

        assertFalse(response.success);
        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE, response.errorReason);
        assertEquals(0, ledger.submissions);
    }

    @Test
    void amountMustBeExact() throws Exception {
        PaymentPayload payload = pay(requirements("hbar"));
        PaymentRequirements higher = requirements("hbar");
        higher.maxAmountRequired = "60000000";

        VerifyResponse response = scheme.verify(facilitator, payload, higher);

        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION_AMOUNT_MISMATCH, response.invalidReason);
        assertEquals("0.0.123456", response.payer);
    }

    @Test
    void recipientMustMatch() throws Exception {
        PaymentPayload payload = pay(requirements("hbar"));
        PaymentRequirements other = requirements("hbar");
        other.payTo = "0.0.111111";

        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION_RECIPIENT_MISMATCH,
                scheme.verify(facilitator, payload, other).invalidReason);
    }

    @Test
    void assetClassMustMatch() throws Exception {
        PaymentPayload hbarPayload = pay(requirements("hbar"));
        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH,
                scheme.verify(facilitator, hbarPayload, requirements("0.0.456858")).invalidReason);

        PaymentPayload tokenPayload = pay(requirements("0.0.456858"));
        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH,
                scheme.verify(facilitator, tokenPayload, requirements("hbar")).invalidReason);
        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH,
                scheme.verify(facilitator, tokenPayload, requirements("0.0.456859")).invalidReason);
    }

    @Test
    void feePayerCannotBeTheDebitedAccount() throws Exception {
        PaymentRequirements req = requirements("hbar");
        HederaSigner selfPaying = new HederaSigner(client, FACILITATOR, PrivateKey.generateECDSA(), ledger);
        PaymentPayload payload = scheme.createPayment(selfPaying, 1, req);

        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION, scheme.verify(facilitator, payload, req).invalidReason);
    }

    @Test
    void unsignedTransferIsRejected() throws Exception {
        PaymentRequirements req = requirements("hbar");
        TransferTransaction unsigned = new TransferTransaction()
                .setTransactionId(TransactionId.generate(FACILITATOR))
                .addHbarTransfer(PAYER, Hbar.fromTinybars(-50_000_000L))
                .addHbarTransfer(AccountId.fromString(PAY_TO), Hbar.fromTinybars(50_000_000L))
                .freezeWith(client);
        PaymentPayload payload = new PaymentPayload(1, "exact", "hedera-testnet",
                PayloadChecks.transactionPayload(unsigned.toBytes()));

        VerifyResponse verified = scheme.verify(facilitator, payload, req);
        assertFalse(verified.isValid);
        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION_SIGNATURE, verified.invalidReason);
        assertEquals("0.0.123456", verified.payer);

        assertFalse(scheme.settle(facilitator, payload, req).success);
        assertEquals(0, ledger.submissions);
    }

    @Test
    void garbageTransactionIsInvalidPayload() {
        PaymentRequirements req = requirements("hbar");
        PaymentPayload payload = new PaymentPayload(1, "exact", "hedera-testnet", Map.of("transaction", "AQID"));

        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION, scheme.verify(facilitator, payload, req).invalidReason);

        payload.payload = Map.of("transaction", "%%%");
        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION, scheme.verify(facilitator, payload, req).invalidReason);

        payload.payload = Map.of();
        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION, scheme.verify(facilitator, payload, req).invalidReason);
    }

    @Test
    void verifyIsIdempotent() throws Exception {
        PaymentRequirements req = requirements("hbar");
        PaymentPayload payload = pay(req);

        assertEquals(scheme.verify(facilitator, payload, req), scheme.verify(facilitator, payload, req));
        assertEquals(0, ledger.submissions);
    }

    @Test
    void settleStopsAtVerificationFailure() throws Exception {
        PaymentPayload payload = pay(requirements("hbar"));
        PaymentRequirements other = requirements("hbar");
        other.payTo = "0.0.111111";

        SettleResponse response = scheme.settle(facilitator, payload, other);

        assertFalse(response.success);
        assertEquals(ErrorReason.INVALID_PAYLOAD_TRANSACTION_RECIPIENT_MISMATCH, response.errorReason);
        assertEquals("", response.transaction);
        assertEquals(0, ledger.submissions);
    }

    @Test
    void settlementTimeoutIsReported() throws Exception {
        PaymentRequirements req = requirements("hbar");
        PaymentPayload payload = pay(req);
        ledger.timesOut = true;

        SettleResponse response = scheme.settle(facilitator, payload, req);

        assertFalse(response.success);
        assertEquals(ErrorReason.CONFIRMATION_TIMEOUT, response.errorReason);
        assertEquals("", response.transaction);
        assertEquals(1, ledger.submissions);
    }

    @Test
    void insufficientBalanceStatusIsMapped() throws Exception {
        PaymentRequirements req = requirements("hbar");
        PaymentPayload payload = pay(req);
        ledger.status = Status.INSUFFICIENT_ACCOUNT_BALANCE;

        SettleResponse response = scheme.settle(facilitator, payload, req);

        assertFalse(response.success);
        assertEquals(ErrorReason.INSUFFICIENT_BALANCE, response.errorReason);
        assertEquals("0.0.123456", response.payer);
    }

    @Test
    void otherFailureStatusIsTransactionFailed() {
        assertEquals(ErrorReason.TRANSACTION_FAILED, HederaSettler.reasonFor(Status.DUPLICATE_TRANSACTION));
        assertEquals(ErrorReason.INSUFFICIENT_BALANCE, HederaSettler.reasonFor(Status.INSUFFICIENT_TOKEN_BALANCE));
    }

    @Test
    void advertisesFeePayer() {
        assertEquals(Map.of("feePayer", "0.0.999999"), scheme.supportedExtra(facilitator));
    }
}
