package io.x402.facilitator;

import io.x402.client.Kind;
import io.x402.codec.PaymentCodec;
import io.x402.exception.PaymentCreationException;
import io.x402.exception.UnsupportedNetworkException;
import io.x402.model.ErrorReason;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;
import io.x402.network.NetworkFamily;
import io.x402.network.NetworkRegistry;
import io.x402.signer.MultiNetworkSigner;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static io.x402.facilitator.StubSchemes.*;
import static org.junit.jupiter.api.Assertions.*;

class PaymentStrategyTest {

    StubScheme<EvmKey> evm;
    StubScheme<SvmKey> svm;
    PaymentStrategy strategy;

    @BeforeEach
    void setUp() {
        evm = new StubScheme<>(NetworkFamily.EVM, EvmKey.class, Map.of());
        svm = new StubScheme<>(NetworkFamily.SVM, SvmKey.class, Map.of("feePayer", ""));
        strategy = new PaymentStrategy(NetworkRegistry.defaults(), List.of(evm, svm));
    }

    private static PaymentRequirements requirements(String scheme, String network) {
        PaymentRequirements req = new PaymentRequirements();
        req.scheme = scheme;
        req.network = network;
        req.asset = "asset";
        req.maxAmountRequired = "1000";
        req.payTo = "merchant";
        req.maxTimeoutSeconds = 60;
        return req;
    }

    private static PaymentPayload payload(String network) {
        return new PaymentPayload(1, "exact", network, Map.of("transaction", "AAAA"));
    }

    @Test
    void duplicateFamilyIsRejected() {
        StubScheme<EvmKey> second = new StubScheme<>(NetworkFamily.EVM, EvmKey.class, Map.of());

        assertThrows(IllegalArgumentException.class,
                () -> new PaymentStrategy(NetworkRegistry.defaults(), List.of(evm, second)));
    }

    @Test
    void routesByNetworkFamily() {
        MultiNetworkSigner signers = MultiNetworkSigner.of(new EvmKey("0xfacilitator"), new SvmKey("FaciLitator"));

        VerifyResponse evmResult = strategy.verify(signers, payload("base-sepolia"), requirements("exact", "base-sepolia"));
        SettleResponse svmResult = strategy.settle(signers, payload("solana"), requirements("exact", "solana"));

        assertEquals("payer-evm", evmResult.payer);
        assertEquals("tx-svm", svmResult.transaction);
        assertEquals(List.of("verify:0xfacilitator"), evm.calls);
        assertEquals(List.of("settle:FaciLitator"), svm.calls);
    }

    @Test
    void createPaymentHeaderEncodesPayload() throws Exception {
        String header = strategy.createPaymentHeader(new EvmKey("0xpayer"), 1, requirements("exact", "base"));

        PaymentPayload decoded = PaymentCodec.decode(header);
        assertEquals("base", decoded.network);
        assertEquals("exact", decoded.scheme);
        assertEquals(List.of("create:0xpayer"), evm.calls);
    }

    @Test
    void createPaymentPicksSignerOfFamily() throws Exception {
        MultiNetworkSigner signers = MultiNetworkSigner.of(new EvmKey("0xpayer"), new SvmKey("Payer"));

        strategy.createPayment(signers, 1, requirements("exact", "solana-devnet"));

        assertEquals(List.of("create:Payer"), svm.calls);
        assertTrue(evm.calls.isEmpty());
    }

    @Test
    void createPaymentFailures() {
        assertThrows(PaymentCreationException.class,
                () -> strategy.createPayment(new EvmKey("0xpayer"), 1, requirements("upto", "base")));
        assertThrows(UnsupportedNetworkException.class,
                () -> strategy.createPayment(new EvmKey("0xpayer"), 1, requirements("exact", "dogechain")));
        assertThrows(PaymentCreationException.class,
                () -> strategy.createPayment(new EvmKey("0xpayer"), 1, requirements("exact", "hedera-testnet")));
        assertThrows(IllegalArgumentException.class,
                () -> strategy.createPayment(MultiNetworkSigner.of(new EvmKey("0xpayer")), 1,
                        requirements("exact", "solana")));
    }

    @Test
    void signerOfWrongFamilyIsProgrammingError() {
        assertThrows(IllegalArgumentException.class,
                () -> strategy.verify(new SvmKey("Payer"), payload("base"), requirements("exact", "base")));
        assertThrows(IllegalArgumentException.class,
                () -> strategy.createPayment(new SvmKey("Payer"), 1, requirements("exact", "base")));
        assertTrue(evm.calls.isEmpty());
    }

    @Test
    void unsupportedSchemeOrNetworkIsInvalidScheme() {
        EvmKey signer = new EvmKey("0xfacilitator");

        assertEquals(ErrorReason.INVALID_SCHEME,
                strategy.verify(signer, payload("base"), requirements("upto", "base")).invalidReason);
        assertEquals(ErrorReason.INVALID_SCHEME,
                strategy.verify(signer, payload("dogechain"), requirements("exact", "dogechain")).invalidReason);

        SettleResponse settled = strategy.settle(signer, payload("hedera-testnet"), requirements("exact", "hedera-testnet"));
        assertFalse(settled.success);
        assertEquals(ErrorReason.INVALID_SCHEME, settled.errorReason);
        assertTrue(evm.calls.isEmpty());
    }

    @Test
    void familyWithoutFacilitatorSignerIsInvalidNetwork() {
        MultiNetworkSigner signers = MultiNetworkSigner.of(new EvmKey("0xfacilitator"));

        assertEquals(ErrorReason.INVALID_NETWORK,
                strategy.verify(signers, payload("solana"), requirements("exact", "solana")).invalidReason);
        assertEquals(ErrorReason.INVALID_NETWORK,
                strategy.settle(signers, payload("solana"), requirements("exact", "solana")).errorReason);
    }

    @Test
    void supportedListsEveryNetworkOfSignedFamilies() {
        MultiNetworkSigner signers = MultiNetworkSigner.of(new SvmKey("FeePayer"));

        List<Kind> kinds = strategy.supported(1, signers);

        assertEquals(List.of(
                new Kind(1, "exact", "solana-devnet", Map.of("feePayer", "FeePayer")),
                new Kind(1, "exact", "solana", Map.of("feePayer", "FeePayer"))), kinds);
    }

    @Test
    void supportedOmitsEmptyExtra() {
        List<Kind> kinds = strategy.supported(1, MultiNetworkSigner.of(new EvmKey("0xfacilitator")));

        assertEquals(NetworkRegistry.defaults().networksOf(NetworkFamily.EVM).size(), kinds.size());
        assertTrue(kinds.stream().allMatch(kind -> kind.extra == null));
    }
}
