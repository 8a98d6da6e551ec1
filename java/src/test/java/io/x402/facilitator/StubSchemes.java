package io.x402.facilitator;

import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;
import io.x402.network.NetworkFamily;
import io.x402.schemes.ExactScheme;
import io.x402.signer.Signer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Family stand-ins that record how the dispatcher called them. */
final class StubSchemes {

    private StubSchemes() {}

    static class StubSigner implements Signer {
        private final NetworkFamily family;
        private final String address;

        StubSigner(NetworkFamily family, String address) {
            this.family = family;
            this.address = address;
        }

        @Override
        public NetworkFamily family() {
            return family;
        }

        @Override
        public String address() {
            return address;
        }
    }

    static final class EvmKey extends StubSigner {
        EvmKey(String address) {
            super(NetworkFamily.EVM, address);
        }
    }

    static final class SvmKey extends StubSigner {
        SvmKey(String address) {
            super(NetworkFamily.SVM, address);
        }
    }

    static final class StubScheme<S extends StubSigner> implements ExactScheme<S> {
        private final NetworkFamily family;
        private final Class<S> signerType;
        private final Map<String, Object> extra;
        final List<String> calls = new ArrayList<>();

        StubScheme(NetworkFamily family, Class<S> signerType, Map<String, Object> extra) {
            this.family = family;
            this.signerType = signerType;
            this.extra = extra;
        }

        @Override
        public NetworkFamily family() {
            return family;
        }

        @Override
        public Class<S> signerType() {
            return signerType;
        }

        @Override
        public PaymentPayload createPayment(S signer, int x402Version, PaymentRequirements requirements) {
            calls.add("create:" + signer.address());
            return new PaymentPayload(x402Version, SCHEME, requirements.network,
                    Map.of("transaction", "c2lnbmVk"));
        }

        @Override
        public VerifyResponse verify(S signer, PaymentPayload payload, PaymentRequirements requirements) {
            calls.add("verify:" + signer.address());
            return VerifyResponse.valid("payer-" + family.id());
        }

        @Override
        public SettleResponse settle(S signer, PaymentPayload payload, PaymentRequirements requirements) {
            calls.add("settle:" + signer.address());
            return SettleResponse.success("tx-" + family.id(), requirements.network, "payer-" + family.id());
        }

        @Override
        public Map<String, Object> supportedExtra(S signer) {
            return extra.isEmpty() ? extra : Map.of("feePayer", signer.address());
        }
    }
}
