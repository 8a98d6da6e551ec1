package io.x402.facilitator;

import io.x402.client.Kind;
import io.x402.config.X402Config;
import io.x402.exception.PaymentCreationException;
import io.x402.model.ErrorReason;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;
import io.x402.network.NetworkFamily;
import io.x402.network.NetworkRegistry;
import io.x402.schemes.ExactScheme;
import io.x402.schemes.evm.ExactEvmScheme;
import io.x402.schemes.hedera.ExactHederaScheme;
import io.x402.schemes.svm.ExactSvmScheme;
import io.x402.signer.MultiNetworkSigner;
import io.x402.signer.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes payment operations to the exact scheme of the requirements' network
 * family. Built once at startup and shared; it holds no per-request state.
 *
 * <p>Verify and settle never throw for unsupported schemes or networks; they
 * answer {@code invalid_scheme}. Passing a signer of the wrong family is a
 * programming error and fails with {@link IllegalArgumentException} before any
 * family logic runs.
 */
public final class PaymentStrategy {

    private static final Logger log = LoggerFactory.getLogger(PaymentStrategy.class);

    private final NetworkRegistry registry;
    private final Map<NetworkFamily, ExactScheme<?>> schemes;

    /**
     * @throws IllegalArgumentException if two schemes serve the same family
     */
    public PaymentStrategy(NetworkRegistry registry, List<ExactScheme<?>> schemes) {
        Map<NetworkFamily, ExactScheme<?>> byFamily = new EnumMap<>(NetworkFamily.class);
        for (ExactScheme<?> scheme : schemes) {
            if (byFamily.putIfAbsent(scheme.family(), scheme) != null) {
                throw new IllegalArgumentException("Multiple schemes given for family " + scheme.family().id());
            }
        }
        this.registry = registry;
        this.schemes = Collections.unmodifiableMap(byFamily);
    }

    /** Strategy over the default registry with the exact scheme of every family. */
    public static PaymentStrategy defaults(X402Config config) {
        NetworkRegistry registry = NetworkRegistry.defaults();
        return new PaymentStrategy(registry, List.of(
                new ExactEvmScheme(registry, config.getSettlementTimeout()),
                new ExactSvmScheme(registry, config.getSettlementTimeout(), config.getPollInterval()),
                new ExactHederaScheme(registry, config.getSettlementTimeout())));
    }

    public NetworkRegistry registry() {
        return registry;
    }

    /**
     * Builds and signs a payment for the requirements.
     *
     * @throws PaymentCreationException if the scheme is not "exact" or the family cannot build the payment
     * @throws io.x402.exception.UnsupportedNetworkException if the network is unknown
     * @throws IllegalArgumentException if the signer belongs to another family
     */
    public PaymentPayload createPayment(Signer signer, int x402Version, PaymentRequirements requirements)
            throws PaymentCreationException {
        ExactScheme<?> scheme = schemeForPayment(requirements);
        return create(scheme, signer, x402Version, requirements);
    }

    /** As {@link #createPayment(Signer, int, PaymentRequirements)}, picking the signer of the network's family. */
    public PaymentPayload createPayment(MultiNetworkSigner signers, int x402Version, PaymentRequirements requirements)
            throws PaymentCreationException {
        ExactScheme<?> scheme = schemeForPayment(requirements);
        Signer signer = signers.forFamily(scheme.family()).orElseThrow(() -> new IllegalArgumentException(
                "No signer for family " + scheme.family().id() + " of network " + requirements.network));
        return create(scheme, signer, x402Version, requirements);
    }

    /** Value for the {@code X-PAYMENT} header. */
    public String createPaymentHeader(Signer signer, int x402Version, PaymentRequirements requirements)
            throws PaymentCreationException {
        return createPayment(signer, x402Version, requirements).toHeader();
    }

    public String createPaymentHeader(MultiNetworkSigner signers, int x402Version, PaymentRequirements requirements)
            throws PaymentCreationException {
        return createPayment(signers, x402Version, requirements).toHeader();
    }

    public VerifyResponse verify(Signer signer, PaymentPayload payload, PaymentRequirements requirements) {
        Optional<ExactScheme<?>> scheme = resolve(payload, requirements);
        if (scheme.isEmpty()) {
            return VerifyResponse.invalid(ErrorReason.INVALID_SCHEME, "");
        }
        return verify(scheme.get(), signer, payload, requirements);
    }

    /**
     * Verifies with the facilitator's signer of the network's family. A family
     * with no configured signer is answered with {@code invalid_network}.
     */
    public VerifyResponse verify(MultiNetworkSigner signers, PaymentPayload payload, PaymentRequirements requirements) {
        Optional<ExactScheme<?>> scheme = resolve(payload, requirements);
        if (scheme.isEmpty()) {
            return VerifyResponse.invalid(ErrorReason.INVALID_SCHEME, "");
        }
        Optional<Signer> signer = signers.forFamily(scheme.get().family());
        if (signer.isEmpty()) {
            log.debug("No facilitator signer for {}", requirements.network);
            return VerifyResponse.invalid(ErrorReason.INVALID_NETWORK, "");
        }
        return verify(scheme.get(), signer.get(), payload, requirements);
    }

    public SettleResponse settle(Signer signer, PaymentPayload payload, PaymentRequirements requirements) {
        Optional<ExactScheme<?>> scheme = resolve(payload, requirements);
        if (scheme.isEmpty()) {
            return SettleResponse.failure(ErrorReason.INVALID_SCHEME, requirements.network, "");
        }
        return settle(scheme.get(), signer, payload, requirements);
    }

    public SettleResponse settle(MultiNetworkSigner signers, PaymentPayload payload, PaymentRequirements requirements) {
        Optional<ExactScheme<?>> scheme = resolve(payload, requirements);
        if (scheme.isEmpty()) {
            return SettleResponse.failure(ErrorReason.INVALID_SCHEME, requirements.network, "");
        }
        Optional<Signer> signer = signers.forFamily(scheme.get().family());
        if (signer.isEmpty()) {
            log.debug("No facilitator signer for {}", requirements.network);
            return SettleResponse.failure(ErrorReason.INVALID_NETWORK, requirements.network, "");
        }
        return settle(scheme.get(), signer.get(), payload, requirements);
    }

    /** Kinds served with the given facilitator signers, one per network of each signed family. */
    public List<Kind> supported(int x402Version, MultiNetworkSigner signers) {
        List<Kind> kinds = new ArrayList<>();
        for (ExactScheme<?> scheme : schemes.values()) {
            Optional<Signer> signer = signers.forFamily(scheme.family());
            if (signer.isEmpty()) {
                continue;
            }
            Map<String, Object> extra = supportedExtra(scheme, signer.get());
            for (String network : registry.networksOf(scheme.family())) {
                kinds.add(new Kind(x402Version, ExactScheme.SCHEME, network, extra.isEmpty() ? null : extra));
            }
        }
        return kinds;
    }

    private ExactScheme<?> schemeForPayment(PaymentRequirements requirements) throws PaymentCreationException {
        if (!ExactScheme.SCHEME.equals(requirements.scheme)) {
            throw new PaymentCreationException("Unsupported scheme: " + requirements.scheme);
        }
        NetworkFamily family = registry.classify(requirements.network);
        ExactScheme<?> scheme = schemes.get(family);
        if (scheme == null) {
            throw new PaymentCreationException("No exact scheme configured for network " + requirements.network);
        }
        return scheme;
    }

    private Optional<ExactScheme<?>> resolve(PaymentPayload payload, PaymentRequirements requirements) {
        if (payload == null || requirements == null
                || !ExactScheme.SCHEME.equals(payload.scheme)
                || !ExactScheme.SCHEME.equals(requirements.scheme)
                || requirements.network == null
                || !registry.isSupported(requirements.network)) {
            return Optional.empty();
        }
        return Optional.ofNullable(schemes.get(registry.classify(requirements.network)));
    }

    private static <S extends Signer> PaymentPayload create(ExactScheme<S> scheme, Signer signer, int x402Version,
                                                            PaymentRequirements requirements)
            throws PaymentCreationException {
        return scheme.createPayment(narrow(scheme, signer), x402Version, requirements);
    }

    private static <S extends Signer> VerifyResponse verify(ExactScheme<S> scheme, Signer signer,
                                                            PaymentPayload payload, PaymentRequirements requirements) {
        return scheme.verify(narrow(scheme, signer), payload, requirements);
    }

    private static <S extends Signer> SettleResponse settle(ExactScheme<S> scheme, Signer signer,
                                                            PaymentPayload payload, PaymentRequirements requirements) {
        return scheme.settle(narrow(scheme, signer), payload, requirements);
    }

    private static <S extends Signer> Map<String, Object> supportedExtra(ExactScheme<S> scheme, Signer signer) {
        return scheme.supportedExtra(narrow(scheme, signer));
    }

    private static <S extends Signer> S narrow(ExactScheme<S> scheme, Signer signer) {
        if (!scheme.signerType().isInstance(signer)) {
            throw new IllegalArgumentException("Signer for " + signer.family().id()
                    + " cannot be used on the " + scheme.family().id() + " family");
        }
        return scheme.signerType().cast(signer);
    }
}
