package io.x402.examples.facilitator;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.x402.client.FacilitatorClient;
import io.x402.codec.Json;
import io.x402.config.X402Config;
import io.x402.facilitator.Facilitator;
import io.x402.facilitator.PaymentStrategy;
import io.x402.model.FacilitatorRequest;
import io.x402.network.Networks;
import io.x402.schemes.evm.EvmSigner;
import io.x402.schemes.hedera.HederaSigner;
import io.x402.schemes.svm.SvmSigner;
import io.x402.signer.MultiNetworkSigner;
import io.x402.signer.Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Minimal facilitator that exposes verify, settle and supported over HTTP.
 *
 * Signers are configured from the environment; a family whose key is not set
 * is simply not served.
 */
public class FacilitatorServer {

    private static final Logger log = LoggerFactory.getLogger(FacilitatorServer.class);

    private final FacilitatorClient facilitator;

    public FacilitatorServer(FacilitatorClient facilitator) {
        this.facilitator = facilitator;
    }

    /**
     * Reads HEDERA_ACCOUNT_ID/HEDERA_PRIVATE_KEY, EVM_PRIVATE_KEY and SVM_PRIVATE_KEY,
     * with HEDERA_NETWORK, EVM_NETWORK and SVM_NETWORK choosing where each signer connects.
     */
    static Facilitator fromEnvironment(Map<String, String> env) {
        X402Config config = X402Config.fromEnvironment(env);
        PaymentStrategy strategy = PaymentStrategy.defaults(config);

        List<Signer> signers = new ArrayList<>();
        if (env.containsKey("HEDERA_ACCOUNT_ID") && env.containsKey("HEDERA_PRIVATE_KEY")) {
            signers.add(HederaSigner.create(env.getOrDefault("HEDERA_NETWORK", Networks.HEDERA_TESTNET),
                    env.get("HEDERA_PRIVATE_KEY"), env.get("HEDERA_ACCOUNT_ID")));
        }
        if (env.containsKey("EVM_PRIVATE_KEY")) {
            signers.add(EvmSigner.create(env.getOrDefault("EVM_NETWORK", Networks.BASE_SEPOLIA),
                    env.get("EVM_PRIVATE_KEY"), config, strategy.registry()));
        }
        if (env.containsKey("SVM_PRIVATE_KEY")) {
            signers.add(SvmSigner.create(env.getOrDefault("SVM_NETWORK", Networks.SOLANA_DEVNET),
                    env.get("SVM_PRIVATE_KEY"), config));
        }
        if (signers.isEmpty()) {
            throw new IllegalStateException("No facilitator key configured");
        }
        for (Signer signer : signers) {
            log.info("{} fee payer: {}", signer.family().id(), signer.address());
        }
        return new Facilitator(strategy, MultiNetworkSigner.of(signers.toArray(new Signer[0])));
    }

    /** POST /verify */
    private void verify(Context ctx) throws Exception {
        FacilitatorRequest request = readRequest(ctx);
        if (request == null) {
            return;
        }
        json(ctx, facilitator.verify(request.paymentPayload, request.paymentRequirements));
    }

    /** POST /settle */
    private void settle(Context ctx) throws Exception {
        FacilitatorRequest request = readRequest(ctx);
        if (request == null) {
            return;
        }
        json(ctx, facilitator.settle(request.paymentPayload, request.paymentRequirements));
    }

    /** GET /supported */
    private void supported(Context ctx) throws Exception {
        json(ctx, Map.of("kinds", facilitator.supported()));
    }

    private static FacilitatorRequest readRequest(Context ctx) throws JsonProcessingException {
        FacilitatorRequest request;
        try {
            request = Json.MAPPER.readValue(ctx.body(), FacilitatorRequest.class);
        } catch (JsonProcessingException e) {
            badRequest(ctx, "invalid request body");
            return null;
        }
        if (request == null || request.paymentPayload == null || request.paymentRequirements == null) {
            badRequest(ctx, "paymentPayload and paymentRequirements are required");
            return null;
        }
        return request;
    }

    private static void badRequest(Context ctx, String message) throws JsonProcessingException {
        ctx.status(400);
        json(ctx, Map.of("error", message));
    }

    private static void json(Context ctx, Object body) throws JsonProcessingException {
        ctx.contentType("application/json").result(Json.MAPPER.writeValueAsString(body));
    }

    /** Starts the routes on {@code port}; 0 picks a free port. */
    public Javalin start(int port) {
        var app = Javalin.create();

        app.post("/verify", this::verify);
        app.post("/settle", this::settle);
        app.get("/supported", this::supported);
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            log.debug("Rejected request to {}: {}", ctx.path(), e.getMessage());
            ctx.status(400);
            ctx.contentType("application/json")
                    .result(Json.MAPPER.createObjectNode().put("error", String.valueOf(e.getMessage())).toString());
        });
        return app.start(port);
    }

    public static void main(String[] args) {
        var server = new FacilitatorServer(fromEnvironment(System.getenv()));

        int port = Integer.parseInt(System.getenv().getOrDefault("PORT", "8080"));
        server.start(port);

        log.info("Facilitator server running on http://localhost:{}", port);
    }
}
