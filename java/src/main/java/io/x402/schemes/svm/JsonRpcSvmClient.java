package io.x402.schemes.svm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.x402.codec.Json;
import io.x402.schemes.LedgerRejectionException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/** {@link SvmRpc} over HTTP JSON-RPC 2.0. */
public class JsonRpcSvmClient implements SvmRpc {

    /** Byte offset of {@code decimals} in an SPL mint account. */
    static final int MINT_DECIMALS_OFFSET = 44;

    private final HttpClient http;
    private final URI endpoint;
    private final AtomicLong ids = new AtomicLong();

    public JsonRpcSvmClient(String endpoint) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), endpoint);
    }

    public JsonRpcSvmClient(HttpClient http, String endpoint) {
        this.http = http;
        this.endpoint = URI.create(endpoint);
    }

    @Override
    public String getLatestBlockhash() throws IOException, InterruptedException {
        ArrayNode params = Json.MAPPER.createArrayNode();
        params.addObject().put("commitment", "confirmed");
        JsonNode blockhash = call("getLatestBlockhash", params).path("value").path("blockhash");
        if (!blockhash.isTextual()) {
            throw new IOException("getLatestBlockhash returned no blockhash");
        }
        return blockhash.asText();
    }

    @Override
    public MintInfo getMint(String mint) throws IOException, InterruptedException {
        ArrayNode params = Json.MAPPER.createArrayNode();
        params.add(mint);
        params.addObject().put("encoding", "base64");
        JsonNode account = call("getAccountInfo", params).path("value");
        if (account.isMissingNode() || account.isNull()) {
            throw new IOException("Mint account " + mint + " does not exist");
        }
        byte[] data = Base64.getDecoder().decode(account.path("data").path(0).asText(""));
        if (data.length <= MINT_DECIMALS_OFFSET) {
            throw new IOException("Account " + mint + " is not a mint");
        }
        SolanaPublicKey owner;
        try {
            owner = SolanaPublicKey.of(account.path("owner").asText());
        } catch (IllegalArgumentException e) {
            throw new IOException("Mint account " + mint + " has an invalid owner", e);
        }
        return new MintInfo(owner, data[MINT_DECIMALS_OFFSET] & 0xff);
    }

    @Override
    public String sendTransaction(String transaction) throws IOException, InterruptedException {
        ArrayNode params = Json.MAPPER.createArrayNode();
        params.add(transaction);
        params.addObject().put("encoding", "base64").put("preflightCommitment", "confirmed");
        JsonNode signature = call("sendTransaction", params);
        if (!signature.isTextual()) {
            throw new IOException("sendTransaction returned no signature");
        }
        return signature.asText();
    }

    @Override
    public Optional<SignatureStatus> getSignatureStatus(String signature) throws IOException, InterruptedException {
        ArrayNode params = Json.MAPPER.createArrayNode();
        params.addArray().add(signature);
        params.addObject().put("searchTransactionHistory", false);
        JsonNode status = call("getSignatureStatuses", params).path("value").path(0);
        if (status.isMissingNode() || status.isNull()) {
            return Optional.empty();
        }
        JsonNode err = status.path("err");
        String error = err.isMissingNode() || err.isNull() ? null : Json.MAPPER.writeValueAsString(err);
        return Optional.of(new SignatureStatus(status.path("confirmationStatus").asText(null), error));
    }

    /**
     * Performs one call and returns its {@code result}.
     *
     * @throws LedgerRejectionException if the node answers with a JSON-RPC error
     */
    JsonNode call(String method, ArrayNode params) throws IOException, InterruptedException {
        ObjectNode request = Json.MAPPER.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", ids.incrementAndGet());
        request.put("method", method);
        request.set("params", params);

        HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(request)))
                .build();
        HttpResponse<String> response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + " from " + method + ": " + response.body());
        }
        JsonNode body = Json.MAPPER.readTree(response.body());
        JsonNode error = body.get("error");
        if (error != null && !error.isNull()) {
            String message = error.path("message").asText("JSON-RPC error");
            JsonNode data = error.path("data").path("err");
            if (!data.isMissingNode() && !data.isNull()) {
                message = message + " " + Json.MAPPER.writeValueAsString(data);
            }
            throw new LedgerRejectionException(method + " failed: " + message);
        }
        JsonNode result = body.get("result");
        if (result == null) {
            throw new IOException(method + " returned no result");
        }
        return result;
    }
}
