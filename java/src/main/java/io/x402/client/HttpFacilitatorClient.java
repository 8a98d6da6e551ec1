package io.x402.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.x402.codec.Json;
import io.x402.model.FacilitatorRequest;
import io.x402.model.PaymentPayload;
import io.x402.model.PaymentRequirements;
import io.x402.model.SettleResponse;
import io.x402.model.VerifyResponse;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/** {@link FacilitatorClient} for a facilitator reached over HTTP. */
public class HttpFacilitatorClient implements FacilitatorClient {

    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    private final String baseUrl;

    /**
     * @param baseUrl facilitator root, with or without a trailing slash
     */
    public HttpFacilitatorClient(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public VerifyResponse verify(PaymentPayload paymentPayload, PaymentRequirements req)
            throws IOException, InterruptedException {
        String body = post("/verify", new FacilitatorRequest(paymentPayload, req));
        return Json.MAPPER.readValue(body, VerifyResponse.class);
    }

    @Override
    public SettleResponse settle(PaymentPayload paymentPayload, PaymentRequirements req)
            throws IOException, InterruptedException {
        String body = post("/settle", new FacilitatorRequest(paymentPayload, req));
        return Json.MAPPER.readValue(body, SettleResponse.class);
    }

    @Override
    public Set<Kind> supported() throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/supported"))
                .GET()
                .build();
        JsonNode root = Json.MAPPER.readTree(send(request));
        Set<Kind> kinds = new LinkedHashSet<>();
        for (JsonNode kind : root.path("kinds")) {
            kinds.add(Json.MAPPER.treeToValue(kind, Kind.class));
        }
        return kinds;
    }

    private String post(String path, Object body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                .build();
        return send(request);
    }

    private String send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + ": " + response.body());
        }
        return response.body();
    }
}
