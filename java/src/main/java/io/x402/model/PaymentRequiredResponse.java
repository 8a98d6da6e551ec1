package io.x402.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/** HTTP 402 response body returned by an x402-enabled server. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentRequiredResponse {
    public int x402Version;
    public List<PaymentRequirements> accepts = new ArrayList<>();
    public String error;

    /** Default constructor for Jackson. */
    public PaymentRequiredResponse() {}

    public PaymentRequiredResponse(int x402Version, List<PaymentRequirements> accepts, String error) {
        this.x402Version = x402Version;
        this.accepts = accepts;
        this.error = error;
    }
}
