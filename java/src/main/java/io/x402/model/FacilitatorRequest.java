package io.x402.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Body of POST /verify and POST /settle on the facilitator. */
@JsonPropertyOrder({"x402Version", "paymentPayload", "paymentRequirements"})
public class FacilitatorRequest {
    public int x402Version;
    public PaymentPayload paymentPayload;
    public PaymentRequirements paymentRequirements;

    /** Default constructor for Jackson. */
    public FacilitatorRequest() {}

    public FacilitatorRequest(PaymentPayload paymentPayload, PaymentRequirements paymentRequirements) {
        this.x402Version = paymentPayload == null ? 0 : paymentPayload.x402Version;
        this.paymentPayload = paymentPayload;
        this.paymentRequirements = paymentRequirements;
    }
}
