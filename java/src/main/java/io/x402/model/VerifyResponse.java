package io.x402.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** JSON returned by POST /verify on the facilitator. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"isValid", "invalidReason", "payer"})
public class VerifyResponse {
    /** Whether the payment verification succeeded. */
    public boolean isValid;

    /** Reason for verification failure (if isValid is false). */
    public ErrorReason invalidReason;

    /** Paying account as derived from the instrument, or empty when unknown. */
    public String payer;

    /** Default constructor for Jackson. */
    public VerifyResponse() {}

    public static VerifyResponse valid(String payer) {
        VerifyResponse response = new VerifyResponse();
        response.isValid = true;
        response.payer = payer;
        return response;
    }

    public static VerifyResponse invalid(ErrorReason reason, String payer) {
        VerifyResponse response = new VerifyResponse();
        response.isValid = false;
        response.invalidReason = reason;
        response.payer = payer == null ? "" : payer;
        return response;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VerifyResponse)) {
            return false;
        }
        VerifyResponse that = (VerifyResponse) o;
        return isValid == that.isValid
                && invalidReason == that.invalidReason
                && java.util.Objects.equals(payer, that.payer);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(isValid, invalidReason, payer);
    }

    @Override
    public String toString() {
        return isValid ? "VerifyResponse{valid, payer=" + payer + "}"
                : "VerifyResponse{invalid, reason=" + invalidReason + "}";
    }
}
