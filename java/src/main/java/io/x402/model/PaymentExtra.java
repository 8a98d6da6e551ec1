package io.x402.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scheme-specific fields of a {@link PaymentRequirements}.
 *
 * <p>{@code feePayer} is read by the Hedera and Solana families, where the
 * facilitator submits the transaction and pays its fees. {@code name} and
 * {@code version} are the EIP-712 domain of an EVM token. Anything else is kept
 * in an open bag so requirements round-trip unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentExtra {
    /** Account of the settling party that pays ledger fees. */
    public String feePayer;

    /** EIP-712 domain name of the token contract (e.g. "USD Coin"). */
    public String name;

    /** EIP-712 domain version of the token contract (e.g. "2"). */
    public String version;

    private final Map<String, Object> other = new LinkedHashMap<>();

    /** Default constructor for Jackson. */
    public PaymentExtra() {}

    public static PaymentExtra feePayer(String feePayer) {
        PaymentExtra extra = new PaymentExtra();
        extra.feePayer = feePayer;
        return extra;
    }

    public static PaymentExtra eip712Domain(String name, String version) {
        PaymentExtra extra = new PaymentExtra();
        extra.name = name;
        extra.version = version;
        return extra;
    }

    @JsonAnyGetter
    public Map<String, Object> getOther() {
        return other;
    }

    @JsonAnySetter
    public void setOther(String key, Object value) {
        this.other.put(key, value);
    }
}
