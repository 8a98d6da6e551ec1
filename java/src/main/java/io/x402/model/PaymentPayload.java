package io.x402.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.x402.codec.PaymentCodec;
import io.x402.exception.MalformedPayloadException;

import java.util.Map;
import java.util.Objects;

/** Signed payment instrument carried in the {@code X-PAYMENT} header. */
@JsonPropertyOrder({"x402Version", "scheme", "network", "payload"})
public class PaymentPayload {
    public int x402Version;
    public String scheme;
    public String network;

    /** Family-specific body, see {@link ExactEvmPayload} and {@link ExactTransactionPayload}. */
    public Map<String, Object> payload;

    /** Default constructor for Jackson. */
    public PaymentPayload() {}

    public PaymentPayload(int x402Version, String scheme, String network, Map<String, Object> payload) {
        this.x402Version = x402Version;
        this.scheme = scheme;
        this.network = network;
        this.payload = payload;
    }

    /** Base64 header value of this payload. */
    public String toHeader() {
        return PaymentCodec.encode(this);
    }

    public static PaymentPayload fromHeader(String header) throws MalformedPayloadException {
        return PaymentCodec.decode(header);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PaymentPayload)) {
            return false;
        }
        PaymentPayload that = (PaymentPayload) o;
        return x402Version == that.x402Version
                && Objects.equals(scheme, that.scheme)
                && Objects.equals(network, that.network)
                && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x402Version, scheme, network, payload);
    }
}
