package io.x402.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;
import java.util.Objects;

/** Identifies a payment scheme+network pair that a facilitator supports. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"x402Version", "scheme", "network", "extra"})
public class Kind {
    public int x402Version;
    public String scheme;    // e.g. "exact"
    public String network;   // e.g. "hedera-testnet"

    /** Family-specific hints, e.g. the facilitator's {@code feePayer} account. */
    public Map<String, Object> extra;

    /** Default constructor for Jackson. */
    public Kind() {}

    public Kind(int x402Version, String scheme, String network, Map<String, Object> extra) {
        this.x402Version = x402Version;
        this.scheme = scheme;
        this.network = network;
        this.extra = extra;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Kind)) return false;
        Kind other = (Kind) o;
        return x402Version == other.x402Version
                && Objects.equals(scheme, other.scheme)
                && Objects.equals(network, other.network)
                && Objects.equals(extra, other.extra);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x402Version, scheme, network, extra);
    }

    @Override
    public String toString() {
        return scheme + "@" + network;
    }
}
