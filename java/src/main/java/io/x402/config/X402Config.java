package io.x402.config;

import io.x402.exception.UnsupportedNetworkException;
import io.x402.network.Networks;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Runtime settings shared by the ledger adapters: RPC endpoints, the settlement
 * confirmation timeout and the receipt polling interval.
 */
public final class X402Config {

    public static final Duration DEFAULT_SETTLEMENT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final long DEFAULT_EVM_GAS_LIMIT = 150_000L;

    private static final String RPC_URL_PREFIX = "X402_RPC_URL_";

    private static final Map<String, String> DEFAULT_RPC_URLS;

    static {
        Map<String, String> urls = new LinkedHashMap<>();
        urls.put(Networks.BASE_SEPOLIA, "https://sepolia.base.org");
        urls.put(Networks.BASE, "https://mainnet.base.org");
        urls.put(Networks.AVALANCHE_FUJI, "https://api.avax-test.network/ext/bc/C/rpc");
        urls.put(Networks.AVALANCHE, "https://api.avax.network/ext/bc/C/rpc");
        urls.put(Networks.IOTEX, "https://babel-api.mainnet.iotex.io");
        urls.put(Networks.SEI, "https://evm-rpc.sei-apis.com");
        urls.put(Networks.SEI_TESTNET, "https://evm-rpc-testnet.sei-apis.com");
        urls.put(Networks.POLYGON, "https://polygon-rpc.com");
        urls.put(Networks.POLYGON_AMOY, "https://rpc-amoy.polygon.technology");
        urls.put(Networks.PEAQ, "https://peaq.api.onfinality.io/public");
        urls.put(Networks.SOLANA_DEVNET, "https://api.devnet.solana.com");
        urls.put(Networks.SOLANA, "https://api.mainnet-beta.solana.com");
        DEFAULT_RPC_URLS = Collections.unmodifiableMap(urls);
    }

    private final Map<String, String> rpcUrls;
    private final Duration settlementTimeout;
    private final Duration pollInterval;
    private final long evmGasLimit;

    private X402Config(Builder builder) {
        this.rpcUrls = Collections.unmodifiableMap(new LinkedHashMap<>(builder.rpcUrls));
        this.settlementTimeout = builder.settlementTimeout;
        this.pollInterval = builder.pollInterval;
        this.evmGasLimit = builder.evmGasLimit;
    }

    public static X402Config defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads overrides from environment-style variables:
     * {@code X402_SETTLEMENT_TIMEOUT_SECONDS}, {@code X402_POLL_INTERVAL_MILLIS},
     * {@code X402_EVM_GAS_LIMIT} and {@code X402_RPC_URL_<NETWORK>} where the network
     * is upper-cased with dashes replaced by underscores.
     */
    public static X402Config fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String timeout = env.get("X402_SETTLEMENT_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            builder.settlementTimeout(Duration.ofSeconds(Long.parseLong(timeout.trim())));
        }
        String poll = env.get("X402_POLL_INTERVAL_MILLIS");
        if (poll != null && !poll.isBlank()) {
            builder.pollInterval(Duration.ofMillis(Long.parseLong(poll.trim())));
        }
        String gas = env.get("X402_EVM_GAS_LIMIT");
        if (gas != null && !gas.isBlank()) {
            builder.evmGasLimit(Long.parseLong(gas.trim()));
        }
        for (String network : DEFAULT_RPC_URLS.keySet()) {
            String url = env.get(RPC_URL_PREFIX + network.toUpperCase(Locale.ROOT).replace('-', '_'));
            if (url != null && !url.isBlank()) {
                builder.rpcUrl(network, url.trim());
            }
        }
        return builder.build();
    }

    /**
     * JSON-RPC endpoint of an EVM or Solana network. Hedera networks are reached
     * through the SDK's own node address book and have no entry here.
     */
    public String rpcUrl(String network) {
        String url = rpcUrls.get(network);
        if (url == null) {
            url = DEFAULT_RPC_URLS.get(network);
        }
        if (url == null) {
            throw new UnsupportedNetworkException(network);
        }
        return url;
    }

    public Duration getSettlementTimeout() {
        return settlementTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public long getEvmGasLimit() {
        return evmGasLimit;
    }

    public static final class Builder {
        private final Map<String, String> rpcUrls = new LinkedHashMap<>();
        private Duration settlementTimeout = DEFAULT_SETTLEMENT_TIMEOUT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private long evmGasLimit = DEFAULT_EVM_GAS_LIMIT;

        private Builder() {}

        public Builder rpcUrl(String network, String url) {
            rpcUrls.put(network, url);
            return this;
        }

        public Builder settlementTimeout(Duration timeout) {
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("settlement timeout must be positive");
            }
            this.settlementTimeout = timeout;
            return this;
        }

        public Builder pollInterval(Duration interval) {
            if (interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("poll interval must be positive");
            }
            this.pollInterval = interval;
            return this;
        }

        public Builder evmGasLimit(long gasLimit) {
            this.evmGasLimit = gasLimit;
            return this;
        }

        public X402Config build() {
            return new X402Config(this);
        }
    }
}
