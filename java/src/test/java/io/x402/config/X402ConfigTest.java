package io.x402.config;

import io.x402.exception.UnsupportedNetworkException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class X402ConfigTest {

    @Test
    void defaults() {
        X402Config config = X402Config.defaults();

        assertEquals(Duration.ofSeconds(30), config.getSettlementTimeout());
        assertEquals(Duration.ofSeconds(1), config.getPollInterval());
        assertEquals(150_000L, config.getEvmGasLimit());
        assertEquals("https://sepolia.base.org", config.rpcUrl("base-sepolia"));
        assertEquals("https://api.devnet.solana.com", config.rpcUrl("solana-devnet"));
    }

    @Test
    void hederaHasNoRpcUrl() {
        assertThrows(UnsupportedNetworkException.class, () -> X402Config.defaults().rpcUrl("hedera-testnet"));
    }

    @Test
    void readsEnvironmentOverrides() {
        X402Config config = X402Config.fromEnvironment(Map.of(
                "X402_SETTLEMENT_TIMEOUT_SECONDS", "45",
                "X402_POLL_INTERVAL_MILLIS", "250",
                "X402_EVM_GAS_LIMIT", "200000",
                "X402_RPC_URL_BASE_SEPOLIA", "http://localhost:8545",
                "UNRELATED", "x"));

        assertEquals(Duration.ofSeconds(45), config.getSettlementTimeout());
        assertEquals(Duration.ofMillis(250), config.getPollInterval());
        assertEquals(200_000L, config.getEvmGasLimit());
        assertEquals("http://localhost:8545", config.rpcUrl("base-sepolia"));
        assertEquals("https://mainnet.base.org", config.rpcUrl("base"));
    }

    @Test
    void rejectsNonPositiveDurations() {
        assertThrows(IllegalArgumentException.class,
                () -> X402Config.builder().settlementTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> X402Config.builder().pollInterval(Duration.ofMillis(-1)));
    }
}
