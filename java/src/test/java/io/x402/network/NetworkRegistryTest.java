package io.x402.network;

import io.x402.exception.UnsupportedNetworkException;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NetworkRegistryTest {

    private final NetworkRegistry registry = NetworkRegistry.defaults();

    @Test
    void classifiesEveryKnownNetworkIntoOneFamily() {
        assertEquals(14, registry.networks().size());
        for (String network : registry.networks()) {
            NetworkFamily family = registry.classify(network);
            int claims = 0;
            for (NetworkFamily candidate : NetworkFamily.values()) {
                if (registry.isNetworkOf(candidate, network)) {
                    claims++;
                }
            }
            assertEquals(1, claims, network);
            assertTrue(registry.networksOf(family).contains(network));
        }
    }

    @Test
    void classifiesRepresentativeNetworks() {
        assertEquals(NetworkFamily.EVM, registry.classify("base-sepolia"));
        assertEquals(NetworkFamily.EVM, registry.classify("peaq"));
        assertEquals(NetworkFamily.SVM, registry.classify("solana-devnet"));
        assertEquals(NetworkFamily.HEDERA, registry.classify("hedera-testnet"));
        assertEquals(List.of("hedera-testnet", "hedera-mainnet"), registry.networksOf(NetworkFamily.HEDERA));
    }

    @Test
    void unknownNetworkFails() {
        UnsupportedNetworkException ex =
                assertThrows(UnsupportedNetworkException.class, () -> registry.classify("ethereum-classic"));
        assertEquals("ethereum-classic", ex.getNetwork());
        assertThrows(UnsupportedNetworkException.class, () -> registry.classify(null));
        assertFalse(registry.isSupported("Base"));
    }

    @Test
    void chainIdsRoundTrip() {
        assertEquals(84532L, registry.chainId("base-sepolia"));
        assertEquals(296L, registry.chainId("hedera-testnet"));
        for (String network : registry.networks()) {
            assertEquals(network, registry.networkForChainId(registry.chainId(network)));
        }
        assertThrows(UnsupportedNetworkException.class, () -> registry.networkForChainId(1L));
    }

    @Test
    void networkClaimedTwiceIsRejected() {
        Map<NetworkFamily, Map<String, Long>> table = new EnumMap<>(NetworkFamily.class);
        table.put(NetworkFamily.EVM, Map.of("shared", 1L));
        table.put(NetworkFamily.SVM, Map.of("shared", 2L));

        assertThrows(IllegalStateException.class, () -> new NetworkRegistry(table));
    }

    @Test
    void chainIdCollisionIsRejected() {
        Map<NetworkFamily, Map<String, Long>> table = new EnumMap<>(NetworkFamily.class);
        table.put(NetworkFamily.EVM, Map.of("one", 7L));
        table.put(NetworkFamily.HEDERA, Map.of("two", 7L));

        assertThrows(IllegalStateException.class, () -> new NetworkRegistry(table));
    }
}
