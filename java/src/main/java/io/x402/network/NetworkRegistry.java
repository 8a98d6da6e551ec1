package io.x402.network;

import io.x402.exception.UnsupportedNetworkException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.x402.network.Networks.*;

/**
 * Static classification of network identifiers into network families, plus the
 * chain id of each network and the reverse lookup from chain id to network.
 *
 * <p>Built once and read-only afterwards. A network claimed by two families or
 * a chain id shared by two networks is rejected at construction.
 */
public final class NetworkRegistry {

    private final Map<String, NetworkFamily> families;
    private final Map<String, Long> chainIds;
    private final Map<Long, String> networksByChainId;

    /**
     * @param chainIdsByFamily for each family, its networks and their numeric chain ids
     * @throws IllegalStateException if a network or chain id is claimed twice
     */
    public NetworkRegistry(Map<NetworkFamily, Map<String, Long>> chainIdsByFamily) {
        Map<String, NetworkFamily> families = new LinkedHashMap<>();
        Map<String, Long> chainIds = new LinkedHashMap<>();
        Map<Long, String> byChainId = new LinkedHashMap<>();
        chainIdsByFamily.forEach((family, networks) -> networks.forEach((network, chainId) -> {
            NetworkFamily previous = families.putIfAbsent(network, family);
            if (previous != null) {
                throw new IllegalStateException(
                        "Network " + network + " claimed by both " + previous.id() + " and " + family.id());
            }
            String clash = byChainId.putIfAbsent(chainId, network);
            if (clash != null) {
                throw new IllegalStateException(
                        "Chain id " + chainId + " claimed by both " + clash + " and " + network);
            }
            chainIds.put(network, chainId);
        }));
        this.families = Collections.unmodifiableMap(families);
        this.chainIds = Collections.unmodifiableMap(chainIds);
        this.networksByChainId = Collections.unmodifiableMap(byChainId);
    }

    /** Registry of every network this library supports. */
    public static NetworkRegistry defaults() {
        Map<String, Long> evm = new LinkedHashMap<>();
        evm.put(BASE_SEPOLIA, 84532L);
        evm.put(BASE, 8453L);
        evm.put(AVALANCHE_FUJI, 43113L);
        evm.put(AVALANCHE, 43114L);
        evm.put(IOTEX, 4689L);
        evm.put(SEI, 1329L);
        evm.put(SEI_TESTNET, 1328L);
        evm.put(POLYGON, 137L);
        evm.put(POLYGON_AMOY, 80002L);
        evm.put(PEAQ, 3338L);

        Map<String, Long> svm = new LinkedHashMap<>();
        svm.put(SOLANA_DEVNET, 103L);
        svm.put(SOLANA, 101L);

        Map<String, Long> hedera = new LinkedHashMap<>();
        hedera.put(HEDERA_TESTNET, 296L);
        hedera.put(HEDERA_MAINNET, 295L);

        Map<NetworkFamily, Map<String, Long>> all = new EnumMap<>(NetworkFamily.class);
        all.put(NetworkFamily.EVM, evm);
        all.put(NetworkFamily.SVM, svm);
        all.put(NetworkFamily.HEDERA, hedera);
        return new NetworkRegistry(all);
    }

    /**
     * Family of the given network.
     *
     * @throws UnsupportedNetworkException if the network is not in the table
     */
    public NetworkFamily classify(String network) {
        NetworkFamily family = network == null ? null : families.get(network);
        if (family == null) {
            throw new UnsupportedNetworkException(network);
        }
        return family;
    }

    public boolean isSupported(String network) {
        return network != null && families.containsKey(network);
    }

    public boolean isNetworkOf(NetworkFamily family, String network) {
        return isSupported(network) && families.get(network) == family;
    }

    public List<String> networksOf(NetworkFamily family) {
        List<String> networks = new ArrayList<>();
        families.forEach((network, f) -> {
            if (f == family) {
                networks.add(network);
            }
        });
        return Collections.unmodifiableList(networks);
    }

    public Set<String> networks() {
        return families.keySet();
    }

    public long chainId(String network) {
        Long chainId = network == null ? null : chainIds.get(network);
        if (chainId == null) {
            throw new UnsupportedNetworkException(network);
        }
        return chainId;
    }

    public String networkForChainId(long chainId) {
        String network = networksByChainId.get(chainId);
        if (network == null) {
            throw new UnsupportedNetworkException("chain id " + chainId);
        }
        return network;
    }
}
