package io.x402.schemes.hedera;

import com.hedera.hashgraph.sdk.Client;
import io.x402.exception.UnsupportedNetworkException;
import io.x402.network.Networks;

/** SDK clients for the Hedera networks. */
public final class HederaClients {

    private HederaClients() {}

    public static Client forNetwork(String network) {
        if (Networks.HEDERA_TESTNET.equals(network)) {
            return Client.forTestnet();
        }
        if (Networks.HEDERA_MAINNET.equals(network)) {
            return Client.forMainnet();
        }
        throw new UnsupportedNetworkException(network);
    }
}
