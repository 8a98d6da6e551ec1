package io.x402.schemes.evm;

import io.x402.config.X402Config;
import io.x402.network.NetworkFamily;
import io.x402.network.NetworkRegistry;
import io.x402.signer.Signer;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/** secp256k1 account plus the chain connection it settles through. */
public final class EvmSigner implements Signer {

    private final Credentials credentials;
    private final EvmLedger ledger;

    public EvmSigner(Credentials credentials, EvmLedger ledger) {
        this.credentials = credentials;
        this.ledger = ledger;
    }

    /**
     * Creates a signer connected to {@code network} over JSON-RPC.
     *
     * @param privateKey hex private key, with or without 0x prefix
     */
    public static EvmSigner create(String network, String privateKey, X402Config config, NetworkRegistry registry) {
        Credentials credentials = Credentials.create(privateKey);
        Web3j web3j = Web3j.build(new HttpService(config.rpcUrl(network)));
        return new EvmSigner(credentials,
                new Web3jEvmLedger(web3j, credentials, registry.chainId(network), config));
    }

    @Override
    public NetworkFamily family() {
        return NetworkFamily.EVM;
    }

    @Override
    public String address() {
        return credentials.getAddress();
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public EvmLedger getLedger() {
        return ledger;
    }
}
