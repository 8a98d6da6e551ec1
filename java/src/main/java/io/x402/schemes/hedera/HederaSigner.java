package io.x402.schemes.hedera;

import com.hedera.hashgraph.sdk.AccountId;
import com.hedera.hashgraph.sdk.Client;
import com.hedera.hashgraph.sdk.PrivateKey;
import io.x402.network.NetworkFamily;
import io.x402.signer.Signer;

/**
 * Hedera account, its private key, and the client used to freeze and submit
 * transactions on its network.
 */
public final class HederaSigner implements Signer {

    private final Client client;
    private final AccountId accountId;
    private final PrivateKey privateKey;
    private final HederaLedger ledger;

    public HederaSigner(Client client, AccountId accountId, PrivateKey privateKey, HederaLedger ledger) {
        this.client = client;
        this.accountId = accountId;
        this.privateKey = privateKey;
        this.ledger = ledger;
    }

    /**
     * Creates a signer with its own client for {@code network}; the client's
     * operator is set to this account.
     *
     * @param privateKey ECDSA private key string (hex or DER)
     * @param accountId  account id in {@code shard.realm.num} form
     */
    public static HederaSigner create(String network, String privateKey, String accountId) {
        return create(network, PrivateKey.fromStringECDSA(privateKey), AccountId.fromString(accountId));
    }

    public static HederaSigner create(String network, PrivateKey privateKey, AccountId accountId) {
        Client client = HederaClients.forNetwork(network);
        client.setOperator(accountId, privateKey);
        return new HederaSigner(client, accountId, privateKey, new SdkHederaLedger(client));
    }

    @Override
    public NetworkFamily family() {
        return NetworkFamily.HEDERA;
    }

    @Override
    public String address() {
        return accountId.toString();
    }

    public Client getClient() {
        return client;
    }

    public AccountId getAccountId() {
        return accountId;
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    public HederaLedger getLedger() {
        return ledger;
    }
}
