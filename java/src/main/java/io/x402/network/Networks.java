package io.x402.network;

/** Identifiers of the supported networks. */
public final class Networks {
    public static final String BASE_SEPOLIA = "base-sepolia";
    public static final String BASE = "base";
    public static final String AVALANCHE_FUJI = "avalanche-fuji";
    public static final String AVALANCHE = "avalanche";
    public static final String IOTEX = "iotex";
    public static final String SEI = "sei";
    public static final String SEI_TESTNET = "sei-testnet";
    public static final String POLYGON = "polygon";
    public static final String POLYGON_AMOY = "polygon-amoy";
    public static final String PEAQ = "peaq";

    public static final String SOLANA_DEVNET = "solana-devnet";
    public static final String SOLANA = "solana";

    public static final String HEDERA_TESTNET = "hedera-testnet";
    public static final String HEDERA_MAINNET = "hedera-mainnet";

    private Networks() {}
}
