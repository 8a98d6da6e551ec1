package io.x402.schemes.evm;

import io.x402.schemes.AssetClass;
import org.web3j.crypto.WalletUtils;

import java.util.Set;

/** Asset identifiers on EVM chains: ERC-20 contract addresses or native-currency sentinels. */
public final class EvmAssets {

    /** Lower-case identifiers that denote the chain's native currency. */
    public static final Set<String> NATIVE_SENTINELS = Set.of(
            "native",
            "0x0000000000000000000000000000000000000000",
            "0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee");

    private EvmAssets() {}

    public static AssetClass classify(String asset) {
        return AssetClass.of(asset, NATIVE_SENTINELS);
    }

    public static boolean isAddress(String value) {
        return value != null && value.startsWith("0x") && WalletUtils.isValidAddress(value);
    }
}
