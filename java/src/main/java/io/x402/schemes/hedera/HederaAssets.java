package io.x402.schemes.hedera;

import com.hedera.hashgraph.sdk.TokenId;
import io.x402.schemes.AssetClass;

import java.util.Set;

/** Asset identifiers on Hedera: HBAR sentinels or HTS token ids. */
public final class HederaAssets {

    /** Lower-case identifiers that denote HBAR. */
    public static final Set<String> NATIVE_SENTINELS = Set.of("0.0.0", "hbar");

    private HederaAssets() {}

    public static AssetClass classify(String asset) {
        return AssetClass.of(asset, NATIVE_SENTINELS);
    }

    public static boolean isHbar(String asset) {
        return classify(asset) == AssetClass.NATIVE;
    }

    /**
     * @throws IllegalArgumentException if the asset is not a {@code shard.realm.num} token id
     */
    public static TokenId parseToken(String asset) {
        return TokenId.fromString(asset.trim());
    }
}
