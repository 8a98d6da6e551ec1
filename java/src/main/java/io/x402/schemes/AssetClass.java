package io.x402.schemes;

import java.util.Locale;
import java.util.Set;

/**
 * Whether requirements ask for the ledger's native currency or for a token.
 * Builders and verifiers of a family classify through the same sentinel set,
 * so both sides always agree on which transfer they are looking at.
 */
public enum AssetClass {
    NATIVE,
    TOKEN;

    /**
     * @param asset     the requirements' asset identifier
     * @param sentinels lower-case identifiers that denote the native currency
     */
    public static AssetClass of(String asset, Set<String> sentinels) {
        if (asset == null) {
            throw new IllegalArgumentException("asset is required");
        }
        return sentinels.contains(asset.trim().toLowerCase(Locale.ROOT)) ? NATIVE : TOKEN;
    }
}
