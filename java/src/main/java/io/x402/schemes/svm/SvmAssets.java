package io.x402.schemes.svm;

import io.x402.schemes.AssetClass;

import java.util.Set;

/** SOL or an SPL mint address. */
public final class SvmAssets {

    public static final Set<String> NATIVE_SENTINELS = Set.of("sol", "11111111111111111111111111111111");

    private SvmAssets() {}

    public static AssetClass classify(String asset) {
        return AssetClass.of(asset, NATIVE_SENTINELS);
    }
}
