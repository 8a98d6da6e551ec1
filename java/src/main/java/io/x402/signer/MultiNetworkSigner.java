package io.x402.signer;

import io.x402.network.NetworkFamily;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed mapping from network family to the signer used on that family, for
 * clients and facilitators that operate on several families at once. Key
 * material is never shared across families.
 */
public final class MultiNetworkSigner {

    private final Map<NetworkFamily, Signer> signers;

    private MultiNetworkSigner(Map<NetworkFamily, Signer> signers) {
        this.signers = Collections.unmodifiableMap(signers);
    }

    /**
     * @throws IllegalArgumentException if two signers belong to the same family
     */
    public static MultiNetworkSigner of(Signer... signers) {
        Map<NetworkFamily, Signer> byFamily = new EnumMap<>(NetworkFamily.class);
        for (Signer signer : signers) {
            if (byFamily.putIfAbsent(signer.family(), signer) != null) {
                throw new IllegalArgumentException("Multiple signers given for family " + signer.family().id());
            }
        }
        return new MultiNetworkSigner(byFamily);
    }

    public Optional<Signer> forFamily(NetworkFamily family) {
        return Optional.ofNullable(signers.get(family));
    }

    public Map<NetworkFamily, Signer> asMap() {
        return signers;
    }
}
