package io.x402.signer;

import io.x402.network.NetworkFamily;

/**
 * Key material of one network family together with the ledger connection it
 * signs for. Implementations are immutable and safe to share between
 * concurrent verify and settle calls.
 */
public interface Signer {

    /** Family whose transactions this signer can authorize. */
    NetworkFamily family();

    /** Account address in the family's native format. */
    String address();
}
