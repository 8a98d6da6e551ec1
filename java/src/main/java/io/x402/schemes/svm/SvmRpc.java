package io.x402.schemes.svm;

import java.io.IOException;
import java.util.Optional;

/** The Solana JSON-RPC calls used by exact payments. */
public interface SvmRpc {

    /** Base58 blockhash of the latest block. */
    String getLatestBlockhash() throws IOException, InterruptedException;

    MintInfo getMint(String mint) throws IOException, InterruptedException;

    /**
     * Submits a signed transaction.
     *
     * @param transaction base64 wire bytes
     * @return the transaction signature in base58
     * @throws io.x402.schemes.LedgerRejectionException if preflight or the node rejects it
     */
    String sendTransaction(String transaction) throws IOException, InterruptedException;

    /** Status of a submitted transaction, empty while the cluster has not seen it. */
    Optional<SignatureStatus> getSignatureStatus(String signature) throws IOException, InterruptedException;
}
