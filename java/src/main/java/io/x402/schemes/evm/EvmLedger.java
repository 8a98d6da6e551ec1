package io.x402.schemes.evm;

import io.x402.model.ExactEvmPayload;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/** The parts of an EVM chain the exact scheme reads from and writes to. */
public interface EvmLedger {

    /** ERC-20 balance of {@code owner} in the token's smallest unit. */
    BigInteger balanceOf(String asset, String owner) throws IOException;

    /**
     * Submits {@code transferWithAuthorization} on the token contract, paying gas
     * from the facilitator's account, and waits for it to be mined.
     *
     * @throws io.x402.schemes.LedgerRejectionException if the node rejects the transaction
     * @throws TimeoutException if no receipt arrived within {@code timeout}
     */
    EvmReceipt transferWithAuthorization(String asset, ExactEvmPayload payload, Duration timeout)
            throws IOException, TimeoutException;
}
