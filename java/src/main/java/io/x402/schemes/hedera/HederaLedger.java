package io.x402.schemes.hedera;

import com.hedera.hashgraph.sdk.Transaction;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/** Submission side of a Hedera network. */
public interface HederaLedger {

    /**
     * Submits a fully signed transaction and blocks until its receipt is known.
     * Precheck and receipt failures are reported through the returned status.
     *
     * @throws TimeoutException if no receipt arrived within {@code timeout}; the
     *                          ledger-side outcome is then unknown
     */
    HederaReceipt submit(Transaction<?> transaction, Duration timeout) throws TimeoutException;
}
