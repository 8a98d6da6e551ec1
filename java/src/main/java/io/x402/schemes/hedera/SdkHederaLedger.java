package io.x402.schemes.hedera;

import com.hedera.hashgraph.sdk.Client;
import com.hedera.hashgraph.sdk.PrecheckStatusException;
import com.hedera.hashgraph.sdk.ReceiptStatusException;
import com.hedera.hashgraph.sdk.Transaction;
import com.hedera.hashgraph.sdk.TransactionReceipt;
import com.hedera.hashgraph.sdk.TransactionResponse;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/** {@link HederaLedger} backed by the Hedera SDK client. */
public final class SdkHederaLedger implements HederaLedger {

    private final Client client;

    public SdkHederaLedger(Client client) {
        this.client = client;
    }

    @Override
    public HederaReceipt submit(Transaction<?> transaction, Duration timeout) throws TimeoutException {
        Instant deadline = Instant.now().plus(timeout);
        String transactionId = transaction.getTransactionId().toString();
        try {
            TransactionResponse response = transaction.execute(client, timeout);
            TransactionReceipt receipt = response.getReceipt(client, remaining(deadline));
            return new HederaReceipt(response.transactionId.toString(), receipt.status);
        } catch (PrecheckStatusException e) {
            return new HederaReceipt(transactionId, e.status);
        } catch (ReceiptStatusException e) {
            return new HederaReceipt(transactionId, e.receipt.status);
        }
    }

    private static Duration remaining(Instant deadline) throws TimeoutException {
        Duration left = Duration.between(Instant.now(), deadline);
        if (left.isNegative() || left.isZero()) {
            throw new TimeoutException("Transaction confirmation timeout");
        }
        return left;
    }
}
