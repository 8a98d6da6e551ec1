package io.x402.schemes;

import java.io.IOException;
import java.util.Locale;
import java.util.regex.Pattern;

/** The ledger refused a submitted transaction, as opposed to the connection failing. */
public class LedgerRejectionException extends IOException {

    private static final Pattern SPL_INSUFFICIENT_FUNDS =
            Pattern.compile("custom program error: 0x1\\b|\"custom\":1}");

    public LedgerRejectionException(String message) {
        super(message);
    }

    /** Whether the ledger's message reports that the payer could not cover the transfer. */
    public boolean isInsufficientBalance() {
        return indicatesInsufficientBalance(getMessage());
    }

    public static boolean indicatesInsufficientBalance(String message) {
        if (message == null) {
            return false;
        }
        String text = message.toLowerCase(Locale.ROOT);
        return text.contains("insufficient funds")
                || text.contains("insufficientfunds")
                || text.contains("insufficient lamports")
                || text.contains("exceeds balance")
                || SPL_INSUFFICIENT_FUNDS.matcher(text).find();
    }
}
