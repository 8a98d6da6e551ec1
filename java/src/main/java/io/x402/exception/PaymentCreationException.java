package io.x402.exception;

/**
 * Raised on the client side when a payment instrument cannot be built.
 * There is no protocol-level fallback for this, so it always propagates.
 */
public class PaymentCreationException extends Exception {

    public PaymentCreationException(String message) {
        super(message);
    }

    public PaymentCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
