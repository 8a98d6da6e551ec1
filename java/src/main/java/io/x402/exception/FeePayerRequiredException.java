package io.x402.exception;

/** The requirements of a fee-payer sponsored network carry no {@code extra.feePayer}. */
public class FeePayerRequiredException extends PaymentCreationException {

    public FeePayerRequiredException(String network) {
        super("feePayer is required in paymentRequirements.extra for network " + network);
    }
}
