package io.x402.schemes;

import io.x402.model.ErrorReason;

/** Short-circuits a verification with a known reason. Never leaves a verifier. */
public class VerificationException extends Exception {

    private final ErrorReason reason;
    private final String payer;

    public VerificationException(ErrorReason reason) {
        this(reason, "", null);
    }

    public VerificationException(ErrorReason reason, String payer) {
        this(reason, payer, null);
    }

    public VerificationException(ErrorReason reason, String payer, Throwable cause) {
        super(reason.code(), cause);
        this.reason = reason;
        this.payer = payer == null ? "" : payer;
    }

    public ErrorReason getReason() {
        return reason;
    }

    public String getPayer() {
        return payer;
    }
}
