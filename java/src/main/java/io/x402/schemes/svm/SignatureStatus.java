package io.x402.schemes.svm;

/** One entry of {@code getSignatureStatuses}. */
public final class SignatureStatus {
    private final String confirmationStatus;
    private final String error;

    public SignatureStatus(String confirmationStatus, String error) {
        this.confirmationStatus = confirmationStatus;
        this.error = error;
    }

    /** {@code processed}, {@code confirmed} or {@code finalized}. */
    public String getConfirmationStatus() {
        return confirmationStatus;
    }

    /** Transaction error as JSON text, {@code null} if the transaction succeeded. */
    public String getError() {
        return error;
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean isConfirmed() {
        return "confirmed".equals(confirmationStatus) || "finalized".equals(confirmationStatus);
    }
}
