package io.x402.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Reason codes shared by every network family for verify and settle failures. */
public enum ErrorReason {
    UNSUPPORTED_SCHEME("unsupported_scheme"),
    INVALID_SCHEME("invalid_scheme"),
    INVALID_NETWORK("invalid_network"),

    INVALID_PAYLOAD_TRANSACTION("invalid_payload_transaction"),
    INVALID_PAYLOAD_TRANSACTION_SIGNATURE("invalid_payload_transaction_signature"),
    INVALID_PAYLOAD_TRANSACTION_ASSET_MISMATCH("invalid_payload_transaction_asset_mismatch"),
    INVALID_PAYLOAD_TRANSACTION_AMOUNT_MISMATCH("invalid_payload_transaction_amount_mismatch"),
    INVALID_PAYLOAD_TRANSACTION_RECIPIENT_MISMATCH("invalid_payload_transaction_recipient_mismatch"),
    INVALID_PAYLOAD_AUTHORIZATION_VALID_BEFORE("invalid_payload_authorization_valid_before"),
    INVALID_PAYLOAD_AUTHORIZATION_VALID_AFTER("invalid_payload_authorization_valid_after"),

    INSUFFICIENT_BALANCE("insufficient_balance"),

    TRANSACTION_FAILED("transaction_failed"),
    CONFIRMATION_TIMEOUT("confirmation_timeout"),

    UNEXPECTED_VERIFY_ERROR("unexpected_verify_error"),
    UNEXPECTED_SETTLE_ERROR("unexpected_settle_error"),

    /** A code reported by a remote facilitator that this version does not know. */
    UNKNOWN("unknown");

    private final String code;

    ErrorReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ErrorReason fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ErrorReason reason : values()) {
            if (reason.code.equals(code)) {
                return reason;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return code;
    }
}
