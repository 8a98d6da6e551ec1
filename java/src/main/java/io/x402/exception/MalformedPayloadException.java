package io.x402.exception;

/** A header value that is not base64 of a well-formed JSON envelope. */
public class MalformedPayloadException extends Exception {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
