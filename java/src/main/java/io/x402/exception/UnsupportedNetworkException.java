package io.x402.exception;

/** A network identifier that is not in the registry's static table. */
public class UnsupportedNetworkException extends IllegalArgumentException {

    private final String network;

    public UnsupportedNetworkException(String network) {
        super("Unsupported network: " + network);
        this.network = network;
    }

    public String getNetwork() {
        return network;
    }
}
