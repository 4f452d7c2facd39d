package at.sv.huebridge.api;

/**
 * Exception to signal that the bridge could not be reached. The connection controller retries the whole start-up.
 */
public final class BridgeConnectionFailure extends RuntimeException {

    public BridgeConnectionFailure(String message) {
        super(message);
    }

    public BridgeConnectionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
