package at.sv.huebridge.api;

public final class BridgeAuthenticationFailure extends RuntimeException {
    public BridgeAuthenticationFailure() {
        super("Application key was rejected by bridge");
    }
}
