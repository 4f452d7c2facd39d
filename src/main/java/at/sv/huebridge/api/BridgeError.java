package at.sv.huebridge.api;

/**
 * A single entry of a legacy (v1) error response, e.g. {@code {"error": {"type": 1, "address": "/", "description": "unauthorized user"}}}.
 */
public record BridgeError(int type, String address, String description) {
}
