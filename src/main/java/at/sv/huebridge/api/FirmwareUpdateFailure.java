package at.sv.huebridge.api;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The bridge rejected a firmware update request. Carries every error entry of the response.
 */
@Getter
public final class FirmwareUpdateFailure extends RuntimeException {

    private final List<BridgeError> errors;

    public FirmwareUpdateFailure(List<BridgeError> errors) {
        super("Firmware update rejected: " + errors.stream()
                                                    .map(BridgeError::description)
                                                    .collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }
}
