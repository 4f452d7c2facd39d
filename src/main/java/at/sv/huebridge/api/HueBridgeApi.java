package at.sv.huebridge.api;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * The remote calls the mirror needs from a bridge. All calls block until the bridge answered.
 */
public interface HueBridgeApi {

    /**
     * Verifies that the bridge is reachable and accepts the configured application key.
     *
     * @throws BridgeConnectionFailure     if the bridge could not be reached
     * @throws BridgeAuthenticationFailure if the application key was rejected
     * @throws ApiFailure                  if the bridge answered with an error
     */
    void initSession(BridgeConfig config);

    /**
     * @return the attribute bag of the legacy {@code /config} endpoint (name, bridgeid, swversion, ...). Not null.
     */
    ObjectNode fetchConfig();

    /**
     * @return the legacy rules, keyed by rule id, in the order reported by the bridge. Not null.
     */
    Map<String, ObjectNode> fetchLegacyRules();

    /**
     * @return every resource of the v2 resource graph, unexpanded. Not null.
     */
    List<ObjectNode> fetchAllGraphResources();

    /**
     * Asks the bridge to check for, or install, a firmware update.
     *
     * @throws FirmwareUpdateFailure if the bridge answered with one or more error entries
     */
    void requestFirmwareUpdate(BridgeConfig config);
}
