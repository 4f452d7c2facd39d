package at.sv.huebridge.bus;

/**
 * Outbound channel for resource notifications. Delivery is fire-and-forget.
 */
public interface ResourceEventBus {

    String CHANNEL_PREFIX = "bridge_";
    String GLOBAL_CHANNEL = "bridge_globalResourceUpdates";

    void emit(String channel, ResourceUpdateMessage message);

    static String channelOf(String resourceId) {
        return CHANNEL_PREFIX + resourceId;
    }
}
