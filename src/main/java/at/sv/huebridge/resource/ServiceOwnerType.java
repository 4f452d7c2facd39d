package at.sv.huebridge.resource;

import java.util.Arrays;

/**
 * Resource types that are expected to aggregate services.
 */
public enum ServiceOwnerType {
    DEVICE("device"),
    ROOM("room"),
    ZONE("zone"),
    BRIDGE_HOME("bridge_home"),
    GROUP("group");

    private final String type;

    ServiceOwnerType(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public static boolean isServiceOwner(String type) {
        return Arrays.stream(values()).anyMatch(ownerType -> ownerType.type.equals(type));
    }
}
