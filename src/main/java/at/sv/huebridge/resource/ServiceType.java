package at.sv.huebridge.resource;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The resource types the bridge lists as services of a device, room, zone or bridge home. Keyed by the bridge's
 * {@code rtype} string.
 */
public enum ServiceType {
    LIGHT("light"),
    GROUPED_LIGHT("grouped_light"),
    BUTTON("button"),
    BELL_BUTTON("bell_button"),
    RELATIVE_ROTARY("relative_rotary"),
    MOTION("motion"),
    CAMERA_MOTION("camera_motion"),
    GROUPED_MOTION("grouped_motion"),
    TEMPERATURE("temperature"),
    LIGHT_LEVEL("light_level"),
    GROUPED_LIGHT_LEVEL("grouped_light_level"),
    CONTACT("contact"),
    TAMPER("tamper"),
    DEVICE_POWER("device_power"),
    DEVICE_SOFTWARE_UPDATE("device_software_update"),
    ZIGBEE_CONNECTIVITY("zigbee_connectivity"),
    ZGP_CONNECTIVITY("zgp_connectivity"),
    ZIGBEE_DEVICE_DISCOVERY("zigbee_device_discovery"),
    WIFI_CONNECTIVITY("wifi_connectivity"),
    ENTERTAINMENT("entertainment"),
    SPEAKER("speaker"),
    BRIDGE("bridge"),
    DEVICE("device"),
    HOMEKIT("homekit"),
    MATTER("matter"),
    BEHAVIOR_INSTANCE("behavior_instance"),
    GEOFENCE_CLIENT("geofence_client"),
    GEOLOCATION("geolocation"),
    CONVENIENCE_AREA_MOTION("convenience_area_motion"),
    SECURITY_AREA_MOTION("security_area_motion");

    private static final Map<String, ServiceType> BY_RTYPE = Arrays.stream(values())
                                                                   .collect(Collectors.toUnmodifiableMap(ServiceType::getRtype, Function.identity()));

    private final String rtype;

    ServiceType(String rtype) {
        this.rtype = rtype;
    }

    public String getRtype() {
        return rtype;
    }

    public static Optional<ServiceType> fromRtype(String rtype) {
        if (rtype == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_RTYPE.get(rtype));
    }
}
