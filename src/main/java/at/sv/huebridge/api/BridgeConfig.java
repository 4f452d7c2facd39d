package at.sv.huebridge.api;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * The configuration of a single bridge node.
 */
@Value
@Builder(toBuilder = true)
public class BridgeConfig {
    String host;
    String applicationKey;
    @Builder.Default
    String name = "Hue Bridge";
    @Builder.Default
    boolean enabled = true;
    /**
     * Skips the event stream subscription entirely. The mirror then only holds the state read at start-up.
     */
    boolean disableUpdates;
    /**
     * {@code null} means enabled.
     */
    Boolean autoUpdates;
    @Builder.Default
    Duration connectionRetryDelay = Duration.ofSeconds(5);
    @Builder.Default
    Duration firmwareUpdateRetryDelay = Duration.ofSeconds(10);
    @Builder.Default
    Duration firmwareUpdateInterval = Duration.ofHours(12);

    public boolean isAutoUpdatesEnabled() {
        return !Boolean.FALSE.equals(autoUpdates);
    }
}
