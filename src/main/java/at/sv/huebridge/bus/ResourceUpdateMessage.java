package at.sv.huebridge.bus;

import java.util.List;

/**
 * @param id              the id of the notified resource
 * @param type            the type of the notified resource
 * @param updatedType     the type of the resource that actually changed, e.g. {@code button} for a device notification
 * @param services        the ids of all services embedded in the notified resource
 * @param suppressMessage true for the initial broadcast, where nothing actually changed
 */
public record ResourceUpdateMessage(String id, String type, String updatedType, List<String> services,
                                    boolean suppressMessage) {
}
