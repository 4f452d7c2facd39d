package at.sv.huebridge.api;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;

/**
 * One resource entry of an event stream message. For updates {@code data} only contains the changed fields, plus
 * {@code id} and {@code type}.
 */
public record IncomingEvent(Type type, ObjectNode data) {

    public String getResourceId() {
        return data.path("id").asText(null);
    }

    public String getResourceType() {
        return data.path("type").asText(null);
    }

    public enum Type {
        ADD,
        UPDATE,
        DELETE,
        ERROR,
        UNKNOWN;

        public static Type fromName(String name) {
            if (name == null) {
                return UNKNOWN;
            }
            try {
                return valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return UNKNOWN;
            }
        }
    }
}
