package at.sv.huebridge.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single mutable entry of the bridge's resource graph. The raw fields are kept as JSON, so every type-specific member
 * the bridge reports survives; {@code id}, {@code id_v1} and {@code type} are always present.
 * <p>
 * Service owners (devices, rooms, zones, ...) additionally hold their services, grouped by {@link ServiceType}. The
 * nested entries are the same instances the {@link ResourceStore} holds, so a change made through either path is
 * visible through both.
 */
public final class Resource {

    public static final String ID = "id";
    public static final String ID_V1 = "id_v1";
    public static final String TYPE = "type";
    public static final String UPDATED = "updated";
    public static final String OWNER = "owner";
    public static final String SERVICES = "services";

    private final ObjectNode data;
    private final Map<ServiceType, Map<String, Resource>> services = new EnumMap<>(ServiceType.class);

    private Resource(ObjectNode data) {
        this.data = data;
    }

    /**
     * Wraps the given node without copying it. A missing {@code id_v1} is stored as empty string.
     *
     * @throws IllegalArgumentException if {@code id} or {@code type} is missing
     */
    public static Resource of(ObjectNode data) {
        assertTextual(data, ID);
        assertTextual(data, TYPE);
        if (!data.hasNonNull(ID_V1)) {
            data.put(ID_V1, "");
        }
        return new Resource(data);
    }

    private static void assertTextual(ObjectNode data, String field) {
        if (!data.path(field).isTextual()) {
            throw new IllegalArgumentException("Resource without '" + field + "': " + data);
        }
    }

    public String getId() {
        return data.get(ID).asText();
    }

    public String getIdV1() {
        return data.get(ID_V1).asText();
    }

    public String getType() {
        return data.get(TYPE).asText();
    }

    public String getUpdated() {
        return data.path(UPDATED).asText(null);
    }

    public void setUpdated(String timestamp) {
        data.put(UPDATED, timestamp);
    }

    /**
     * @return the live JSON representation of this resource
     */
    public ObjectNode getData() {
        return data;
    }

    public JsonNode get(String field) {
        return data.get(field);
    }

    public boolean has(String field) {
        return data.has(field);
    }

    public void remove(String field) {
        data.remove(field);
    }

    public Optional<ResourceReference> getOwnerReference() {
        return toReference(data.get(OWNER));
    }

    /**
     * @return the raw {@code services} references as reported by the bridge, including ones not embedded
     */
    public List<ResourceReference> getServiceReferences() {
        JsonNode references = data.get(SERVICES);
        if (references == null || !references.isArray()) {
            return List.of();
        }
        List<ResourceReference> result = new ArrayList<>();
        references.forEach(reference -> toReference(reference).ifPresent(result::add));
        return result;
    }

    private static Optional<ResourceReference> toReference(JsonNode node) {
        if (node == null || !node.hasNonNull("rid")) {
            return Optional.empty();
        }
        return Optional.of(new ResourceReference(node.get("rid").asText(), node.path("rtype").asText(null)));
    }

    public boolean hasServices() {
        return !services.isEmpty();
    }

    public Map<ServiceType, Map<String, Resource>> getServices() {
        return Collections.unmodifiableMap(services);
    }

    public Map<String, Resource> getServices(ServiceType serviceType) {
        Map<String, Resource> servicesOfType = services.get(serviceType);
        if (servicesOfType == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(servicesOfType);
    }

    /**
     * @return the ids of all embedded services, bucket by bucket in {@link ServiceType} order
     */
    public List<String> getServiceIds() {
        return services.values()
                       .stream()
                       .flatMap(servicesOfType -> servicesOfType.keySet().stream())
                       .toList();
    }

    public void embedService(ServiceType serviceType, Resource service) {
        services.computeIfAbsent(serviceType, type -> new LinkedHashMap<>())
                .put(service.getId(), service);
    }

    /**
     * Replaces every embedded entry with the same id as the given resource.
     */
    void relinkService(Resource replacement) {
        services.values().forEach(servicesOfType -> servicesOfType.replace(replacement.getId(), replacement));
    }

    /**
     * @return true, if applying the given partial update would change at least one field
     */
    public boolean wouldChange(ObjectNode update) {
        ObjectNode candidate = data.deepCopy();
        merge(candidate, update);
        return !candidate.equals(data);
    }

    /**
     * Deep merges the given partial update into this resource. Objects are merged member by member, arrays and
     * scalars are replaced.
     */
    public void apply(ObjectNode update) {
        merge(data, update);
    }

    private static void merge(ObjectNode target, ObjectNode update) {
        Iterator<Map.Entry<String, JsonNode>> fields = update.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode current = target.get(field.getKey());
            if (current instanceof ObjectNode currentObject && field.getValue() instanceof ObjectNode updateObject) {
                merge(currentObject, updateObject);
            } else {
                target.set(field.getKey(), field.getValue().deepCopy());
            }
        }
    }

    @Override
    public String toString() {
        return getType() + " '" + getId() + "'";
    }
}
