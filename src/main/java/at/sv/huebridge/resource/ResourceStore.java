package at.sv.huebridge.resource;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The mirror of the bridge's resources and the ownership index. Not thread safe: only ever accessed from the node's
 * scheduler thread.
 */
public final class ResourceStore {

    private final Map<String, Resource> resources = new LinkedHashMap<>();
    private final Map<String, List<String>> owners = new HashMap<>();

    @Nullable
    public Resource get(String id) {
        return resources.get(id);
    }

    public boolean contains(String id) {
        return resources.containsKey(id);
    }

    /**
     * Creates or fully replaces the entry. Owners embedding the replaced instance are re-linked to the new one.
     */
    public void put(String id, Resource resource) {
        Resource previous = resources.put(id, resource);
        if (previous != null && previous != resource) {
            ownersOf(id).stream()
                        .map(resources::get)
                        .forEach(owner -> owner.relinkService(resource));
        }
    }

    /**
     * Commits all given resources at once and replaces the ownership index with the given one. The owners embed the
     * given instances already, so nothing is re-linked.
     *
     * @throws MissingResourceException if an owner id is neither given nor already stored. Nothing is committed then.
     */
    public void putAll(ExpandedResources expanded) {
        expanded.owners().forEach((serviceId, ownerIds) -> {
            for (String ownerId : ownerIds) {
                if (!contains(ownerId) && !expanded.resources().containsKey(ownerId)) {
                    throw new MissingResourceException("No resource entry for '" + ownerId + "', the owner of '"
                                                       + serviceId + "'");
                }
            }
        });
        resources.putAll(expanded.resources());
        owners.clear();
        expanded.owners().forEach((serviceId, ownerIds) -> owners.put(serviceId, List.copyOf(ownerIds)));
    }

    /**
     * @return the ids of the owners embedding the given resource, in the order they were found. Empty if unowned.
     */
    public List<String> ownersOf(String id) {
        return owners.getOrDefault(id, List.of());
    }

    /**
     * @return a snapshot of all resources in insertion order
     */
    public List<Resource> getResources() {
        return List.copyOf(resources.values());
    }

    public int size() {
        return resources.size();
    }
}
