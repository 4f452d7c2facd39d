package at.sv.huebridge.resource;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the flat resource list of the bridge into canonical resources with their services embedded, and builds the
 * ownership index along the way.
 */
@Slf4j
public final class ResourceExpander {

    private ResourceExpander() {
    }

    public static ExpandedResources expand(List<ObjectNode> rawResources) {
        Map<String, Resource> resources = new LinkedHashMap<>();
        for (ObjectNode raw : rawResources) {
            if (!raw.path(Resource.ID).isTextual() || !raw.path(Resource.TYPE).isTextual()) {
                log.warn("Skipping resource without id or type: {}", raw);
                continue;
            }
            Resource resource = Resource.of(raw.deepCopy());
            resources.put(resource.getId(), resource);
        }
        Map<String, List<String>> owners = new LinkedHashMap<>();
        for (Resource owner : resources.values()) {
            for (ResourceReference reference : owner.getServiceReferences()) {
                Resource service = resources.get(reference.getRid());
                if (service == null) {
                    log.trace("Service {} '{}' of {} is unknown. Skipped.", reference.getRtype(), reference.getRid(), owner);
                    continue;
                }
                Optional<ServiceType> serviceType = ServiceType.fromRtype(service.getType());
                if (serviceType.isEmpty()) {
                    log.trace("Unsupported service type of {} in {}. Skipped.", service, owner);
                    continue;
                }
                owner.embedService(serviceType.get(), service);
                owners.computeIfAbsent(service.getId(), id -> new ArrayList<>()).add(owner.getId());
            }
        }
        return new ExpandedResources(resources, owners);
    }
}
