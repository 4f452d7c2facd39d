package at.sv.huebridge.resource;

import java.util.List;
import java.util.Map;

/**
 * Resources keyed by id, together with the ownership index: service id to the ids of the resources embedding it.
 */
public record ExpandedResources(Map<String, Resource> resources, Map<String, List<String>> owners) {
}
