package at.sv.huebridge.resource;

import at.sv.huebridge.api.HueBridgeApi;
import at.sv.huebridge.api.UpstreamFetchFailure;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static at.sv.huebridge.resource.BridgeInformationFetcher.fetch;

/**
 * Reads the complete state of the bridge into the store.
 */
@Slf4j
public final class ResourceEnumerator {

    private final HueBridgeApi api;
    private final BridgeInformationFetcher bridgeInformationFetcher;
    private final ResourceStore store;

    public ResourceEnumerator(HueBridgeApi api, BridgeInformationFetcher bridgeInformationFetcher, ResourceStore store) {
        this.api = api;
        this.bridgeInformationFetcher = bridgeInformationFetcher;
        this.store = store;
    }

    /**
     * Fetches the bridge, its legacy rules and the whole resource graph, and commits them to the store in one step.
     * Nothing is written if any of the calls fails.
     *
     * @return bridge, rules and graph resources, in that order
     * @throws UpstreamFetchFailure if any of the calls failed
     */
    public List<Resource> enumerateAll() {
        Resource bridge = bridgeInformationFetcher.fetchBridgeInfo(false);
        List<Resource> rules = bridgeInformationFetcher.fetchLegacyRules();
        List<ObjectNode> graphResources = fetch("resource graph", api::fetchAllGraphResources);
        ExpandedResources graph = ResourceExpander.expand(graphResources);

        Map<String, Resource> all = new LinkedHashMap<>();
        all.put(bridge.getId(), bridge);
        rules.forEach(rule -> all.put(rule.getId(), rule));
        all.putAll(graph.resources());
        store.putAll(new ExpandedResources(all, graph.owners()));
        log.debug("Enumerated {} resources: {} rules, {} graph resources, {} owned services.", all.size(), rules.size(),
                graph.resources().size(), graph.owners().size());
        return List.copyOf(all.values());
    }
}
