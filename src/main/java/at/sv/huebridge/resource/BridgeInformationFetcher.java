package at.sv.huebridge.resource;

import at.sv.huebridge.FormatUtil;
import at.sv.huebridge.api.HueBridgeApi;
import at.sv.huebridge.api.UpstreamFetchFailure;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Provides the synthetic {@code bridge} resource and the legacy rules, which are not part of the v2 resource graph.
 */
public final class BridgeInformationFetcher {

    public static final String BRIDGE_ID = "bridge";
    static final String RULE_ID_PREFIX = "rule_";

    private final HueBridgeApi api;
    private final ResourceStore store;
    private final Supplier<ZonedDateTime> currentTime;

    public BridgeInformationFetcher(HueBridgeApi api, ResourceStore store, Supplier<ZonedDateTime> currentTime) {
        this.api = api;
        this.store = store;
        this.currentTime = currentTime;
    }

    /**
     * @param mergeIntoStore if the result should also replace the {@code bridge} entry of the store
     * @throws UpstreamFetchFailure if the configuration could not be fetched
     */
    public Resource fetchBridgeInfo(boolean mergeIntoStore) {
        ObjectNode data = fetch("bridge configuration", api::fetchConfig).deepCopy();
        data.put(Resource.TYPE, "bridge");
        data.put(Resource.ID, BRIDGE_ID);
        data.put(Resource.ID_V1, "/config");
        data.put(Resource.UPDATED, FormatUtil.formatTimestamp(currentTime.get()));
        Resource bridge = Resource.of(data);
        if (mergeIntoStore) {
            store.put(BRIDGE_ID, bridge);
        }
        return bridge;
    }

    /**
     * @throws UpstreamFetchFailure if the rules could not be fetched
     */
    public List<Resource> fetchLegacyRules() {
        Map<String, ObjectNode> rules = fetch("legacy rules", api::fetchLegacyRules);
        return rules.entrySet()
                    .stream()
                    .map(rule -> toRuleResource(rule.getKey(), rule.getValue()))
                    .toList();
    }

    private static Resource toRuleResource(String ruleId, ObjectNode fields) {
        ObjectNode data = fields.deepCopy();
        data.put(Resource.ID, RULE_ID_PREFIX + ruleId);
        data.put(Resource.ID_V1, "/rules/" + ruleId);
        data.put(Resource.TYPE, "rule");
        return Resource.of(data);
    }

    static <T> T fetch(String description, Supplier<T> call) {
        try {
            return call.get();
        } catch (UpstreamFetchFailure e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamFetchFailure("Failed to fetch " + description + ": " + FormatUtil.getCauseMessage(e), e);
        }
    }
}
