package at.sv.huebridge.api.hue;

import at.sv.huebridge.api.ApiFailure;
import at.sv.huebridge.api.BridgeAuthenticationFailure;
import at.sv.huebridge.api.BridgeConfig;
import at.sv.huebridge.api.BridgeError;
import at.sv.huebridge.api.FirmwareUpdateFailure;
import at.sv.huebridge.api.HttpResourceProvider;
import at.sv.huebridge.api.HueBridgeApi;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Talks to the bridge: the v2 (CLIP) API for the resource graph, the legacy v1 API for configuration, rules and
 * firmware updates.
 */
@Slf4j
public final class HueBridgeApiImpl implements HueBridgeApi {

    private static final int UNAUTHORIZED_USER_ERROR = 1;
    private static final Set<String> READY_TO_INSTALL_STATES = Set.of("anyreadytoinstall", "allreadytoinstall");

    private final HttpResourceProvider resourceProvider;
    private final ObjectMapper mapper;
    private final String resourceApi;
    private final String legacyApi;

    public HueBridgeApiImpl(HttpResourceProvider resourceProvider, String host, String applicationKey) {
        this.resourceProvider = resourceProvider;
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        assertNotHttpSchemeProvided(host);
        resourceApi = "https://" + host + "/clip/v2/resource";
        legacyApi = "https://" + host + "/api/" + applicationKey;
    }

    private static void assertNotHttpSchemeProvided(String host) {
        if (host.toLowerCase(Locale.ROOT).startsWith("http")) {
            throw new InvalidConnectionException("Invalid host provided. Hue Bridge host can't contain a scheme: " + host);
        }
    }

    @Override
    public void initSession(BridgeConfig config) {
        List<ObjectNode> bridges = getDataList(createUrl(resourceApi + "/bridge"));
        if (bridges.isEmpty()) {
            throw new ApiFailure("Bridge did not report a bridge resource");
        }
        log.debug("Session established with bridge {}", bridges.get(0).path("bridge_id").asText("?"));
    }

    @Override
    public ObjectNode fetchConfig() {
        return getLegacyObject(createUrl(legacyApi + "/config"));
    }

    @Override
    public Map<String, ObjectNode> fetchLegacyRules() {
        ObjectNode rules = getLegacyObject(createUrl(legacyApi + "/rules"));
        Map<String, ObjectNode> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = rules.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (entry.getValue() instanceof ObjectNode rule) {
                result.put(entry.getKey(), rule);
            }
        }
        return result;
    }

    @Override
    public List<ObjectNode> fetchAllGraphResources() {
        return getDataList(createUrl(resourceApi));
    }

    @Override
    public void requestFirmwareUpdate(BridgeConfig config) {
        String state = fetchConfig().path("swupdate2").path("state").asText("");
        ObjectNode body = mapper.createObjectNode();
        ObjectNode softwareUpdate = body.putObject("swupdate2");
        if (READY_TO_INSTALL_STATES.contains(state)) {
            log.info("Installing bridge firmware update.");
            softwareUpdate.put("install", true);
        } else {
            softwareUpdate.put("checkforupdate", true);
        }
        String response = resourceProvider.putResource(createUrl(legacyApi + "/config"), getBody(body));
        List<BridgeError> errors = parseLegacyErrors(readTree(response));
        if (!errors.isEmpty()) {
            throw new FirmwareUpdateFailure(errors);
        }
    }

    private List<ObjectNode> getDataList(URL url) {
        JsonNode response = readTree(resourceProvider.getResource(url));
        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new ApiFailure("Bridge returned errors for " + url + ": " + errors);
        }
        JsonNode data = response.path("data");
        if (!data.isArray()) {
            throw new ApiFailure("Missing data in response of " + url);
        }
        List<ObjectNode> result = new ArrayList<>(data.size());
        data.forEach(resource -> {
            if (resource instanceof ObjectNode objectNode) {
                result.add(objectNode);
            }
        });
        return result;
    }

    /**
     * The legacy API reports errors with status code 200, as array of error entries.
     */
    private ObjectNode getLegacyObject(URL url) {
        JsonNode response = readTree(resourceProvider.getResource(url));
        List<BridgeError> errors = parseLegacyErrors(response);
        if (!errors.isEmpty()) {
            BridgeError error = errors.get(0);
            if (error.type() == UNAUTHORIZED_USER_ERROR) {
                throw new BridgeAuthenticationFailure();
            }
            throw new ApiFailure("Bridge returned error for " + url + ": " + error.description());
        }
        if (!(response instanceof ObjectNode objectNode)) {
            throw new ApiFailure("Unexpected response of " + url + ": " + response);
        }
        return objectNode;
    }

    private List<BridgeError> parseLegacyErrors(JsonNode response) {
        if (!response.isArray()) {
            return List.of();
        }
        List<BridgeError> errors = new ArrayList<>();
        for (JsonNode entry : response) {
            JsonNode error = entry.get("error");
            if (error != null) {
                errors.add(treeToValue(error));
            }
        }
        return errors;
    }

    private BridgeError treeToValue(JsonNode error) {
        try {
            return mapper.treeToValue(error, BridgeError.class);
        } catch (JsonProcessingException e) {
            throw new ApiFailure("Failed to parse error entry: " + error, e);
        }
    }

    private JsonNode readTree(String response) {
        try {
            JsonNode node = mapper.readTree(response);
            if (node == null || node.isMissingNode()) {
                throw new ApiFailure("Empty response");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ApiFailure("Failed to parse response '" + response + "': " + e.getOriginalMessage(), e);
        }
    }

    private String getBody(Object object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to create body", e);
        }
    }

    private static URL createUrl(String url) {
        try {
            return new URI(url).toURL();
        } catch (MalformedURLException | URISyntaxException e) {
            throw new IllegalArgumentException("Failed to construct API url", e);
        }
    }
}
