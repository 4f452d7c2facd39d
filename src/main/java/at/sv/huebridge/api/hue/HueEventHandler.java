package at.sv.huebridge.api.hue;

import at.sv.huebridge.api.IncomingEvent;
import at.sv.huebridge.resource.MissingResourceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.launchdarkly.eventsource.MessageEvent;
import com.launchdarkly.eventsource.background.BackgroundEventHandler;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Converts each message of the event stream, an array of {@code {"type": "update", "data": [...]}} containers, into one
 * batch of {@link IncomingEvent}s.
 */
@Slf4j
public final class HueEventHandler implements BackgroundEventHandler {

    private final Consumer<List<IncomingEvent>> batchConsumer;
    private final Executor dispatcher;
    private final ObjectMapper objectMapper;

    public HueEventHandler(Consumer<List<IncomingEvent>> batchConsumer, Executor dispatcher) {
        this.batchConsumer = batchConsumer;
        this.dispatcher = dispatcher;
        objectMapper = new ObjectMapper();
    }

    @Override
    public void onOpen() {
        MDC.put("context", "events");
        log.trace("Hue event stream handler opened.");
        MDC.remove("context");
    }

    @Override
    public void onClosed() {
        MDC.put("context", "events");
        log.trace("Hue event stream handler closed.");
        MDC.remove("context");
    }

    @Override
    public void onMessage(String event, MessageEvent messageEvent) throws Exception {
        List<IncomingEvent> batch = parseBatch(objectMapper.readTree(messageEvent.getData()));
        if (batch.isEmpty()) {
            return;
        }
        dispatcher.execute(() -> deliver(batch));
    }

    private static List<IncomingEvent> parseBatch(JsonNode containers) {
        if (!containers.isArray()) {
            return List.of();
        }
        List<IncomingEvent> batch = new ArrayList<>();
        for (JsonNode containerNode : containers) {
            IncomingEvent.Type type = IncomingEvent.Type.fromName(containerNode.path("type").asText(null));
            JsonNode data = containerNode.path("data");
            if (!data.isArray()) {
                continue;
            }
            for (JsonNode resourceNode : data) {
                if (resourceNode instanceof ObjectNode resource) {
                    batch.add(new IncomingEvent(type, resource));
                }
            }
        }
        return batch;
    }

    private void deliver(List<IncomingEvent> batch) {
        MDC.put("context", "events");
        try {
            batchConsumer.accept(batch);
        } catch (MissingResourceException e) {
            log.error("Resource mirror is inconsistent: {}", e.getMessage());
        } finally {
            MDC.remove("context");
        }
    }

    @Override
    public void onComment(String comment) {
    }

    @Override
    public void onError(Throwable t) {
        MDC.put("context", "events");
        log.error("An error occurred during event stream processing: {}", t.getLocalizedMessage());
        MDC.remove("context");
    }
}
