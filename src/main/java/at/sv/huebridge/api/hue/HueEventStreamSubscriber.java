package at.sv.huebridge.api.hue;

import at.sv.huebridge.api.BridgeConfig;
import at.sv.huebridge.api.BridgeEventSubscriber;
import at.sv.huebridge.api.EventSubscription;
import at.sv.huebridge.api.IncomingEvent;
import com.launchdarkly.eventsource.background.BackgroundEventSource;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Subscribes to the SSE event stream of the bridge. Batches are handed over to the given executor, which should be
 * the node's scheduler so the mirror is never accessed concurrently.
 */
@Slf4j
public final class HueEventStreamSubscriber implements BridgeEventSubscriber {

    private final OkHttpClient httpsClient;
    private final Executor dispatcher;
    private final int eventStreamReadTimeoutInMinutes;

    public HueEventStreamSubscriber(OkHttpClient httpsClient, Executor dispatcher, int eventStreamReadTimeoutInMinutes) {
        this.httpsClient = httpsClient;
        this.dispatcher = dispatcher;
        this.eventStreamReadTimeoutInMinutes = eventStreamReadTimeoutInMinutes;
    }

    @Override
    public EventSubscription subscribe(BridgeConfig config, Consumer<List<IncomingEvent>> onEventBatch) {
        HueEventHandler handler = new HueEventHandler(onEventBatch, dispatcher);
        BackgroundEventSource eventSource = new HueEventStreamReader(config.getHost(), config.getApplicationKey(),
                httpsClient, handler, eventStreamReadTimeoutInMinutes).start();
        log.debug("Subscribed to event stream of {}", config.getHost());
        return () -> close(eventSource);
    }

    private static void close(BackgroundEventSource eventSource) {
        try {
            eventSource.close();
        } catch (Exception e) {
            log.warn("Failed to close event stream: {}", e.getLocalizedMessage());
        }
    }
}
