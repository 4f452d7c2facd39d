package at.sv.huebridge.api;

import java.util.List;
import java.util.function.Consumer;

public interface BridgeEventSubscriber {
    /**
     * Opens the push event stream of the bridge. Batches are handed to {@code onEventBatch} one at a time, in the order
     * the bridge sent them.
     *
     * @return a handle to close the stream again
     */
    EventSubscription subscribe(BridgeConfig config, Consumer<List<IncomingEvent>> onEventBatch);
}
