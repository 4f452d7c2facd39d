package at.sv.huebridge.bus;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process bus delivering messages synchronously to the listeners of a channel. A failing listener is logged and
 * does not affect the others.
 */
@Slf4j
public final class LocalResourceEventBus implements ResourceEventBus {

    private final Map<String, List<Consumer<ResourceUpdateMessage>>> listeners = new ConcurrentHashMap<>();

    /**
     * @return a callback removing the listener again
     */
    public Runnable subscribe(String channel, Consumer<ResourceUpdateMessage> listener) {
        listeners.computeIfAbsent(channel, key -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> listeners.getOrDefault(channel, List.of()).remove(listener);
    }

    @Override
    public void emit(String channel, ResourceUpdateMessage message) {
        List<Consumer<ResourceUpdateMessage>> channelListeners = listeners.get(channel);
        if (channelListeners == null || channelListeners.isEmpty()) {
            return;
        }
        log.trace("Emit on {}: {}", channel, message);
        for (Consumer<ResourceUpdateMessage> listener : channelListeners) {
            try {
                listener.accept(message);
            } catch (RuntimeException e) {
                log.error("Listener on '{}' failed: {}", channel, e.getLocalizedMessage(), e);
            }
        }
    }
}
