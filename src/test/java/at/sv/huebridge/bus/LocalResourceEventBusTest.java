package at.sv.huebridge.bus;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocalResourceEventBusTest {

    private static final ResourceUpdateMessage MESSAGE = new ResourceUpdateMessage("light-1", "light", "light",
            List.of(), false);

    private LocalResourceEventBus bus;
    private List<ResourceUpdateMessage> received;

    @BeforeEach
    void setUp() {
        bus = new LocalResourceEventBus();
        received = new ArrayList<>();
    }

    @Test
    void emit_deliversOnlyToListenersOfChannel() {
        bus.subscribe("bridge_light-1", received::add);
        List<ResourceUpdateMessage> other = new ArrayList<>();
        bus.subscribe("bridge_light-2", other::add);

        bus.emit(ResourceEventBus.channelOf("light-1"), MESSAGE);

        assertThat(received).containsExactly(MESSAGE);
        assertThat(other).isEmpty();
    }

    @Test
    void emit_noListeners_noError() {
        bus.emit(ResourceEventBus.GLOBAL_CHANNEL, MESSAGE);
    }

    @Test
    void emit_failingListener_othersStillNotified() {
        bus.subscribe(ResourceEventBus.GLOBAL_CHANNEL, message -> {
            throw new IllegalStateException("listener failure");
        });
        bus.subscribe(ResourceEventBus.GLOBAL_CHANNEL, received::add);

        bus.emit(ResourceEventBus.GLOBAL_CHANNEL, MESSAGE);

        assertThat(received).containsExactly(MESSAGE);
    }

    @Test
    void unsubscribe_noLongerNotified() {
        Runnable unsubscribe = bus.subscribe(ResourceEventBus.GLOBAL_CHANNEL, received::add);

        unsubscribe.run();
        bus.emit(ResourceEventBus.GLOBAL_CHANNEL, MESSAGE);

        assertThat(received).isEmpty();
    }

    @Test
    void channelOf_prefixesId() {
        assertThat(ResourceEventBus.channelOf("bridge")).isEqualTo("bridge_bridge");
    }
}
