package at.sv.huebridge.sync;

import at.sv.huebridge.bus.ResourceEventBus;
import at.sv.huebridge.bus.ResourceUpdateMessage;
import at.sv.huebridge.resource.Resource;
import at.sv.huebridge.resource.ResourceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static at.sv.huebridge.resource.TestResources.button1;
import static at.sv.huebridge.resource.TestResources.button2;
import static at.sv.huebridge.resource.TestResources.createStore;
import static at.sv.huebridge.resource.TestResources.devicePower;
import static at.sv.huebridge.resource.TestResources.dimmerSwitch;
import static at.sv.huebridge.resource.TestResources.groupedLight;
import static at.sv.huebridge.resource.TestResources.light;
import static at.sv.huebridge.resource.TestResources.room;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatePropagatorTest {

    private static final String GLOBAL = "bridge_globalResourceUpdates";

    @Mock
    private ResourceEventBus eventBus;
    private ResourceStore store;
    private StatePropagator propagator;

    @BeforeEach
    void setUp() {
        store = createStore(dimmerSwitch(), button1(), button2(), devicePower(), room(), groupedLight(), light());
        propagator = new StatePropagator(store, eventBus);
    }

    @Test
    void unownedResource_emitsOnOwnAndGlobalChannel() {
        propagator.pushUpdatedState(store.get("light-1"), "light");

        ResourceUpdateMessage expected = new ResourceUpdateMessage("light-1", "light", "light", List.of(), false);
        InOrder inOrder = inOrder(eventBus);
        inOrder.verify(eventBus).emit("bridge_light-1", expected);
        inOrder.verify(eventBus).emit(GLOBAL, expected);
        verifyNoMoreInteractions(eventBus);
    }

    @Test
    void serviceOwner_listsEmbeddedServicesInTypeOrder() {
        propagator.pushUpdatedState(store.get("device-1"), "button");

        ResourceUpdateMessage expected = new ResourceUpdateMessage("device-1", "device", "button",
                List.of("button-1", "button-2", "power-1"), false);
        verify(eventBus).emit("bridge_device-1", expected);
        verify(eventBus).emit(GLOBAL, expected);
        verifyNoMoreInteractions(eventBus);
    }

    @Test
    void suppressMessage_passedThrough() {
        propagator.pushUpdatedState(store.get("light-1"), "light", true);

        verify(eventBus).emit("bridge_light-1", new ResourceUpdateMessage("light-1", "light", "light", List.of(), true));
        verify(eventBus).emit(GLOBAL, new ResourceUpdateMessage("light-1", "light", "light", List.of(), true));
    }

    @Test
    void ownedResource_alsoNotifiesEveryGroup() {
        propagator.pushUpdatedState(store.get("grouped-light-1"), "grouped_light");

        ResourceUpdateMessage direct = new ResourceUpdateMessage("grouped-light-1", "grouped_light", "grouped_light",
                List.of(), false);
        ResourceUpdateMessage group = new ResourceUpdateMessage("room-1", "room", "grouped_light",
                List.of("grouped-light-1"), false);
        InOrder inOrder = inOrder(eventBus);
        inOrder.verify(eventBus).emit("bridge_grouped-light-1", direct);
        inOrder.verify(eventBus).emit(GLOBAL, direct);
        inOrder.verify(eventBus).emit("bridge_room-1", group);
        inOrder.verify(eventBus).emit(GLOBAL, group);
        verify(eventBus, times(4)).emit(anyString(), any());
    }

    @Test
    void groupNotInStore_fallsBackToGenericGroup() {
        ResourceStore storeWithDanglingGroup = mock(ResourceStore.class);
        Resource light = Resource.of(light());
        when(storeWithDanglingGroup.ownersOf("light-1")).thenReturn(List.of("group-x"));
        propagator = new StatePropagator(storeWithDanglingGroup, eventBus);

        propagator.pushUpdatedState(light, "light");

        ResourceUpdateMessage group = new ResourceUpdateMessage("group-x", "group", "light", List.of(), false);
        verify(eventBus).emit("bridge_group-x", group);
        verify(eventBus).emit(GLOBAL, group);
        verify(eventBus, times(4)).emit(anyString(), any());
    }
}
