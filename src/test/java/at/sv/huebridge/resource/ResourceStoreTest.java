package at.sv.huebridge.resource;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static at.sv.huebridge.resource.TestResources.button1;
import static at.sv.huebridge.resource.TestResources.button2;
import static at.sv.huebridge.resource.TestResources.createStore;
import static at.sv.huebridge.resource.TestResources.devicePower;
import static at.sv.huebridge.resource.TestResources.dimmerSwitch;
import static at.sv.huebridge.resource.TestResources.json;
import static at.sv.huebridge.resource.TestResources.light;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceStoreTest {

    private ResourceStore store;

    @BeforeEach
    void setUp() {
        store = createStore(dimmerSwitch(), button1(), button2(), devicePower(), light());
    }

    @Test
    void get_unknown_null() {
        assertThat(store.get("unknown")).isNull();
        assertThat(store.contains("unknown")).isFalse();
    }

    @Test
    void ownersOf_unowned_empty() {
        assertThat(store.ownersOf("light-1")).isEmpty();
        assertThat(store.ownersOf("unknown")).isEmpty();
    }

    @Test
    void ownersOf_service_returnsOwner() {
        assertThat(store.ownersOf("button-1")).containsExactly("device-1");
    }

    @Test
    void embeddedServices_areTheStoredInstances() {
        Resource device = store.get("device-1");

        assertThat(device.getServices(ServiceType.BUTTON).get("button-1")).isSameAs(store.get("button-1"));

        store.get("button-1").setUpdated("2024-03-01T18:30:05Z");

        assertThat(device.getServices(ServiceType.BUTTON).get("button-1").getUpdated()).isEqualTo("2024-03-01T18:30:05Z");
    }

    @Test
    void put_replacingEmbeddedService_relinksOwner() {
        Resource replacement = Resource.of(json("""
                {"id": "button-1", "type": "button", "button": {"last_event": "long_press"}}
                """));

        store.put("button-1", replacement);

        assertThat(store.get("button-1")).isSameAs(replacement);
        assertThat(store.get("device-1").getServices(ServiceType.BUTTON).get("button-1")).isSameAs(replacement);
        assertThat(store.ownersOf("button-1")).containsExactly("device-1");
    }

    @Test
    void put_newResource_added() {
        store.put("light-2", Resource.of(json("""
                {"id": "light-2", "type": "light"}
                """)));

        assertThat(store.size()).isEqualTo(6);
        assertThat(store.getResources()).last().extracting(Resource::getId).isEqualTo("light-2");
    }

    @Test
    void getResources_snapshotInInsertionOrder() {
        List<Resource> resources = store.getResources();
        store.put("light-2", Resource.of(json("""
                {"id": "light-2", "type": "light"}
                """)));

        assertThat(resources).extracting(Resource::getId)
                             .containsExactly("device-1", "button-1", "button-2", "power-1", "light-1");
    }

    @Test
    void putAll_reEnumeratedGraph_replacesOwnershipIndex() {
        store = createStore(light(), json("""
                {
                  "id": "zone-a",
                  "type": "zone",
                  "services": [
                    {"rid": "light-1", "rtype": "light"}
                  ]
                }
                """));
        assertThat(store.ownersOf("light-1")).containsExactly("zone-a");

        store.putAll(ResourceExpander.expand(List.of(light(), json("""
                {"id": "zone-a", "type": "zone", "services": []}
                """))));

        assertThat(store.ownersOf("light-1")).isEmpty();
        assertThat(store.get("zone-a").getServiceIds()).isEmpty();
        assertThat(store.get("light-1")).isNotNull();
    }

    @Test
    void putAll_ownerNeitherGivenNorStored_throws_nothingCommitted() {
        Resource light2 = Resource.of(json("""
                {"id": "light-2", "type": "light"}
                """));

        assertThatThrownBy(() -> store.putAll(new ExpandedResources(Map.of("light-2", light2),
                Map.of("light-2", List.of("zone-x")))))
                .isInstanceOf(MissingResourceException.class)
                .hasMessageContaining("No resource entry for 'zone-x'");

        assertThat(store.contains("light-2")).isFalse();
        assertThat(store.ownersOf("button-1")).containsExactly("device-1");
    }

    @Test
    void putAll_ownerAlreadyStored_accepted() {
        Resource light2 = Resource.of(json("""
                {"id": "light-2", "type": "light"}
                """));

        store.putAll(new ExpandedResources(Map.of("light-2", light2), Map.of("light-2", List.of("device-1"))));

        assertThat(store.ownersOf("light-2")).containsExactly("device-1");
        assertThat(store.ownersOf("button-1")).isEmpty();
    }
}
