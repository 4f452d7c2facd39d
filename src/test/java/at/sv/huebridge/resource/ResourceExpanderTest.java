package at.sv.huebridge.resource;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static at.sv.huebridge.resource.TestResources.button1;
import static at.sv.huebridge.resource.TestResources.button2;
import static at.sv.huebridge.resource.TestResources.devicePower;
import static at.sv.huebridge.resource.TestResources.dimmerSwitch;
import static at.sv.huebridge.resource.TestResources.groupedLight;
import static at.sv.huebridge.resource.TestResources.json;
import static at.sv.huebridge.resource.TestResources.light;
import static at.sv.huebridge.resource.TestResources.room;
import static org.assertj.core.api.Assertions.assertThat;

class ResourceExpanderTest {

    @Test
    void expand_embedsServicesUnderOwners_buildsIndex() {
        ExpandedResources expanded = ResourceExpander.expand(List.of(dimmerSwitch(), button1(), button2(),
                devicePower(), room(), groupedLight(), light()));

        Resource device = expanded.resources().get("device-1");
        assertThat(device.getServices(ServiceType.BUTTON)).containsOnlyKeys("button-1", "button-2");
        assertThat(device.getServices(ServiceType.BUTTON).get("button-1")).isSameAs(expanded.resources().get("button-1"));
        assertThat(device.getServices(ServiceType.DEVICE_POWER)).containsOnlyKeys("power-1");
        assertThat(expanded.resources().get("room-1").getServiceIds()).containsExactly("grouped-light-1");
        assertThat(expanded.owners()).containsOnlyKeys("button-1", "button-2", "power-1", "grouped-light-1");
        assertThat(expanded.owners().get("grouped-light-1")).containsExactly("room-1");
    }

    @Test
    void expand_keepsOrderAndAllFields() {
        ExpandedResources expanded = ResourceExpander.expand(List.of(light(), room()));

        assertThat(expanded.resources()).containsOnlyKeys("light-1", "room-1");
        assertThat(expanded.resources().values()).extracting(Resource::getId).containsExactly("light-1", "room-1");
        assertThat(expanded.resources().get("light-1").get("dimming").get("brightness").asDouble()).isEqualTo(50.0);
        assertThat(expanded.resources().get("room-1").getIdV1()).isEqualTo("/groups/1");
    }

    @Test
    void expand_referenceToUnknownResource_skipped() {
        ExpandedResources expanded = ResourceExpander.expand(List.of(dimmerSwitch(), button1()));

        assertThat(expanded.resources().get("device-1").getServiceIds()).containsExactly("button-1");
        assertThat(expanded.owners()).containsOnlyKeys("button-1");
    }

    @Test
    void expand_serviceOwnedTwice_bothOwnersIndexed() {
        ExpandedResources expanded = ResourceExpander.expand(List.of(light(), json("""
                {
                  "id": "room-1",
                  "type": "room",
                  "services": [{"rid": "light-1", "rtype": "light"}]
                }
                """), json("""
                {
                  "id": "zone-1",
                  "type": "zone",
                  "services": [{"rid": "light-1", "rtype": "light"}]
                }
                """)));

        assertThat(expanded.owners().get("light-1")).containsExactly("room-1", "zone-1");
    }

    @Test
    void expand_unsupportedServiceType_notEmbedded() {
        ExpandedResources expanded = ResourceExpander.expand(List.of(json("""
                {"id": "thing-1", "type": "some_future_type"}
                """), json("""
                {
                  "id": "device-1",
                  "type": "device",
                  "services": [{"rid": "thing-1", "rtype": "some_future_type"}]
                }
                """)));

        assertThat(expanded.resources()).containsOnlyKeys("thing-1", "device-1");
        assertThat(expanded.resources().get("device-1").hasServices()).isFalse();
        assertThat(expanded.owners()).isEmpty();
    }

    @Test
    void expand_entryWithoutId_skipped() {
        ExpandedResources expanded = ResourceExpander.expand(List.of(json("""
                {"type": "light"}
                """), light()));

        assertThat(expanded.resources()).containsOnlyKeys("light-1");
    }

    @Test
    void expand_doesNotModifyInput() {
        ObjectNode raw = light();

        ExpandedResources expanded = ResourceExpander.expand(List.of(raw));
        expanded.resources().get("light-1").setUpdated("now");

        assertThat(raw.has("updated")).isFalse();
    }
}
