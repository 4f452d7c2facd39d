package at.sv.huebridge.resource;

import at.sv.huebridge.api.ApiFailure;
import at.sv.huebridge.api.HueBridgeApi;
import at.sv.huebridge.api.UpstreamFetchFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static at.sv.huebridge.resource.TestResources.button1;
import static at.sv.huebridge.resource.TestResources.button2;
import static at.sv.huebridge.resource.TestResources.devicePower;
import static at.sv.huebridge.resource.TestResources.dimmerSwitch;
import static at.sv.huebridge.resource.TestResources.json;
import static at.sv.huebridge.resource.TestResources.light;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResourceEnumeratorTest {

    @Mock
    private HueBridgeApi api;
    private ResourceStore store;
    private ResourceEnumerator enumerator;

    @BeforeEach
    void setUp() {
        store = new ResourceStore();
        BridgeInformationFetcher fetcher = new BridgeInformationFetcher(api, store,
                () -> ZonedDateTime.of(2024, 3, 1, 18, 30, 5, 0, ZoneId.of("UTC")));
        enumerator = new ResourceEnumerator(api, fetcher, store);
    }

    @Test
    void enumerateAll_bridgeRulesAndGraph_committedToStore() {
        when(api.fetchConfig()).thenReturn(json("""
                {"name": "Philips hue"}
                """));
        when(api.fetchLegacyRules()).thenReturn(Map.of("3", json("""
                {"name": "Wall switch rule"}
                """)));
        when(api.fetchAllGraphResources()).thenReturn(List.of(dimmerSwitch(), button1(), button2(), devicePower(),
                light()));

        List<Resource> resources = enumerator.enumerateAll();

        assertThat(resources).extracting(Resource::getId)
                             .containsExactly("bridge", "rule_3", "device-1", "button-1", "button-2", "power-1",
                                     "light-1");
        assertThat(resources).allSatisfy(resource -> {
            assertThat(resource.has(Resource.ID)).isTrue();
            assertThat(resource.has(Resource.ID_V1)).isTrue();
            assertThat(resource.has(Resource.TYPE)).isTrue();
        });
        assertThat(store.getResources()).containsExactlyElementsOf(resources);
        assertThat(store.ownersOf("button-2")).containsExactly("device-1");
        assertThat(store.get("device-1").getServices(ServiceType.BUTTON).get("button-2")).isSameAs(store.get("button-2"));
        assertThat(store.get("bridge").getUpdated()).isEqualTo("2024-03-01T18:30:05Z");
    }

    @Test
    void enumerateAll_graphFails_storeUntouched() {
        when(api.fetchConfig()).thenReturn(json("""
                {"name": "Philips hue"}
                """));
        when(api.fetchLegacyRules()).thenReturn(Map.of());
        when(api.fetchAllGraphResources()).thenThrow(new ApiFailure("Missing data in response"));

        assertThatThrownBy(() -> enumerator.enumerateAll())
                .isInstanceOf(UpstreamFetchFailure.class)
                .hasMessageContaining("resource graph")
                .hasCauseInstanceOf(ApiFailure.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void enumerateAll_configFails_nothingElseFetched() {
        when(api.fetchConfig()).thenThrow(new ApiFailure("Empty response"));

        assertThatThrownBy(() -> enumerator.enumerateAll()).isInstanceOf(UpstreamFetchFailure.class);
        assertThat(store.size()).isZero();
    }
}
