package org.caureq.gpufleet.service.provider;

import org.caureq.gpufleet.config.ScalewayProps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScalewayProviderTest {
    private static final String ZONE = "fr-par-2";

    /** Canned answers keyed by "METHOD path" or "METHOD path?query"; unknown routes answer 404. */
    private final Map<String, ClientResponse> routes = new LinkedHashMap<>();
    private final List<ClientRequest> requests = new ArrayList<>();
    private ScalewayProvider provider;

    @BeforeEach
    void setUp() {
        var http = WebClient.builder()
                .baseUrl("https://api.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    var key = request.method().name() + " " + request.url().getPath();
                    var query = request.url().getQuery();
                    var response = query == null ? null : routes.get(key + "?" + query);
                    if (response == null) response = routes.get(key);
                    return Mono.just(response != null ? response : ClientResponse.create(HttpStatus.NOT_FOUND)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body("{\"type\":\"not_found\"}")
                            .build());
                })
                .build();
        provider = new ScalewayProvider(new ScalewayProps(true, "https://api.test", "secret-key", "project-1",
                "ubuntu_jammy_gpu_os_12", List.of(ZONE), Duration.ofSeconds(5)), http);
    }

    private void route(HttpMethod method, String path, HttpStatus status, String json) {
        routes.put(method.name() + " " + path, ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(json)
                .build());
    }

    private long calls(HttpMethod method, String path) {
        return requests.stream()
                .filter(r -> r.method().equals(method) && r.url().getPath().equals(path))
                .count();
    }

    @Test
    void createReusesAServerLeftByAnEarlierAttempt() {
        route(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers", HttpStatus.OK,
                "{\"servers\":[{\"id\":\"srv-1\",\"name\":\"gpu-abc\",\"state\":\"stopped\"}]}");

        var id = provider.createInstance(new CreateInstanceRequest(ZONE, "L4-1-24G", null, "gpu-abc"));

        assertEquals("srv-1", id);
        assertEquals(0, calls(HttpMethod.POST, "/instance/v1/zones/fr-par-2/servers"));
    }

    @Test
    void createPostsWhenNoServerCarriesTheName() {
        route(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers", HttpStatus.OK, "{\"servers\":[]}");
        route(HttpMethod.POST, "/instance/v1/zones/fr-par-2/servers", HttpStatus.CREATED,
                "{\"server\":{\"id\":\"srv-new\"}}");

        var id = provider.createInstance(new CreateInstanceRequest(ZONE, "L4-1-24G", null, "gpu-abc"));

        assertEquals("srv-new", id);
        assertEquals("secret-key", requests.get(1).headers().getFirst("X-Auth-Token"));
    }

    @Test
    void listingFollowsPagesUntilTheTotalIsReached() {
        var first = new StringBuilder("{\"total_count\":102,\"servers\":[");
        for (int i = 0; i < 100; i++) {
            if (i > 0) first.append(',');
            first.append("{\"id\":\"srv-").append(i).append("\",\"name\":\"gpu-").append(i)
                    .append("\",\"state\":\"running\"}");
        }
        first.append("]}");
        route(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers?per_page=100&page=1", HttpStatus.OK, first.toString());
        route(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers?per_page=100&page=2", HttpStatus.OK,
                "{\"total_count\":102,\"servers\":[{\"id\":\"srv-100\",\"name\":\"gpu-100\",\"state\":\"running\","
                        + "\"public_ip\":{\"address\":\"51.15.0.1\"}},"
                        + "{\"id\":\"srv-101\",\"name\":\"gpu-101\",\"state\":\"stopped\"}]}");

        var servers = provider.listInstances(ZONE);

        assertEquals(102, servers.size());
        assertEquals("srv-101", servers.get(101).providerId());
        assertEquals("51.15.0.1", servers.get(100).ipAddress());
        assertEquals(2, calls(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers"));
    }

    @Test
    void listingStopsOnAShortPage() {
        route(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers", HttpStatus.OK,
                "{\"servers\":[{\"id\":\"srv-1\",\"name\":\"gpu-a\",\"state\":\"running\"}]}");

        assertEquals(1, provider.listInstances(ZONE).size());
        assertEquals(1, calls(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers"));
    }

    @Test
    void outOfStockAnswerIsPermanent() {
        route(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers", HttpStatus.OK, "{\"servers\":[]}");
        route(HttpMethod.POST, "/instance/v1/zones/fr-par-2/servers", HttpStatus.PRECONDITION_FAILED,
                "{\"type\":\"out_of_stock\",\"message\":\"no L4 left\"}");

        var ex = assertThrows(ProviderException.class, () -> provider.createInstance(
                new CreateInstanceRequest(ZONE, "L4-1-24G", null, "gpu-abc")));

        assertTrue(ex.isOutOfStock());
        assertFalse(ex.retryable());
    }

    @Test
    void serverErrorIsTransient() {
        route(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers/srv-1", HttpStatus.SERVICE_UNAVAILABLE,
                "{\"message\":\"maintenance\"}");

        var ex = assertThrows(ProviderException.class, () -> provider.getInstanceIp(ZONE, "srv-1"));

        assertTrue(ex.retryable());
        assertEquals(503, ex.status());
    }

    @Test
    void missingServerDoesNotExist() {
        assertFalse(provider.instanceExists(ZONE, "srv-gone"));
    }

    @Test
    void terminatedServerDoesNotExist() {
        route(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers/srv-1", HttpStatus.OK,
                "{\"server\":{\"id\":\"srv-1\",\"state\":\"terminated\"}}");

        assertFalse(provider.instanceExists(ZONE, "srv-1"));
    }

    @Test
    void terminatingAMissingServerSucceeds() {
        assertDoesNotThrow(() -> provider.terminateInstance(ZONE, "srv-gone"));
    }

    @Test
    void deletingAMissingVolumeSucceeds() {
        assertDoesNotThrow(() -> provider.deleteVolume(ZONE, "vol-gone"));
        assertEquals(1, calls(HttpMethod.DELETE, "/block/v1/zones/fr-par-2/volumes/vol-gone"));
        assertEquals(1, calls(HttpMethod.DELETE, "/instance/v1/zones/fr-par-2/volumes/vol-gone"));
    }

    @Test
    void ipFallsBackToThePublicIpList() {
        route(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers/srv-1", HttpStatus.OK,
                "{\"server\":{\"id\":\"srv-1\",\"state\":\"running\",\"public_ip\":null,"
                        + "\"public_ips\":[{\"address\":\"51.15.0.7\"}]}}");

        assertEquals(Optional.of("51.15.0.7"), provider.getInstanceIp(ZONE, "srv-1"));
    }

    @Test
    void startIsSkippedForARunningServer() {
        route(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers/srv-1", HttpStatus.OK,
                "{\"server\":{\"id\":\"srv-1\",\"state\":\"running\"}}");

        provider.startInstance(ZONE, "srv-1");

        assertEquals(0, calls(HttpMethod.POST, "/instance/v1/zones/fr-par-2/servers/srv-1/action"));
    }

    @Test
    void attachedVolumesMarkTheBootSlot() {
        route(HttpMethod.GET, "/instance/v1/zones/fr-par-2/servers/srv-1", HttpStatus.OK,
                "{\"server\":{\"id\":\"srv-1\",\"volumes\":{"
                        + "\"0\":{\"id\":\"vol-boot\",\"volume_type\":\"l_ssd\",\"size\":20000000000},"
                        + "\"1\":{\"id\":\"vol-data\",\"volume_type\":\"sbs_volume\",\"size\":200000000000}}}}");

        var volumes = provider.listAttachedVolumes(ZONE, "srv-1");

        assertEquals(2, volumes.size());
        assertTrue(volumes.get(0).boot());
        assertFalse(volumes.get(1).boot());
        assertEquals("vol-data", volumes.get(1).volumeId());
    }
}
