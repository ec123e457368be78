package org.caureq.gpufleet.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.config.ScalewayProps;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/** Scaleway Instance + Block Storage driver. */
@Component
@ConditionalOnProperty(prefix = "providers.scaleway", name = "enabled", havingValue = "true")
@Slf4j
public class ScalewayProvider implements CloudProvider {
    public static final String NAME = "scaleway";
    static final int SERVERS_PAGE_SIZE = 100;

    private final ScalewayProps props;
    private final WebClient http;
    private final ObjectMapper om = new ObjectMapper();

    public ScalewayProvider(ScalewayProps props, @Qualifier("scalewayWebClient") WebClient http) {
        this.props = props;
        this.http = http;
    }

    @PostConstruct
    void checkToken() {
        var key = props.secretKey() == null ? "" : props.secretKey();
        var masked = key.length() > 4 ? key.substring(0, 4) + "********" : "(missing)";
        log.info("[Scaleway] X-Auth-Token = {} project={}", masked, props.projectId());
    }

    /** Centralised error mapping: non-2xx, timeouts and I/O all become {@link ProviderException}. */
    private <T> Mono<T> handle(WebClient.ResponseSpec spec, Class<T> bodyType) {
        return spec
                .onStatus(s -> !s.is2xxSuccessful(),
                        r -> r.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> ProviderException.fromHttpStatus(r.statusCode().value(), body))
                )
                .bodyToMono(bodyType)
                .timeout(timeout())
                .retryWhen(
                        Retry.backoff(1, Duration.ofMillis(400)).jitter(0.4)
                                .filter(ex -> ex instanceof IOException || ex instanceof WebClientRequestException)
                                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure())
                )
                .onErrorMap(TimeoutException.class, ex -> ProviderException.transientError(
                        ProviderException.TIMEOUT, "Scaleway call exceeded " + timeout(), ex))
                .onErrorMap(WebClientRequestException.class, ex -> ProviderException.transientError(
                        ProviderException.UNAVAILABLE, "Scaleway unreachable: " + ex.getMessage(), ex));
    }

    private Duration timeout() {
        return props.timeout() == null ? Duration.ofSeconds(30) : props.timeout();
    }

    private JsonNode get(String uri, Object... vars) {
        var spec = http.get().uri(uri, vars)
                .header("X-Auth-Token", props.secretKey())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve();
        return handle(spec, JsonNode.class).block();
    }

    private JsonNode send(String method, Object body, String uri, Object... vars) {
        var req = switch (method) {
            case "POST" -> http.post().uri(uri, vars);
            case "PATCH" -> http.patch().uri(uri, vars);
            default -> throw new IllegalArgumentException("Unsupported method " + method);
        };
        var spec = req.header("X-Auth-Token", props.secretKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve();
        return handle(spec, JsonNode.class).block();
    }

    private void delete(String uri, Object... vars) {
        var spec = http.delete().uri(uri, vars)
                .header("X-Auth-Token", props.secretKey())
                .retrieve();
        handle(spec, String.class).block();
    }

    /* --------------------- servers --------------------- */

    @Override
    public String name() { return NAME; }

    @Override
    public List<String> zones() {
        return props.zones() == null ? List.of() : props.zones();
    }

    @Override
    public String createInstance(CreateInstanceRequest request) {
        // a retried create reuses the server left by an attempt that failed after the call
        var existing = get("/instance/v1/zones/{zone}/servers?name={name}", request.zone(), request.name());
        for (var s : existing.path("servers")) {
            if (request.name().equals(s.path("name").asText()) && !"terminated".equals(s.path("state").asText())) {
                log.info("[Scaleway] reusing server {} for {}", s.path("id").asText(), request.name());
                return s.path("id").asText();
            }
        }

        var body = om.createObjectNode();
        body.put("name", request.name());
        body.put("commercial_type", request.instanceType());
        body.put("project", props.projectId());
        body.put("image", request.image() == null ? props.image() : request.image());
        body.set("tags", om.valueToTree(List.of("gpu-fleet", "worker")));
        body.put("dynamic_ip_required", true);

        var json = send("POST", body, "/instance/v1/zones/{zone}/servers", request.zone());
        var id = json.path("server").path("id").asText("");
        if (id.isBlank()) {
            throw ProviderException.permanent(ProviderException.REJECTED, "Create answer carried no server id");
        }
        return id;
    }

    private String serverState(String zone, String serverId) {
        return get("/instance/v1/zones/{zone}/servers/{id}", zone, serverId)
                .path("server").path("state").asText("");
    }

    @Override
    public void startInstance(String zone, String serverId) {
        var state = serverState(zone, serverId);
        if ("running".equals(state) || "starting".equals(state)) return;
        send("POST", Map.of("action", "poweron"), "/instance/v1/zones/{zone}/servers/{id}/action", zone, serverId);
    }

    @Override
    public void terminateInstance(String zone, String serverId) {
        try {
            send("POST", Map.of("action", "terminate"), "/instance/v1/zones/{zone}/servers/{id}/action", zone, serverId);
        } catch (ProviderException ex) {
            if (!ex.isNotFound()) throw ex;
            log.debug("[Scaleway] terminate {}: already gone", serverId);
        }
    }

    @Override
    public Optional<String> getInstanceIp(String zone, String serverId) {
        var server = get("/instance/v1/zones/{zone}/servers/{id}", zone, serverId).path("server");
        var ip = server.path("public_ip").path("address").asText("");
        if (ip.isBlank()) {
            for (var p : server.path("public_ips")) {
                ip = p.path("address").asText("");
                if (!ip.isBlank()) break;
            }
        }
        return ip.isBlank() ? Optional.empty() : Optional.of(ip);
    }

    @Override
    public boolean instanceExists(String zone, String serverId) {
        try {
            var state = serverState(zone, serverId);
            return !"terminated".equals(state);
        } catch (ProviderException ex) {
            if (ex.isNotFound()) return false;
            throw ex;
        }
    }

    @Override
    public List<RemoteInstance> listInstances(String zone) {
        List<RemoteInstance> out = new ArrayList<>();
        for (int page = 1; ; page++) {
            var json = get("/instance/v1/zones/{zone}/servers?per_page={size}&page={page}", zone, SERVERS_PAGE_SIZE, page);
            var servers = json.path("servers");
            for (var s : servers) {
                var ip = s.path("public_ip").path("address").asText("");
                out.add(new RemoteInstance(
                        s.path("id").asText(),
                        s.path("name").asText(),
                        zone,
                        s.path("state").asText(),
                        ip.isBlank() ? null : ip,
                        parseInstant(s.path("creation_date").asText(null))));
            }
            int total = json.path("total_count").asInt(-1);
            boolean more = total >= 0 ? out.size() < total : servers.size() == SERVERS_PAGE_SIZE;
            if (servers.isEmpty() || !more) return out;
        }
    }

    @Override
    public void pushBootstrap(String zone, String serverId, String script) {
        var spec = http.patch().uri("/instance/v1/zones/{zone}/servers/{id}/user_data/cloud-init", zone, serverId)
                .header("X-Auth-Token", props.secretKey())
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue(script)
                .retrieve();
        handle(spec, String.class).block();
    }

    /* --------------------- volumes --------------------- */

    @Override
    public String createVolume(String zone, String name, long sizeBytes) {
        var body = om.createObjectNode();
        body.put("name", name);
        body.put("project_id", props.projectId());
        body.putObject("from_empty").put("size", sizeBytes);
        var json = send("POST", body, "/block/v1/zones/{zone}/volumes", zone);
        return json.path("id").asText();
    }

    @Override
    public void attachVolume(String zone, String serverId, String volumeId) {
        var attached = listAttachedVolumes(zone, serverId);
        if (attached.stream().anyMatch(v -> v.volumeId().equals(volumeId))) return;
        send("POST", Map.of("volume_id", volumeId, "volume_type", "sbs_volume"),
                "/instance/v1/zones/{zone}/servers/{id}/attach-volume", zone, serverId);
    }

    @Override
    public void detachVolume(String zone, String serverId, String volumeId) {
        try {
            send("POST", Map.of("volume_id", volumeId),
                    "/instance/v1/zones/{zone}/servers/{id}/detach-volume", zone, serverId);
        } catch (ProviderException ex) {
            if (!ex.isNotFound()) throw ex;
            log.debug("[Scaleway] detach {} from {}: nothing attached", volumeId, serverId);
        }
    }

    @Override
    public void resizeVolume(String zone, String volumeId, long newSizeBytes) {
        send("PATCH", Map.of("size", newSizeBytes), "/block/v1/zones/{zone}/volumes/{id}", zone, volumeId);
    }

    @Override
    public void deleteVolume(String zone, String volumeId) {
        try {
            delete("/block/v1/zones/{zone}/volumes/{id}", zone, volumeId);
            return;
        } catch (ProviderException ex) {
            if (!ex.isNotFound()) throw ex;
        }
        // local volumes live in the Instance API
        try {
            delete("/instance/v1/zones/{zone}/volumes/{id}", zone, volumeId);
        } catch (ProviderException ex) {
            if (!ex.isNotFound()) throw ex;
            log.debug("[Scaleway] volume {} already deleted", volumeId);
        }
    }

    @Override
    public List<AttachedVolume> listAttachedVolumes(String zone, String serverId) {
        var server = get("/instance/v1/zones/{zone}/servers/{id}", zone, serverId).path("server");
        List<AttachedVolume> out = new ArrayList<>();
        var it = server.path("volumes").fields();
        while (it.hasNext()) {
            var e = it.next();
            var v = e.getValue();
            out.add(new AttachedVolume(
                    v.path("id").asText(),
                    v.path("name").asText(""),
                    v.path("volume_type").asText(""),
                    v.path("size").asLong(0),
                    v.path("boot").asBoolean("0".equals(e.getKey()))));
        }
        return out;
    }

    /* --------------------- catalog --------------------- */

    @Override
    public List<CatalogItem> fetchCatalog(String zone) {
        var json = get("/instance/v1/zones/{zone}/products/servers", zone);
        List<CatalogItem> items = new ArrayList<>();
        var it = json.path("servers").fields();
        while (it.hasNext()) {
            var e = it.next();
            var d = e.getValue();
            items.add(new CatalogItem(
                    e.getKey(),
                    e.getKey(),
                    d.path("hourly_price").asDouble(0.0),
                    d.path("ncpus").asInt(0),
                    (int) (d.path("ram").asLong(0) / (1024L * 1024 * 1024)),
                    d.path("gpu").asInt(0),
                    (int) (d.path("gpu_info").path("gpu_memory").asLong(0) / (1024L * 1024 * 1024)),
                    d.path("network").path("sum_internet_bandwidth").asLong(0)));
        }
        return items;
    }

    private static Instant parseInstant(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("[Scaleway] unparseable creation_date {}", s);
            return null;
        }
    }
}
