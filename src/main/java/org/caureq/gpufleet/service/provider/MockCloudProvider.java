package org.caureq.gpufleet.service.provider;

import lombok.extern.slf4j.Slf4j;
import org.caureq.gpufleet.config.MockProviderProps;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory backend. Servers go created -> running on power on and
 * terminating -> terminated once {@code delete-after} has elapsed.
 */
@Component
@ConditionalOnProperty(prefix = "providers.mock", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class MockCloudProvider implements CloudProvider {
    public static final String NAME = "mock";
    private static final long BOOT_VOLUME_BYTES = 20L * 1024 * 1024 * 1024;

    private final MockProviderProps props;
    private final Clock clock;
    private final Map<String, Server> servers = new ConcurrentHashMap<>();
    private final Map<String, Volume> volumes = new ConcurrentHashMap<>();
    private final AtomicInteger ipSeq = new AtomicInteger();

    private static final class Server {
        final String id;
        final String name;
        final String zone;
        final String type;
        final Instant createdAt;
        volatile String state = "created";
        volatile String ip;
        volatile String bootstrap;
        volatile Instant terminateRequestedAt;

        Server(String id, String name, String zone, String type, Instant createdAt) {
            this.id = id; this.name = name; this.zone = zone; this.type = type; this.createdAt = createdAt;
        }
    }

    private static final class Volume {
        final String id;
        final String name;
        final String zone;
        final boolean boot;
        volatile long sizeBytes;
        volatile String serverId;

        Volume(String id, String name, String zone, long sizeBytes, boolean boot) {
            this.id = id; this.name = name; this.zone = zone; this.sizeBytes = sizeBytes; this.boot = boot;
        }
    }

    public MockCloudProvider(MockProviderProps props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    @Override
    public String name() { return NAME; }

    @Override
    public List<String> zones() {
        return props.zones() == null ? List.of() : props.zones();
    }

    @Override
    public String createInstance(CreateInstanceRequest request) {
        var outOfStock = props.outOfStockTypes() == null ? List.<String>of() : props.outOfStockTypes();
        if (outOfStock.stream().anyMatch(t -> t.equalsIgnoreCase(request.instanceType()))) {
            throw ProviderException.permanent(ProviderException.OUT_OF_STOCK,
                    "Instance type " + request.instanceType() + " is out of stock in " + request.zone());
        }
        var id = "mock-" + UUID.randomUUID();
        var server = new Server(id, request.name(), request.zone(), request.instanceType(), clock.instant());
        servers.put(id, server);

        var boot = new Volume("mock-vol-" + UUID.randomUUID(), request.name() + "-boot", request.zone(),
                BOOT_VOLUME_BYTES, true);
        boot.serverId = id;
        volumes.put(boot.id, boot);
        log.debug("[Mock] created {} type={} zone={}", id, request.instanceType(), request.zone());
        return id;
    }

    @Override
    public void startInstance(String zone, String serverId) {
        var s = require(zone, serverId);
        if ("terminating".equals(s.state)) {
            throw ProviderException.permanent(ProviderException.REJECTED, "Server " + serverId + " is terminating");
        }
        s.state = "running";
        if (s.ip == null) {
            int n = ipSeq.getAndIncrement();
            s.ip = String.format("10.0.%d.%d", (n / 250) % 250, 5 + n % 250);
        }
    }

    @Override
    public void terminateInstance(String zone, String serverId) {
        var s = find(zone, serverId);
        if (s == null || !isAlive(s)) {
            log.debug("[Mock] terminate {}: already gone", serverId);
            return;
        }
        if (!"terminating".equals(s.state)) {
            s.state = "terminating";
            s.terminateRequestedAt = clock.instant();
        }
    }

    @Override
    public Optional<String> getInstanceIp(String zone, String serverId) {
        var s = require(zone, serverId);
        return "running".equals(s.state) ? Optional.ofNullable(s.ip) : Optional.empty();
    }

    @Override
    public boolean instanceExists(String zone, String serverId) {
        var s = find(zone, serverId);
        return s != null && isAlive(s);
    }

    @Override
    public List<RemoteInstance> listInstances(String zone) {
        List<RemoteInstance> out = new ArrayList<>();
        for (var s : servers.values()) {
            if (!s.zone.equals(zone) || !isAlive(s)) continue;
            out.add(new RemoteInstance(s.id, s.name, s.zone, s.state, s.ip, s.createdAt));
        }
        return out;
    }

    @Override
    public void pushBootstrap(String zone, String serverId, String script) {
        require(zone, serverId).bootstrap = script;
    }

    @Override
    public String createVolume(String zone, String name, long sizeBytes) {
        var v = new Volume("mock-vol-" + UUID.randomUUID(), name, zone, sizeBytes, false);
        volumes.put(v.id, v);
        return v.id;
    }

    @Override
    public void attachVolume(String zone, String serverId, String volumeId) {
        require(zone, serverId);
        var v = requireVolume(volumeId);
        if (v.serverId != null && !v.serverId.equals(serverId)) {
            throw ProviderException.permanent(ProviderException.REJECTED,
                    "Volume " + volumeId + " is attached to " + v.serverId);
        }
        v.serverId = serverId;
    }

    @Override
    public void detachVolume(String zone, String serverId, String volumeId) {
        var v = volumes.get(volumeId);
        if (v != null && serverId.equals(v.serverId)) v.serverId = null;
    }

    @Override
    public void resizeVolume(String zone, String volumeId, long newSizeBytes) {
        var v = requireVolume(volumeId);
        if (newSizeBytes < v.sizeBytes) {
            throw ProviderException.permanent(ProviderException.REJECTED, "Volumes can only grow");
        }
        v.sizeBytes = newSizeBytes;
    }

    @Override
    public void deleteVolume(String zone, String volumeId) {
        if (volumes.remove(volumeId) == null) {
            log.debug("[Mock] volume {} already deleted", volumeId);
        }
    }

    @Override
    public List<AttachedVolume> listAttachedVolumes(String zone, String serverId) {
        require(zone, serverId);
        List<AttachedVolume> out = new ArrayList<>();
        for (var v : volumes.values()) {
            if (serverId.equals(v.serverId)) {
                out.add(new AttachedVolume(v.id, v.name, v.boot ? "l_ssd" : "sbs_volume", v.sizeBytes, v.boot));
            }
        }
        return out;
    }

    @Override
    public List<CatalogItem> fetchCatalog(String zone) {
        return List.of(
                new CatalogItem("MOCK-GPU-S", "MOCK-GPU-S", 0.25, 8, 32, 1, 24, 1_000_000_000L),
                new CatalogItem("MOCK-4GPU-M", "MOCK-4GPU-M", 0.75, 16, 64, 4, 48, 2_000_000_000L));
    }

    /** Drops a server as if deleted out-of-band by the provider. */
    public void simulateProviderDeletion(String serverId) {
        servers.remove(serverId);
    }

    /** Current bootstrap script, null if none was pushed. */
    public String bootstrapOf(String serverId) {
        var s = servers.get(serverId);
        return s == null ? null : s.bootstrap;
    }

    public boolean volumeExists(String volumeId) {
        return volumes.containsKey(volumeId);
    }

    private boolean isAlive(Server s) {
        if ("terminating".equals(s.state) && s.terminateRequestedAt != null) {
            Duration after = props.deleteAfter() == null ? Duration.ofSeconds(15) : props.deleteAfter();
            if (!clock.instant().isBefore(s.terminateRequestedAt.plus(after))) {
                s.state = "terminated";
            }
        }
        return !"terminated".equals(s.state);
    }

    private Server find(String zone, String serverId) {
        var s = servers.get(serverId);
        if (s == null || (zone != null && !s.zone.equals(zone))) return null;
        return s;
    }

    private Server require(String zone, String serverId) {
        var s = find(zone, serverId);
        if (s == null || !isAlive(s)) {
            throw ProviderException.notFound("Server " + serverId + " not found in " + zone);
        }
        return s;
    }

    private Volume requireVolume(String volumeId) {
        var v = volumes.get(volumeId);
        if (v == null) throw ProviderException.notFound("Volume " + volumeId + " not found");
        return v;
    }
}
