package org.caureq.gpufleet.service.provider;

import java.util.List;
import java.util.Optional;

/**
 * Capability set of a compute backend. Implementations never touch the ledger:
 * they return facts or throw {@link ProviderException}. Mutating calls must be
 * safe to repeat.
 */
public interface CloudProvider {

    /** Key persisted in {@code instances.provider}. */
    String name();

    /** Zones scanned by catalog sync and full reconciliation. */
    List<String> zones();

    /** @return the provider-assigned server id */
    String createInstance(CreateInstanceRequest request);

    void startInstance(String zone, String serverId);

    /** Requests deletion; an already deleted server is not an error. */
    void terminateInstance(String zone, String serverId);

    /** Empty while the address is still pending. */
    Optional<String> getInstanceIp(String zone, String serverId);

    boolean instanceExists(String zone, String serverId);

    List<RemoteInstance> listInstances(String zone);

    /** Hands the worker bootstrap script (cloud-init user data) to the server. */
    void pushBootstrap(String zone, String serverId, String script);

    String createVolume(String zone, String name, long sizeBytes);

    void attachVolume(String zone, String serverId, String volumeId);

    void detachVolume(String zone, String serverId, String volumeId);

    void resizeVolume(String zone, String volumeId, long newSizeBytes);

    /** A volume that is already gone counts as deleted. */
    void deleteVolume(String zone, String volumeId);

    List<AttachedVolume> listAttachedVolumes(String zone, String serverId);

    List<CatalogItem> fetchCatalog(String zone);
}
