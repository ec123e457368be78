package org.caureq.gpufleet.service.provider;

public record AttachedVolume(String volumeId, String name, String volumeType, long sizeBytes, boolean boot) {}
