package org.caureq.gpufleet.service.provider;

public record CatalogItem(String code, String name, double costPerHour, int cpuCount, int ramGb,
                          int gpuCount, int vramPerGpuGb, long bandwidthBps) {}
