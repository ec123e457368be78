package org.caureq.gpufleet.service.provider;

/** @param name server name, derived from the ledger id so retries are recognisable */
public record CreateInstanceRequest(String zone, String instanceType, String image, String name) {}
