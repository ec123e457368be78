package org.caureq.gpufleet.domain;

public enum VolumeKind { BOOT, DATA }
