package org.caureq.gpufleet.api.dto;

import jakarta.validation.constraints.Size;

public record TerminateRequestDTO(@Size(max = 64) String reason) {}
