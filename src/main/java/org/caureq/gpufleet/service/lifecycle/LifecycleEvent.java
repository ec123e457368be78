package org.caureq.gpufleet.service.lifecycle;

public enum LifecycleEvent {
    /** provider create + power on succeeded */
    PROVIDER_STARTED,
    /** unrecoverable provider error, or retries exhausted */
    PROVISIONING_FAILED,
    /** fresh heartbeat with a ready worker */
    WORKER_READY,
    STARTUP_TIMED_OUT,
    DRAIN_REQUESTED,
    TERMINATE_REQUESTED,
    /** remote server gone and owned volumes resolved */
    TERMINATION_CONFIRMED,
    /** remote server disappeared outside of our control */
    PROVIDER_DELETED,
    ARCHIVE_REQUESTED
}
