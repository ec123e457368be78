package org.caureq.gpufleet.service.provider;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProviderExceptionTest {

    @Test
    void notFoundIsPermanentAndRecognised() {
        var ex = ProviderException.fromHttpStatus(404, "{\"type\":\"not_found\"}");

        assertTrue(ex.isNotFound());
        assertFalse(ex.retryable());
        assertEquals(404, ex.status());
    }

    @Test
    void serverErrorsThrottlingAndTimeoutsAreTransient() {
        assertTrue(ProviderException.fromHttpStatus(500, "").retryable());
        assertTrue(ProviderException.fromHttpStatus(503, "busy").retryable());
        assertTrue(ProviderException.fromHttpStatus(429, "slow down").retryable());
        assertTrue(ProviderException.fromHttpStatus(408, "").retryable());
    }

    @Test
    void outOfStockIsDetectedFromTheBody() {
        var ex = ProviderException.fromHttpStatus(412, "{\"message\":\"OUT_OF_STOCK for L4-1-24G\"}");

        assertTrue(ex.isOutOfStock());
        assertFalse(ex.retryable());
    }

    @Test
    void otherClientErrorsAreRejections() {
        var ex = ProviderException.fromHttpStatus(400, "bad commercial_type");

        assertEquals(ProviderException.REJECTED, ex.code());
        assertFalse(ex.retryable());
        assertTrue(ex.getMessage().contains("bad commercial_type"));
    }
}
