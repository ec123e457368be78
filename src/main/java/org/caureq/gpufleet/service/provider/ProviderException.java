package org.caureq.gpufleet.service.provider;

import java.util.Map;

/**
 * Failure reported by a {@link CloudProvider}. {@code retryable} separates
 * transient errors (retry next tick) from permanent ones (terminal failure).
 */
public class ProviderException extends RuntimeException {
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String OUT_OF_STOCK = "OUT_OF_STOCK";
    public static final String TIMEOUT = "PROVIDER_TIMEOUT";
    public static final String UNAVAILABLE = "PROVIDER_UNAVAILABLE";
    public static final String REJECTED = "PROVIDER_REJECTED";

    private final int status;
    private final String code;
    private final boolean retryable;
    private final Map<String, Object> payload;

    public ProviderException(int status, String code, boolean retryable, String message,
                             Map<String, Object> payload, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
        this.retryable = retryable;
        this.payload = payload == null ? Map.of() : payload;
    }

    public static ProviderException transientError(String code, String message, Throwable cause) {
        return new ProviderException(0, code, true, message, Map.of(), cause);
    }

    public static ProviderException permanent(String code, String message) {
        return new ProviderException(0, code, false, message, Map.of(), null);
    }

    public static ProviderException notFound(String message) {
        return new ProviderException(404, NOT_FOUND, false, message, Map.of(), null);
    }

    /** Maps an HTTP error answer to the transient/permanent taxonomy. */
    public static ProviderException fromHttpStatus(int status, String body) {
        String raw = body == null ? "" : body;
        String message = "Provider API error " + status + (raw.isBlank() ? "" : " -> " + raw);
        if (status == 404) {
            return new ProviderException(status, NOT_FOUND, false, message, Map.of("raw", raw), null);
        }
        if (status == 408 || status == 429 || status >= 500) {
            return new ProviderException(status, UNAVAILABLE, true, message, Map.of("raw", raw), null);
        }
        String code = raw.toLowerCase().contains("out_of_stock") ? OUT_OF_STOCK : REJECTED;
        return new ProviderException(status, code, false, message, Map.of("raw", raw), null);
    }

    public int status() { return status; }
    public String code() { return code; }
    public boolean retryable() { return retryable; }
    public Map<String, Object> payload() { return payload; }

    public boolean isNotFound() { return status == 404 || NOT_FOUND.equals(code); }
    public boolean isOutOfStock() { return OUT_OF_STOCK.equals(code); }
}
