package com.xksgroup.catalogsync.model.dto;

/**
 * Outcome of a catalog call. The orchestrator switches on {@link Kind} instead of catching exceptions.
 *
 * @param kind   OK, RETRYABLE (session expired, refresh and repeat) or FATAL (give up)
 * @param value  payload for OK; may be null when the catalog answered with nothing
 * @param reason human-readable cause for RETRYABLE and FATAL
 */
public record CatalogResult<T>(Kind kind, T value, String reason) {

    public enum Kind { OK, RETRYABLE, FATAL }

    public static <T> CatalogResult<T> ok(T value) {
        return new CatalogResult<>(Kind.OK, value, null);
    }

    public static <T> CatalogResult<T> retryable(String reason) {
        return new CatalogResult<>(Kind.RETRYABLE, null, reason);
    }

    public static <T> CatalogResult<T> fatal(String reason) {
        return new CatalogResult<>(Kind.FATAL, null, reason);
    }

    public boolean isEmpty() {
        return value == null;
    }
}
