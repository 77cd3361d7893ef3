package dev.matchengine.exception;

/**
 * Raised when a pair crosses tenants or the anchor has no tenant.
 * Surfaced to callers exactly like a missing entity.
 */
public class TenantMismatchException extends RuntimeException {

    public TenantMismatchException(String message) {
        super(message);
    }
}
