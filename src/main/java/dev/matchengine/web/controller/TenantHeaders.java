package dev.matchengine.web.controller;

/**
 * Resolves the tenant of a request from the {@code X-Tenant-Id} header.
 */
final class TenantHeaders {

    static final String TENANT_HEADER = "X-Tenant-Id";

    private TenantHeaders() {
    }

    static String require(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException(TENANT_HEADER + " header is required");
        }
        return tenantId.trim();
    }
}
