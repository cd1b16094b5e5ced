package dev.ragservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Result of removing a tenant's documents. */
public record DeleteResponse(
    String status,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("deleted_count") int deletedCount,
    String message) {}
