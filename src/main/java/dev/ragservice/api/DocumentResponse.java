package dev.ragservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Acknowledgement of an indexed document. */
public record DocumentResponse(
    String status,
    @JsonProperty("document_id") String documentId,
    @JsonProperty("tenant_id") String tenantId,
    String message) {}
