package dev.ragservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.ragservice.document.TenantDocument;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /documents}.
 *
 * @param tenantId the owning tenant
 * @param documentId the tenant-local document id
 * @param content the document text
 * @param metadata optional attributes returned with search hits
 */
public record DocumentRequest(
    @NotBlank @JsonProperty("tenant_id") String tenantId,
    @NotBlank @JsonProperty("document_id") String documentId,
    @NotBlank String content,
    @Nullable Map<String, Object> metadata) {

  TenantDocument toTenantDocument() {
    return new TenantDocument(tenantId, documentId, content, metadata);
  }
}
