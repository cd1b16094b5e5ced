package dev.ragservice.api;

import dev.ragservice.document.TenantDocument;
import dev.ragservice.ingestion.IngestionService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Document ingestion and tenant removal endpoints. */
@RestController
public class DocumentController {

  private final IngestionService ingestionService;

  public DocumentController(IngestionService ingestionService) {
    this.ingestionService = ingestionService;
  }

  @PostMapping("/documents")
  public DocumentResponse addDocument(@Valid @RequestBody DocumentRequest request) {
    TenantDocument document = request.toTenantDocument();
    double elapsedMs = ingestionService.ingest(document);
    return new DocumentResponse(
        "success",
        document.documentId(),
        document.tenantId(),
        "Document indexed in %d ms".formatted(Math.round(elapsedMs)));
  }

  @DeleteMapping("/documents/{tenantId}")
  public DeleteResponse deleteTenant(@PathVariable String tenantId) {
    int deleted = ingestionService.deleteTenant(tenantId);
    return new DeleteResponse(
        "success", tenantId, deleted, "Deleted %d documents for tenant".formatted(deleted));
  }
}
