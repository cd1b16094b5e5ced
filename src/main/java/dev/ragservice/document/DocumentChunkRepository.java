package dev.ragservice.document;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link DocumentChunk} rows. */
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, UUID> {

  /**
   * Counts the documents stored for a tenant.
   *
   * @param tenantId the tenant
   * @return number of rows
   */
  @Query(
      value = "SELECT COUNT(*) FROM document_chunks WHERE metadata->>'tenant_id' = :tenantId",
      nativeQuery = true)
  long countByTenant(@Param("tenantId") String tenantId);

  /**
   * Deletes every document of a tenant.
   *
   * @param tenantId the tenant
   * @return number of rows deleted
   */
  @Modifying
  @Transactional
  @Query(
      value = "DELETE FROM document_chunks WHERE metadata->>'tenant_id' = :tenantId",
      nativeQuery = true)
  int deleteByTenant(@Param("tenantId") String tenantId);
}
