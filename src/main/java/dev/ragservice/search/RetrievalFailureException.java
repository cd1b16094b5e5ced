package dev.ragservice.search;

import java.util.List;

/**
 * Thrown when every retrieval branch of a search failed or timed out, so no result can be produced.
 */
public class RetrievalFailureException extends RuntimeException {

  private final String tenantId;
  private final List<String> branchFailures;

  public RetrievalFailureException(String tenantId, List<String> branchFailures) {
    super("All retrieval branches failed for tenant '" + tenantId + "': " + branchFailures);
    this.tenantId = tenantId;
    this.branchFailures = List.copyOf(branchFailures);
  }

  public String getTenantId() {
    return tenantId;
  }

  /** One description per branch, e.g. {@code "dense: timed out after 750ms"}. */
  public List<String> getBranchFailures() {
    return branchFailures;
  }
}
