package dev.ragservice.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SearchRequestTest {

  @Test
  void defaultTopKIsFive() {
    SearchRequest request = new SearchRequest("tenant-a", "query");
    assertThat(request.topK()).isEqualTo(5);
  }

  @Test
  void customTopKIsRespected() {
    SearchRequest request = new SearchRequest("tenant-a", "query", 12);
    assertThat(request.topK()).isEqualTo(12);
  }

  @Test
  void blankTenantThrowsIllegalArgumentException() {
    assertThatThrownBy(() -> new SearchRequest("  ", "query"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("tenantId must not be blank");
  }

  @Test
  void nullQueryThrowsIllegalArgumentException() {
    assertThatThrownBy(() -> new SearchRequest("tenant-a", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Query must not be blank");
  }

  @Test
  void blankQueryThrowsIllegalArgumentException() {
    assertThatThrownBy(() -> new SearchRequest("tenant-a", "   "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Query must not be blank");
  }

  @Test
  void topKLessThanOneThrowsIllegalArgumentException() {
    assertThatThrownBy(() -> new SearchRequest("tenant-a", "query", 0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("topK must be in [1, 100], got: 0");
  }

  @Test
  void topKAboveMaximumThrowsIllegalArgumentException() {
    assertThatThrownBy(() -> new SearchRequest("tenant-a", "query", 101))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("got: 101");
  }

  @Test
  void topKAtMaximumIsAccepted() {
    assertThat(new SearchRequest("tenant-a", "query", 100).topK()).isEqualTo(100);
  }
}
