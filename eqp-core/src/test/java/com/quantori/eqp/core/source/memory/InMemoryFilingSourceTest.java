package com.quantori.eqp.core.source.memory;

import static com.quantori.eqp.core.Filings.filing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quantori.eqp.api.FilingSourceException;
import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.DiscoveryCriteria;
import com.quantori.eqp.api.model.FilingListRequest;
import com.quantori.eqp.api.model.FilingPage;
import com.quantori.eqp.api.model.FormType;
import com.quantori.eqp.api.model.SortKey;
import com.quantori.eqp.api.model.SortOrder;
import java.util.Set;
import org.junit.jupiter.api.Test;

class InMemoryFilingSourceTest {

  private final InMemoryFilingSource source = new InMemoryFilingSource()
      .add(filing("a-1", "Acme", FormType.TEN_K, "2024-02-01"), "annual text")
      .add(filing("a-2", "Acme", FormType.TEN_Q, "2024-05-01"), "quarter text")
      .add(filing("b-1", "Beta", FormType.TEN_K, "2024-03-01"), "annual text")
      .add(filing("c-1", "Gamma", FormType.TEN_K, "2023-03-01"), "annual text");

  @Test
  void pagesFilteredFilingsInRequestedOrder() {
    DiscoveryCriteria criteria = DiscoveryCriteria.builder()
        .formTypes(Set.of(FormType.TEN_K))
        .sortBy(SortKey.FILED_DATE)
        .sortOrder(SortOrder.DESC)
        .build();

    FilingPage first = source.listFilings(request(criteria, null, 0, 2));
    FilingPage second = source.listFilings(request(criteria, null, 1, 2));

    assertThat(first.getFilings()).extracting(DiscoveredFiling::getAccessionNumber).containsExactly("b-1", "a-1");
    assertThat(first.isLastPage()).isFalse();
    assertThat(first.getTotalCount()).isEqualTo(3L);
    assertThat(second.getFilings()).extracting(DiscoveredFiling::getAccessionNumber).containsExactly("c-1");
    assertThat(second.isLastPage()).isTrue();
  }

  @Test
  void narrowsListingToCompany() {
    FilingPage page = source.listFilings(request(DiscoveryCriteria.builder().build(), "acme", 0, 10));

    assertThat(page.getFilings()).extracting(DiscoveredFiling::getAccessionNumber)
        .containsExactlyInAnyOrder("a-1", "a-2");
  }

  @Test
  void unknownFilingIsNotRetryable() {
    DiscoveredFiling unknown = filing("x-1", "Nobody", FormType.TEN_K, "2024-01-01");

    assertThatThrownBy(() -> source.fetchFilingContent(unknown, Set.of()))
        .isInstanceOf(FilingSourceException.class)
        .matches(error -> ((FilingSourceException) error).isUnrecoverable());
  }

  private static FilingListRequest request(DiscoveryCriteria criteria, String company, int page, int size) {
    return FilingListRequest.builder().criteria(criteria).company(company).page(page).pageSize(size).build();
  }
}
