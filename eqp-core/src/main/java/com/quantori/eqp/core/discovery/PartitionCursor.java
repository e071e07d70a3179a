package com.quantori.eqp.core.discovery;

import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.DiscoveryCriteria;
import com.quantori.eqp.api.model.ErrorType;
import com.quantori.eqp.api.model.FilingPage;
import com.quantori.eqp.api.model.SearchError;
import com.quantori.eqp.core.source.FilingFetcher;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Paging state of one discovery partition. Pages of a partition are fetched one after another, so
 * the cursor is never accessed concurrently.
 */
@Slf4j
class PartitionCursor {
  private final int index;
  private final String company;
  private final String sourceName;
  private final int maxResults;
  private final int maxConsecutiveFailures;
  private final Predicate<DiscoveredFiling> filter;
  private final Set<String> seen = new HashSet<>();
  private int consecutiveFailures;
  private boolean done;

  PartitionCursor(int index, String company, DiscoveryCriteria criteria, String sourceName,
                  int maxConsecutiveFailures) {
    this.index = index;
    this.company = company;
    this.sourceName = sourceName;
    this.maxResults = criteria.getMaxResults();
    this.maxConsecutiveFailures = maxConsecutiveFailures;
    this.filter = FilingFilter.matching(criteria, company);
  }

  int getIndex() {
    return index;
  }

  String getCompany() {
    return company;
  }

  boolean isDone() {
    return done;
  }

  /**
   * Accounts a completed page fetch.
   *
   * @throws CompletionException wrapping the cause when the source failed unrecoverably
   */
  PageResult onPage(int page, FilingPage filingPage, Throwable error) {
    if (error != null) {
      return onFailure(page, FilingFetcher.unwrap(error));
    }
    consecutiveFailures = 0;
    List<DiscoveredFiling> kept = filingPage.getFilings().stream()
        .filter(filter)
        .filter(filing -> seen.size() < maxResults && seen.add(filing.getAccessionNumber()))
        .toList();
    if (filingPage.isLastPage() || filingPage.getFilings().isEmpty() || seen.size() >= maxResults) {
      done = true;
    }
    return PageResult.fetched(index, page, kept, filingPage.getTotalCount());
  }

  private PageResult onFailure(int page, Throwable cause) {
    if (FilingFetcher.isUnrecoverable(cause)) {
      done = true;
      throw new CompletionException(cause);
    }
    consecutiveFailures++;
    if (consecutiveFailures >= maxConsecutiveFailures) {
      log.warn("Giving up partition {} after {} failed pages in a row", label(), consecutiveFailures);
      done = true;
    } else {
      log.warn("Discovery page {} of {} failed: {}", page, label(), cause.toString());
    }
    String itemId = String.format("%s/page-%d", label(), page);
    return PageResult.failed(index, page,
        new SearchError(ErrorType.DISCOVERY_PAGE, sourceName, itemId, String.valueOf(cause.getMessage())));
  }

  private String label() {
    return company == null ? "all-companies" : company;
  }
}
