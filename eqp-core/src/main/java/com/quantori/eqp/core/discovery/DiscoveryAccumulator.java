package com.quantori.eqp.core.discovery;

import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.DiscoveryCriteria;
import com.quantori.eqp.api.model.Phase;
import com.quantori.eqp.api.model.SearchError;
import com.quantori.eqp.core.progress.ProgressChannel;
import com.quantori.eqp.core.progress.RemainingTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the pages of all partitions of one discovery run. Only the single stream stage following
 * the merge touches it.
 */
class DiscoveryAccumulator {
  private final DiscoveryCriteria criteria;
  private final int partitionCount;
  private final ProgressChannel progress;
  private final Map<String, Entry> filings = new LinkedHashMap<>();
  private final Map<Integer, Long> estimates = new HashMap<>();
  private final List<SearchError> errors = new ArrayList<>();
  private final RemainingTime remainingTime = RemainingTime.start();
  private long sequence;
  private int pages;

  DiscoveryAccumulator(DiscoveryCriteria criteria, int partitionCount, ProgressChannel progress) {
    this.criteria = criteria;
    this.partitionCount = partitionCount;
    this.progress = progress;
  }

  /**
   * Adds a page, first occurrence of an accession number wins.
   *
   * @return unique filings collected so far
   */
  int add(PageResult page) {
    pages++;
    if (page.getError() != null) {
      errors.add(page.getError());
    } else {
      for (DiscoveredFiling filing : page.getFilings()) {
        filings.putIfAbsent(filing.getAccessionNumber(), new Entry(filing, page.getPartition(), sequence++));
      }
      if (page.getTotalCount() != null) {
        estimates.put(page.getPartition(), page.getTotalCount());
      }
    }
    int total = expectedTotal();
    int completed = Math.min(filings.size(), total);
    String item = String.format("partition %d page %d", page.getPartition(), page.getPage());
    if (isTotalEstimated()) {
      progress.offer(Phase.DISCOVERY, completed, total, item, remainingTime);
    } else {
      progress.offer(Phase.DISCOVERY, completed, total, item);
    }
    return filings.size();
  }

  DiscoveryOutcome outcome(boolean cancelled) {
    Comparator<DiscoveredFiling> ordering = FilingFilter.ordering(criteria.getSortBy(), criteria.getSortOrder());
    List<DiscoveredFiling> sorted = filings.values().stream()
        .sorted(Comparator.comparingInt(Entry::partition).thenComparingLong(Entry::sequence))
        .map(Entry::filing)
        .sorted(ordering)
        .limit(criteria.getMaxResults())
        .toList();
    return new DiscoveryOutcome(sorted, List.copyOf(errors), pages, cancelled);
  }

  private boolean isTotalEstimated() {
    return estimates.size() >= partitionCount;
  }

  private int expectedTotal() {
    int max = criteria.getMaxResults();
    if (!isTotalEstimated()) {
      return max;
    }
    long estimated = estimates.values().stream().mapToLong(Long::longValue).sum();
    return (int) Math.min(max, Math.max(estimated, filings.size()));
  }

  private record Entry(DiscoveredFiling filing, int partition, long sequence) {
  }
}
