package com.quantori.eqp.core.discovery;

import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.SearchError;
import java.util.List;
import lombok.Value;

/**
 * One fetched or failed page of a discovery partition.
 */
@Value
class PageResult {
  int partition;
  int page;
  List<DiscoveredFiling> filings;
  Long totalCount;
  SearchError error;

  static PageResult fetched(int partition, int page, List<DiscoveredFiling> filings, Long totalCount) {
    return new PageResult(partition, page, filings, totalCount, null);
  }

  static PageResult failed(int partition, int page, SearchError error) {
    return new PageResult(partition, page, List.of(), null, error);
  }
}
