package com.quantori.eqp.core.discovery;

import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.SearchError;
import java.util.List;
import lombok.Value;

/**
 * Filings found by a discovery run, unique by accession number and bounded by the requested maximum.
 */
@Value
public class DiscoveryOutcome {
  List<DiscoveredFiling> filings;
  List<SearchError> errors;
  int pagesFetched;
  boolean cancelled;

  static DiscoveryOutcome empty(boolean cancelled) {
    return new DiscoveryOutcome(List.of(), List.of(), 0, cancelled);
  }
}
