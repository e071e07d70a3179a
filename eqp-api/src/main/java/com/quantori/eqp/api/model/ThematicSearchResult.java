package com.quantori.eqp.api.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a thematic search run.
 *
 * <p>{@code matchingFilings} is always the size of {@code results} and {@code companiesFound} is
 * the number of distinct company names among them.
 */
@Value
@Builder
public class ThematicSearchResult {
  String query;
  long executionTimeMillis;
  int totalFilingsScanned;
  int matchingFilings;
  int companiesFound;
  List<SearchResult> results;
  List<ThemeAggregation> aggregations;
  DiscoveryCriteria discoveryCriteria;
  SearchCriteria searchCriteria;
  List<SearchError> errors;
  boolean cancelled;
  int sourceCalls;
}
