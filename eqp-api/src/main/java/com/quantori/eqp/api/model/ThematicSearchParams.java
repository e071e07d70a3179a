package com.quantori.eqp.api.model;

import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Input of a complete discovery, search and aggregation run.
 */
@Value
@Builder(toBuilder = true)
public class ThematicSearchParams {
  String query;
  @Builder.Default
  Set<FormType> formTypes = DiscoveryCriteria.DEFAULT_FORM_TYPES;
  DateRange dateRange;
  @Builder.Default
  Set<Industry> industries = Set.of();
  @Builder.Default
  List<String> companies = List.of();
  @Builder.Default
  Set<SectionType> sections = Set.of();
  @Builder.Default
  int maxFilings = DiscoveryCriteria.DEFAULT_MAX_RESULTS;
  @Builder.Default
  int maxResults = SearchCriteria.DEFAULT_MAX_RESULTS;
  @Builder.Default
  double minScore = SearchCriteria.DEFAULT_MIN_SCORE;
  @Builder.Default
  boolean includeSnippets = true;
  @Builder.Default
  int snippetLength = SearchCriteria.DEFAULT_SNIPPET_LENGTH;
  @Builder.Default
  boolean deduplicateResults = true;
  @Builder.Default
  SortKey sortBy = SortKey.FILED_DATE;
  @Builder.Default
  SortOrder sortOrder = SortOrder.DESC;

  public DiscoveryCriteria toDiscoveryCriteria() {
    return DiscoveryCriteria.builder()
        .formTypes(formTypes)
        .dateRange(dateRange)
        .industries(industries)
        .companies(companies)
        .maxResults(maxFilings)
        .sortBy(sortBy)
        .sortOrder(sortOrder)
        .build();
  }

  public SearchCriteria toSearchCriteria(List<DiscoveredFiling> filings) {
    return SearchCriteria.builder()
        .filings(filings)
        .query(query)
        .sections(sections)
        .maxResults(maxResults)
        .minScore(minScore)
        .includeSnippets(includeSnippets)
        .snippetLength(snippetLength)
        .deduplicateResults(deduplicateResults)
        .build();
  }
}
