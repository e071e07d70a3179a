package com.quantori.eqp.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of a cross-document search over already discovered filings.
 */
@Value
@Builder(toBuilder = true)
public class SearchCriteria {
  public static final int DEFAULT_MAX_RESULTS = 100;
  public static final double DEFAULT_MIN_SCORE = 0.1;
  public static final int DEFAULT_SNIPPET_LENGTH = 200;

  @JsonIgnore
  @Builder.Default
  List<DiscoveredFiling> filings = List.of();
  String query;
  /**
   * Sections to search, empty means every section of the filing.
   */
  @Builder.Default
  Set<SectionType> sections = Set.of();
  @Builder.Default
  int maxResults = DEFAULT_MAX_RESULTS;
  @Builder.Default
  double minScore = DEFAULT_MIN_SCORE;
  @Builder.Default
  boolean includeSnippets = true;
  @Builder.Default
  int snippetLength = DEFAULT_SNIPPET_LENGTH;
  @Builder.Default
  boolean deduplicateResults = true;
}
