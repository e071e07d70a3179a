package com.quantori.eqp.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A filing section that matched the free-text query.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResult {
  DiscoveredFiling filing;
  /**
   * Relevance in {@code [0, 1]}.
   */
  double score;
  int matchCount;
  String snippet;
  Integer snippetStart;
  Integer snippetEnd;
  List<SectionType> matchedSections;
  String sectionTitle;
  String sourceUrl;
  /**
   * Human readable reference, i.e. {@code Acme Corp 10-K filed 2024-02-01, Risk Factors}.
   */
  String citation;
}
