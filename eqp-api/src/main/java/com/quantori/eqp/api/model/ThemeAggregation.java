package com.quantori.eqp.api.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Summary statistics of the results of one thematic query.
 */
@Value
@Builder
public class ThemeAggregation {
  public static final int TOP_COMPANIES_LIMIT = 10;
  public static final int KEY_TERMS_LIMIT = 5;
  public static final int SNIPPETS_LIMIT = 5;

  String theme;
  int matchingFilings;
  int companiesCount;
  List<CompanyMatch> topCompanies;
  /**
   * Filed year to number of results, ascending by year.
   */
  Map<Integer, Integer> timeDistribution;
  List<String> keyTerms;
  List<String> representativeSnippets;
}
