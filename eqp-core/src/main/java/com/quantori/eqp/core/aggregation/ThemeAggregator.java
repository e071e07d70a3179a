package com.quantori.eqp.core.aggregation;

import com.quantori.eqp.api.model.CompanyMatch;
import com.quantori.eqp.api.model.SearchResult;
import com.quantori.eqp.api.model.ThemeAggregation;
import com.quantori.eqp.core.search.Terms;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summarizes ranked results of a thematic query. Pure: identical input gives identical output.
 */
public class ThemeAggregator {
  static final int MIN_SNIPPET_LENGTH = 50;

  /**
   * Aggregates the results into a single theme.
   *
   * @return an empty list for no results, otherwise exactly one aggregation
   */
  public List<ThemeAggregation> aggregate(String query, List<SearchResult> results) {
    if (results.isEmpty()) {
      return List.of();
    }
    Map<String, CompanyTally> companies = new LinkedHashMap<>();
    Map<Integer, Integer> years = new TreeMap<>();
    for (SearchResult result : results) {
      companies.computeIfAbsent(result.getFiling().getCompanyName(),
              name -> new CompanyTally(name, result.getFiling().getTicker()))
          .add(result.getScore());
      if (result.getFiling().getFiledDate() != null) {
        years.merge(result.getFiling().getFiledDate().getYear(), 1, Integer::sum);
      }
    }

    // stable sort, companies with equal counts keep their first-encounter order
    List<CompanyMatch> topCompanies = companies.values().stream()
        .sorted(Comparator.comparingInt(CompanyTally::getCount).reversed())
        .limit(ThemeAggregation.TOP_COMPANIES_LIMIT)
        .map(CompanyTally::toMatch)
        .toList();

    return List.of(ThemeAggregation.builder()
        .theme(query)
        .matchingFilings(results.size())
        .companiesCount(companies.size())
        .topCompanies(topCompanies)
        .timeDistribution(years)
        .keyTerms(Terms.keyTerms(query, ThemeAggregation.KEY_TERMS_LIMIT))
        .representativeSnippets(snippets(results))
        .build());
  }

  private static List<String> snippets(List<SearchResult> results) {
    List<SearchResult> candidates = new ArrayList<>();
    for (SearchResult result : results) {
      if (result.getSnippet() != null && result.getSnippet().length() > MIN_SNIPPET_LENGTH) {
        candidates.add(result);
      }
    }
    return candidates.stream()
        .sorted(Comparator.comparingDouble(SearchResult::getScore).reversed())
        .limit(ThemeAggregation.SNIPPETS_LIMIT)
        .map(SearchResult::getSnippet)
        .toList();
  }

  private static final class CompanyTally {
    private final String name;
    private final String ticker;
    private int count;
    private double scoreSum;

    private CompanyTally(String name, String ticker) {
      this.name = name;
      this.ticker = ticker;
    }

    void add(double score) {
      count++;
      scoreSum += score;
    }

    int getCount() {
      return count;
    }

    CompanyMatch toMatch() {
      return new CompanyMatch(name, ticker, count, scoreSum / count);
    }
  }
}
