package com.quantori.eqp.core.search;

import com.quantori.eqp.api.model.SearchCriteria;
import com.quantori.eqp.api.model.SearchResult;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Filters, deduplicates and orders raw section results.
 *
 * <p>Order is score descending, then filed date descending, then accession number and section so
 * that the outcome does not depend on the order in which filings were fetched.
 */
public class ResultRanker {
  static final Comparator<SearchResult> RANKING = Comparator
      .comparingDouble(SearchResult::getScore).reversed()
      .thenComparing(result -> result.getFiling().getFiledDate(),
          Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
      .thenComparing(result -> result.getFiling().getAccessionNumber())
      .thenComparing(result -> result.getMatchedSections().get(0));

  public List<SearchResult> rank(List<SearchResult> raw, SearchCriteria criteria) {
    Stream<SearchResult> ranked = raw.stream()
        .filter(result -> result.getScore() >= criteria.getMinScore())
        .sorted(RANKING);
    if (criteria.isDeduplicateResults()) {
      Set<String> seen = new HashSet<>();
      ranked = ranked.filter(result -> seen.add(result.getFiling().getAccessionNumber()));
    }
    return ranked.limit(criteria.getMaxResults()).toList();
  }
}
