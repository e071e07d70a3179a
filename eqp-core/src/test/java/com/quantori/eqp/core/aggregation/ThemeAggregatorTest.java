package com.quantori.eqp.core.aggregation;

import static com.quantori.eqp.core.Filings.filing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.quantori.eqp.api.model.CompanyMatch;
import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.FormType;
import com.quantori.eqp.api.model.SearchResult;
import com.quantori.eqp.api.model.SectionType;
import com.quantori.eqp.api.model.ThemeAggregation;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ThemeAggregatorTest {
  private static final String LONG_SNIPPET =
      "Supply chain disruptions continued to affect our ability to source components on time";

  private final ThemeAggregator aggregator = new ThemeAggregator();

  private static SearchResult result(DiscoveredFiling filing, double score, String snippet) {
    return SearchResult.builder()
        .filing(filing)
        .score(score)
        .matchCount(1)
        .snippet(snippet)
        .matchedSections(List.of(SectionType.FULL_TEXT))
        .build();
  }

  @Test
  void noResultsGiveNoAggregation() {
    assertThat(aggregator.aggregate("supply chain", List.of())).isEmpty();
  }

  @Test
  void summarizesCompaniesYearsAndTerms() {
    List<SearchResult> results = List.of(
        result(filing("1", "Acme Corp", FormType.TEN_K, "2023-02-01"), 0.9, LONG_SNIPPET + " one"),
        result(filing("2", "Globex", FormType.TEN_Q, "2024-05-01"), 0.7, "too short"),
        result(filing("3", "Acme Corp", FormType.TEN_Q, "2024-08-01"), 0.5, LONG_SNIPPET + " two"),
        result(filing("4", "Initech", FormType.EIGHT_K, "2024-09-01"), 0.3, null));

    List<ThemeAggregation> aggregations = aggregator.aggregate("Show all companies mentioning supply chain risk",
        results);

    assertThat(aggregations).hasSize(1);
    ThemeAggregation aggregation = aggregations.get(0);
    assertThat(aggregation.getTheme()).isEqualTo("Show all companies mentioning supply chain risk");
    assertThat(aggregation.getMatchingFilings()).isEqualTo(4);
    assertThat(aggregation.getCompaniesCount()).isEqualTo(3);
    assertThat(aggregation.getTopCompanies()).extracting(CompanyMatch::getCompanyName)
        .containsExactly("Acme Corp", "Globex", "Initech");
    assertThat(aggregation.getTopCompanies().get(0).getMatchCount()).isEqualTo(2);
    assertThat(aggregation.getTopCompanies().get(0).getAvgScore()).isCloseTo(0.7, within(1e-9));
    assertThat(aggregation.getTimeDistribution()).containsExactly(Map.entry(2023, 1), Map.entry(2024, 3));
    assertThat(aggregation.getKeyTerms()).containsExactly("supply", "chain", "risk");
    assertThat(aggregation.getRepresentativeSnippets())
        .containsExactly(LONG_SNIPPET + " one", LONG_SNIPPET + " two");
  }

  @Test
  void countsEveryResultWhenOneFilingMatchesSeveralSections() {
    DiscoveredFiling filing = filing("1", "Acme Corp", FormType.TEN_K, "2024-02-01");
    List<SearchResult> results = List.of(
        result(filing, 0.9, LONG_SNIPPET + " risk factors"),
        result(filing, 0.6, LONG_SNIPPET + " md&a"));

    ThemeAggregation aggregation = aggregator.aggregate("supply chain", results).get(0);

    assertThat(aggregation.getMatchingFilings()).isEqualTo(2);
    assertThat(aggregation.getCompaniesCount()).isEqualTo(1);
  }

  @Test
  void companiesWithEqualCountsKeepEncounterOrderAndAreLimited() {
    List<SearchResult> results = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      results.add(result(filing("a-" + i, "Company " + (char) ('A' + i), FormType.TEN_K, "2024-01-01"), 0.5, null));
    }
    results.add(result(filing("l-2", "Company L", FormType.TEN_K, "2024-01-02"), 0.5, null));

    ThemeAggregation aggregation = aggregator.aggregate("inflation", results).get(0);

    assertThat(aggregation.getCompaniesCount()).isEqualTo(12);
    assertThat(aggregation.getTopCompanies()).hasSize(ThemeAggregation.TOP_COMPANIES_LIMIT)
        .extracting(CompanyMatch::getCompanyName)
        .startsWith("Company L", "Company A", "Company B")
        .doesNotContain("Company J", "Company K");
  }

  @Test
  void keepsAtMostFiveSnippetsByScore() {
    List<SearchResult> results = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      results.add(result(filing("s-" + i, "Company " + i, FormType.TEN_K, "2024-01-01"), i / 10.0,
          LONG_SNIPPET + " #" + i));
    }

    ThemeAggregation aggregation = aggregator.aggregate("supply chain", results).get(0);

    assertThat(aggregation.getRepresentativeSnippets()).hasSize(ThemeAggregation.SNIPPETS_LIMIT)
        .first().isEqualTo(LONG_SNIPPET + " #7");
  }

  @Test
  void identicalInputGivesIdenticalJson() throws Exception {
    ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    List<SearchResult> results = List.of(
        result(filing("1", "Acme Corp", FormType.TEN_K, "2023-02-01"), 0.9, LONG_SNIPPET),
        result(filing("2", "Globex", FormType.TEN_Q, "2024-05-01"), 0.7, LONG_SNIPPET),
        result(filing("3", "Initech", FormType.TEN_Q, "2024-08-01"), 0.7, LONG_SNIPPET));

    String first = mapper.writeValueAsString(aggregator.aggregate("supply chain", results));
    String second = mapper.writeValueAsString(aggregator.aggregate("supply chain", List.copyOf(results)));

    assertThat(first).isEqualTo(second).contains("\"companiesCount\":3");
  }
}
