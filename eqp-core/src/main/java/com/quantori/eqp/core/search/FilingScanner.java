package com.quantori.eqp.core.search;

import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.FilingContent;
import com.quantori.eqp.api.model.FilingSection;
import com.quantori.eqp.api.model.SearchCriteria;
import com.quantori.eqp.api.model.SearchResult;
import com.quantori.eqp.api.model.SectionType;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Scores the sections of one filing against the query terms. Produces one result per section with
 * at least one term occurrence.
 */
public class FilingScanner {
  private final RelevanceScorer scorer;
  private final SnippetExtractor snippetExtractor = new SnippetExtractor();

  public FilingScanner(RelevanceScorer scorer) {
    this.scorer = scorer;
  }

  public List<SearchResult> scan(DiscoveredFiling filing, FilingContent content, SearchCriteria criteria,
                                 List<String> terms) {
    List<SearchResult> results = new ArrayList<>();
    for (FilingSection section : sectionsToSearch(content.getSections(), criteria.getSections())) {
      String text = TextCleaner.clean(section.getText());
      TermMatches matches = TermMatches.find(text, terms);
      if (matches.count() == 0) {
        continue;
      }
      SearchResult.SearchResultBuilder result = SearchResult.builder()
          .filing(filing)
          .score(scorer.score(matches, terms))
          .matchCount(matches.count())
          .matchedSections(List.of(section.getType()))
          .sectionTitle(section.getTitle())
          .sourceUrl(filing.getDocumentUrl())
          .citation(citation(filing, section.getTitle()));
      if (criteria.isIncludeSnippets()) {
        Snippet snippet = snippetExtractor.extract(text, matches, criteria.getSnippetLength());
        result.snippet(snippet.getText())
            .snippetStart(snippet.getStart())
            .snippetEnd(snippet.getEnd());
      }
      results.add(result.build());
    }
    return results;
  }

  /**
   * Sections matching the filter, or every section when the filter is empty or matches none of them.
   */
  static List<FilingSection> sectionsToSearch(List<FilingSection> sections, Set<SectionType> filter) {
    if (filter.isEmpty()) {
      return sections;
    }
    List<FilingSection> selected = sections.stream()
        .filter(section -> filter.contains(section.getType()))
        .toList();
    return selected.isEmpty() ? sections : selected;
  }

  static String citation(DiscoveredFiling filing, String sectionTitle) {
    return String.format("%s %s filed %s, %s", filing.getCompanyName(), filing.getFormType(),
        filing.getFiledDate(), sectionTitle);
  }
}
