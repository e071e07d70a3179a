package com.quantori.eqp.core.source.memory;

import com.quantori.eqp.api.FilingSource;
import com.quantori.eqp.api.FilingSourceException;
import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.FilingContent;
import com.quantori.eqp.api.model.FilingListRequest;
import com.quantori.eqp.api.model.FilingPage;
import com.quantori.eqp.api.model.FilingSection;
import com.quantori.eqp.api.model.SectionType;
import com.quantori.eqp.core.discovery.FilingFilter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Filing source over a fixed corpus held in memory. Applies the listing criteria, sorts and pages the
 * way a remote full-text service would.
 */
@Slf4j
public class InMemoryFilingSource implements FilingSource {
  public static final String DEFAULT_NAME = "in-memory";

  private final String name;
  private final Map<String, Document> documents = new LinkedHashMap<>();

  public InMemoryFilingSource() {
    this(DEFAULT_NAME);
  }

  public InMemoryFilingSource(String name) {
    this.name = name;
  }

  /**
   * Adds a filing with its sections, replacing a filing with the same accession number.
   */
  public InMemoryFilingSource add(DiscoveredFiling filing, List<FilingSection> sections) {
    synchronized (documents) {
      documents.put(filing.getAccessionNumber(), new Document(filing, List.copyOf(sections)));
    }
    return this;
  }

  /**
   * Adds a filing whose whole text forms a single section.
   */
  public InMemoryFilingSource add(DiscoveredFiling filing, String text) {
    return add(filing, List.of(FilingSection.of(SectionType.FULL_TEXT, text)));
  }

  @Override
  public String getSourceName() {
    return name;
  }

  @Override
  public FilingPage listFilings(FilingListRequest request) {
    if (request.getPage() < 0 || request.getPageSize() <= 0) {
      throw FilingSourceException.unrecoverable("Invalid page request: page " + request.getPage()
          + ", size " + request.getPageSize());
    }
    Predicate<DiscoveredFiling> filter = FilingFilter.matching(request.getCriteria(), request.getCompany());
    List<DiscoveredFiling> matching = snapshot().stream()
        .map(Document::filing)
        .filter(filter)
        .sorted(FilingFilter.ordering(request.getCriteria().getSortBy(), request.getCriteria().getSortOrder()))
        .toList();
    long from = (long) request.getPage() * request.getPageSize();
    if (from >= matching.size()) {
      return new FilingPage(List.of(), true, (long) matching.size());
    }
    int to = (int) Math.min(matching.size(), from + request.getPageSize());
    log.trace("Listing page {} [{}..{}) of {} filings", request.getPage(), from, to, matching.size());
    return new FilingPage(new ArrayList<>(matching.subList((int) from, to)), to == matching.size(),
        (long) matching.size());
  }

  @Override
  public FilingContent fetchFilingContent(DiscoveredFiling filing, Set<SectionType> sections) {
    Document document;
    synchronized (documents) {
      document = documents.get(filing.getAccessionNumber());
    }
    if (document == null) {
      throw new FilingSourceException("Filing not found: " + filing.getAccessionNumber(), 404);
    }
    return new FilingContent(filing.getAccessionNumber(), document.sections());
  }

  private Collection<Document> snapshot() {
    synchronized (documents) {
      return new ArrayList<>(documents.values());
    }
  }

  private record Document(DiscoveredFiling filing, List<FilingSection> sections) {
  }
}
