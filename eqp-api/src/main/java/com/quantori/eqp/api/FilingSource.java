package com.quantori.eqp.api;

import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.FilingContent;
import com.quantori.eqp.api.model.FilingListRequest;
import com.quantori.eqp.api.model.FilingPage;
import com.quantori.eqp.api.model.SectionType;
import java.util.Set;

/**
 * External corpus of filings the platform discovers and searches.
 *
 * <p>Calls are blocking, may be slow or rate limited and must be safe to call concurrently and to
 * retry. Implementations signal failures with {@link FilingSourceException}; a failure created by
 * {@link FilingSourceException#unrecoverable(String)} aborts the run instead of being retried.
 */
public interface FilingSource {

  /**
   * Name used in error reports and result envelopes.
   */
  String getSourceName();

  /**
   * Lists one page of filings matching the request, ordered by the requested sort key and order.
   *
   * @param request criteria, optional company narrowing and page coordinates
   * @return the page, never null
   */
  FilingPage listFilings(FilingListRequest request);

  /**
   * Fetches the text of a filing.
   *
   * @param filing   filing to fetch
   * @param sections sections of interest, empty means all; a source may return more sections than
   *                 requested
   * @return content split into sections
   */
  FilingContent fetchFilingContent(DiscoveredFiling filing, Set<SectionType> sections);
}
