package com.quantori.eqp.api.model;

/**
 * Ordering of discovered filings.
 */
public enum SortKey {
  FILED_DATE,
  COMPANY,
  /**
   * Relevance is unknown before the search stage, discovery orders by filed date instead.
   */
  RELEVANCE
}
