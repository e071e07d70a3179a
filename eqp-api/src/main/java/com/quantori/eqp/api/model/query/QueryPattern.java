package com.quantori.eqp.api.model.query;

/**
 * Resolution strategy of a natural-language query.
 */
public enum QueryPattern {
  /**
   * Question about one named company, i.e. "Apple's revenue in the latest 10-K"
   */
  COMPANY_SPECIFIC,
  /**
   * Question answerable from filing metadata alone, i.e. "latest 10-K filings"
   */
  METADATA_ONLY,
  /**
   * Named company combined with a cross-document theme
   */
  HYBRID,
  /**
   * Cross-document question not tied to a single company
   */
  THEMATIC
}
