package com.quantori.eqp.api.model;

/**
 * Type of error occurred during a thematic search.
 */
public enum ErrorType {
  /**
   * A page of the discovery listing could not be fetched
   */
  DISCOVERY_PAGE,
  /**
   * Content of a single filing could not be fetched or scored
   */
  SEARCH_ITEM,
  /**
   * Other errors
   */
  GENERAL
}
