package com.quantori.eqp.api.model.query;

/**
 * Stable failure tokens of a {@link QueryResult}.
 */
public enum QueryErrorCode {
  NOT_IMPLEMENTED,
  CONFIGURATION_ERROR,
  DISCOVERY_FAILED,
  CLASSIFICATION_FAILED,
  EXECUTION_FAILED
}
