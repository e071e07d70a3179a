package com.quantori.eqp.api;

import com.quantori.eqp.api.model.query.QueryPattern;

/**
 * Maps a natural-language query to the strategy that resolves it. Must be deterministic for a given
 * text.
 */
public interface QueryClassifier {
  QueryPattern classify(String queryText);
}
