package com.quantori.eqp.api.model;

/**
 * Pipeline stage a progress update belongs to.
 */
public enum Phase {
  DISCOVERY,
  SEARCH,
  AGGREGATION
}
