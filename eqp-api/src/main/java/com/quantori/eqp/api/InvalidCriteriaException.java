package com.quantori.eqp.api;

/**
 * Thrown before any work starts when the parameters of a run are inconsistent.
 */
public class InvalidCriteriaException extends IllegalArgumentException {
  public InvalidCriteriaException(String message) {
    super(message);
  }
}
