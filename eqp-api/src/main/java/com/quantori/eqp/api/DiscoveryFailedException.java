package com.quantori.eqp.api;

/**
 * Discovery could not produce any usable result, i.e. the filing source rejected the request as a
 * whole. Filings accumulated before the failure are discarded.
 */
public class DiscoveryFailedException extends RuntimeException {
  public DiscoveryFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
