package com.quantori.eqp.api.model.query;

import java.time.Instant;
import lombok.Value;

/**
 * Data source consulted while resolving a query.
 */
@Value
public class SourceDescriptor {
  SourceType type;
  String name;
  Instant timestamp;

  public enum SourceType {
    FILING_SOURCE,
    LOOKUP
  }
}
