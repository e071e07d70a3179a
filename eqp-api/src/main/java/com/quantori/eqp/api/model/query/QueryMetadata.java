package com.quantori.eqp.api.model.query;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryMetadata {
  long executionTimeMillis;
  int externalCalls;
  @Builder.Default
  List<String> errors = List.of();
  boolean cancelled;
}
