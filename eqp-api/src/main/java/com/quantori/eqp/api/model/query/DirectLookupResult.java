package com.quantori.eqp.api.model.query;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a direct lookup collaborator.
 */
@Value
@Builder
public class DirectLookupResult<P extends QueryPayload> {
  P payload;
  @Builder.Default
  List<Citation> citations = List.of();
  @Builder.Default
  List<SourceDescriptor> sources = List.of();
  int externalCalls;
}
