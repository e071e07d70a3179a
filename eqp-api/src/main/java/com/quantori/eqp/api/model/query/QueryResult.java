package com.quantori.eqp.api.model.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Envelope returned for every query. Failures are reported through {@link #success} and
 * {@link #errorCode}, never thrown.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResult {
  boolean success;
  QueryPattern pattern;
  QueryPayload data;
  @Builder.Default
  List<SourceDescriptor> sources = List.of();
  @Builder.Default
  List<Citation> citations = List.of();
  QueryMetadata metadata;
  QueryErrorCode errorCode;
  String errorMessage;
}
