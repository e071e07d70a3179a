package com.quantori.eqp.api.model.query;

import com.quantori.eqp.api.CancellationSignal;
import com.quantori.eqp.api.ProgressListener;
import com.quantori.eqp.api.model.DateRange;
import com.quantori.eqp.api.model.FormType;
import com.quantori.eqp.api.model.SectionType;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Caller preferences and constraints of a query. Unset values fall back to the platform defaults.
 */
@Value
@Builder
public class QueryOptions {
  Integer maxResults;
  @Builder.Default
  ResponseDetail responseDetail = ResponseDetail.DETAILED;
  Set<FormType> formTypes;
  DateRange dateRange;
  Set<SectionType> sections;
  Double minScore;
  @Builder.Default
  ProgressListener progressListener = ProgressListener.NO_OP;
  @Builder.Default
  CancellationSignal cancellation = CancellationSignal.none();

  public static QueryOptions defaults() {
    return QueryOptions.builder().build();
  }
}
