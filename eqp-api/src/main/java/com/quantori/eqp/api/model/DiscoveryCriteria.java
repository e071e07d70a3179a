package com.quantori.eqp.api.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Structured filters of a discovery run.
 */
@Value
@Builder(toBuilder = true)
public class DiscoveryCriteria {
  public static final Set<FormType> DEFAULT_FORM_TYPES =
      Collections.unmodifiableSet(EnumSet.of(FormType.TEN_K, FormType.TEN_Q, FormType.EIGHT_K));
  public static final int DEFAULT_MAX_RESULTS = 1000;

  @Builder.Default
  Set<FormType> formTypes = DEFAULT_FORM_TYPES;
  /**
   * Filed date window, {@code null} means no date constraint.
   */
  DateRange dateRange;
  /**
   * Industries to keep, empty means any industry.
   */
  @Builder.Default
  Set<Industry> industries = Set.of();
  /**
   * Company allowlist (names, tickers or CIKs), empty means any company.
   */
  @Builder.Default
  List<String> companies = List.of();
  @Builder.Default
  int maxResults = DEFAULT_MAX_RESULTS;
  @Builder.Default
  SortKey sortBy = SortKey.FILED_DATE;
  @Builder.Default
  SortOrder sortOrder = SortOrder.DESC;
}
