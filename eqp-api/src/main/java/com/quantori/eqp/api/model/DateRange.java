package com.quantori.eqp.api.model;

import java.time.LocalDate;
import javax.validation.constraints.NotNull;
import lombok.Value;

/**
 * Inclusive range of calendar dates.
 */
@Value
public class DateRange {
  @NotNull
  LocalDate start;
  @NotNull
  LocalDate end;

  public static DateRange of(LocalDate start, LocalDate end) {
    return new DateRange(start, end);
  }

  /**
   * Range covering the given number of days that ends on {@code today}.
   */
  public static DateRange trailing(int days, LocalDate today) {
    return new DateRange(today.minusDays(days), today);
  }

  public boolean isOrdered() {
    return start != null && end != null && !start.isAfter(end);
  }

  public boolean contains(LocalDate date) {
    return date != null && !date.isBefore(start) && !date.isAfter(end);
  }
}
