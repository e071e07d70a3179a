package com.quantori.eqp.core.progress;

import java.util.function.LongSupplier;

/**
 * Extrapolates the time left in a stage from the average time per completed item.
 */
public final class RemainingTime {
  private final LongSupplier nanoClock;
  private final long started;

  RemainingTime(LongSupplier nanoClock) {
    this.nanoClock = nanoClock;
    this.started = nanoClock.getAsLong();
  }

  public static RemainingTime start() {
    return new RemainingTime(System::nanoTime);
  }

  /**
   * Estimates the remaining seconds, rounded.
   *
   * @return {@code null} when {@code total} is unknown or nothing has completed yet
   */
  public Long estimateSeconds(int completed, Integer total) {
    if (total == null || completed <= 0) {
      return null;
    }
    long remaining = Math.max(0, total - completed);
    double nanosPerItem = (double) (nanoClock.getAsLong() - started) / completed;
    return Math.round(nanosPerItem * remaining / 1_000_000_000d);
  }
}
