package com.quantori.eqp.api.model;

/**
 * Transient progress notification of a running thematic search.
 *
 * @param phase                     pipeline stage
 * @param completed                 items completed so far within the stage
 * @param total                     expected item count, {@code null} when unknown
 * @param currentItem               label of the item just processed, may be {@code null}
 * @param estimatedSecondsRemaining time left in the stage extrapolated from the pace so far,
 *                                  {@code null} when the total is unknown or nothing completed yet
 */
public record ProgressUpdate(Phase phase, int completed, Integer total, String currentItem,
                             Long estimatedSecondsRemaining) {

  public ProgressUpdate(Phase phase, int completed, Integer total, String currentItem) {
    this(phase, completed, total, currentItem, null);
  }
}
