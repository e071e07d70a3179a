package com.quantori.eqp.core.search;

import java.util.List;

/**
 * Saturating term frequency score.
 *
 * <p>{@code score = 1/|Q| * sum over query terms t of tf(t) / (tf(t) + k)} where {@code k} is the
 * saturation constant. The score is 0 without any matching term, grows with every term frequency
 * and approaches 1 as all terms occur often. It never leaves {@code [0, 1]}.
 */
public class RelevanceScorer {
  private final double saturation;

  public RelevanceScorer(double saturation) {
    if (saturation <= 0) {
      throw new IllegalArgumentException("Saturation must be positive.");
    }
    this.saturation = saturation;
  }

  public double score(TermMatches matches, List<String> terms) {
    if (terms.isEmpty()) {
      return 0;
    }
    double sum = 0;
    for (String term : terms) {
      int frequency = matches.frequency(term);
      sum += frequency / (frequency + saturation);
    }
    return Math.min(1.0, sum / terms.size());
  }
}
