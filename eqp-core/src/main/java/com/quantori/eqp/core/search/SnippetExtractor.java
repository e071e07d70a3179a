package com.quantori.eqp.core.search;

import java.util.List;

/**
 * Cuts a window of bounded length around the densest cluster of term occurrences.
 */
public class SnippetExtractor {

  /**
   * Extracts a snippet of at most {@code maxLength} characters.
   *
   * @param text      cleaned text
   * @param matches   term occurrences in {@code text}
   * @param maxLength upper bound of the snippet length
   * @return snippet, the beginning of the text when nothing matched
   */
  public Snippet extract(String text, TermMatches matches, int maxLength) {
    if (text.length() <= maxLength) {
      return new Snippet(text, 0, text.length());
    }
    List<int[]> spans = matches.spans();
    if (spans.isEmpty()) {
      return trim(text, 0, maxLength);
    }

    // two pointers over the occurrences: the widest run that fits into the window
    int bestFirst = 0;
    int bestLast = 0;
    int first = 0;
    for (int last = 0; last < spans.size(); last++) {
      while (first < last && spans.get(last)[1] - spans.get(first)[0] > maxLength) {
        first++;
      }
      if (last - first > bestLast - bestFirst) {
        bestFirst = first;
        bestLast = last;
      }
    }
    int clusterStart = spans.get(bestFirst)[0];
    int clusterEnd = Math.max(spans.get(bestLast)[1], clusterStart);
    int center = (clusterStart + clusterEnd) / 2;
    int start = Math.max(0, center - maxLength / 2);
    int end = Math.min(text.length(), start + maxLength);
    start = Math.max(0, end - maxLength);
    return trim(text, start, end);
  }

  private Snippet trim(String text, int start, int end) {
    int from = start;
    int to = end;
    if (from > 0 && !Character.isWhitespace(text.charAt(from - 1))) {
      int boundary = text.indexOf(' ', from);
      if (boundary >= 0 && boundary < to) {
        from = boundary + 1;
      }
    }
    if (to < text.length() && !Character.isWhitespace(text.charAt(to))) {
      int boundary = text.lastIndexOf(' ', to - 1);
      if (boundary > from) {
        to = boundary;
      }
    }
    while (from < to && Character.isWhitespace(text.charAt(from))) {
      from++;
    }
    while (to > from && Character.isWhitespace(text.charAt(to - 1))) {
      to--;
    }
    return new Snippet(text.substring(from, to), from, to);
  }
}
