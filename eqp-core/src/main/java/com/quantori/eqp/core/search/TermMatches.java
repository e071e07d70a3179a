package com.quantori.eqp.core.search;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Occurrences of query terms in a cleaned text. A token matches a term when it equals the term after
 * {@link Terms#normalize(String) normalization}.
 */
public final class TermMatches {
  private final Map<String, Integer> frequencies;
  private final List<int[]> spans;

  private TermMatches(Map<String, Integer> frequencies, List<int[]> spans) {
    this.frequencies = frequencies;
    this.spans = spans;
  }

  public static TermMatches find(String text, Collection<String> terms) {
    Set<String> wanted = new HashSet<>(terms);
    Map<String, Integer> frequencies = new HashMap<>();
    List<int[]> spans = new ArrayList<>();
    int length = text.length();
    int i = 0;
    while (i < length) {
      while (i < length && Character.isWhitespace(text.charAt(i))) {
        i++;
      }
      int start = i;
      while (i < length && !Character.isWhitespace(text.charAt(i))) {
        i++;
      }
      if (start == i) {
        break;
      }
      int tokenStart = start;
      int tokenEnd = i;
      while (tokenStart < tokenEnd && !Character.isLetterOrDigit(text.charAt(tokenStart))) {
        tokenStart++;
      }
      while (tokenEnd > tokenStart && !Character.isLetterOrDigit(text.charAt(tokenEnd - 1))) {
        tokenEnd--;
      }
      String token = Terms.normalize(text.substring(tokenStart, tokenEnd));
      if (wanted.contains(token)) {
        frequencies.merge(token, 1, Integer::sum);
        spans.add(new int[] {tokenStart, tokenEnd});
      }
    }
    return new TermMatches(frequencies, spans);
  }

  public int frequency(String term) {
    return frequencies.getOrDefault(term, 0);
  }

  /**
   * Total number of term occurrences.
   */
  public int count() {
    return spans.size();
  }

  /**
   * Start (inclusive) and end (exclusive) offsets of every occurrence in text order.
   */
  public List<int[]> spans() {
    return spans;
  }
}
