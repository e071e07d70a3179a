package com.quantori.eqp.core.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Tokenization shared by scoring, snippet extraction and key-term aggregation.
 */
public final class Terms {
  /**
   * Words ignored when a query is split into search terms.
   */
  public static final Set<String> QUERY_STOP_WORDS =
      Set.of("the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by");

  /**
   * Words that never become a key term of an aggregation. Extends the query stop words with
   * question phrasing.
   */
  public static final Set<String> KEY_TERM_STOP_WORDS = Set.of(
      "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
      "a", "an", "is", "are", "was", "were", "all", "show", "find",
      "companies", "filings", "mentions", "mentioning");

  private static final int MIN_TERM_LENGTH = 3;

  private Terms() {
  }

  /**
   * Lowercases a token and strips leading and trailing punctuation.
   */
  public static String normalize(String token) {
    String lower = token.toLowerCase(Locale.ROOT);
    int start = 0;
    int end = lower.length();
    while (start < end && !Character.isLetterOrDigit(lower.charAt(start))) {
      start++;
    }
    while (end > start && !Character.isLetterOrDigit(lower.charAt(end - 1))) {
      end--;
    }
    return lower.substring(start, end);
  }

  /**
   * Distinct search terms of a free-text query in query order. Falls back to every token when all of
   * them are stop words or too short.
   */
  public static List<String> queryTerms(String query) {
    Set<String> all = new LinkedHashSet<>();
    Set<String> kept = new LinkedHashSet<>();
    for (String token : StringUtils.split(StringUtils.defaultString(query))) {
      String term = normalize(token);
      if (term.isEmpty()) {
        continue;
      }
      all.add(term);
      if (term.length() >= MIN_TERM_LENGTH && !QUERY_STOP_WORDS.contains(term)) {
        kept.add(term);
      }
    }
    return new ArrayList<>(kept.isEmpty() ? all : kept);
  }

  /**
   * Key terms of a theme: distinct, lowercase, longer than two characters and not a stop word.
   */
  public static List<String> keyTerms(String query, int limit) {
    Set<String> terms = new LinkedHashSet<>();
    for (String token : StringUtils.split(StringUtils.defaultString(query))) {
      String term = normalize(token);
      if (term.length() >= MIN_TERM_LENGTH && !KEY_TERM_STOP_WORDS.contains(term)) {
        terms.add(term);
      }
      if (terms.size() == limit) {
        break;
      }
    }
    return List.copyOf(terms);
  }
}
