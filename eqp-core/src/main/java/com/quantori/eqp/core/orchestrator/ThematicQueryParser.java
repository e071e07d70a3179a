package com.quantori.eqp.core.orchestrator;

import com.quantori.eqp.api.model.DateRange;
import com.quantori.eqp.api.model.FormType;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Lifts explicit form types and time expressions out of a thematic question and keeps the remaining
 * words as the free-text search query.
 */
public class ThematicQueryParser {
  private static final Pattern FORM = Pattern.compile(
      "\\b(10-?k|10-?q|8-?k|s-?1|s-?3|s-?4|20-?f|6-?k|def\\s?14a)s?\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern RELATIVE_TIME = Pattern.compile(
      "\\b(?:in\\s+|over\\s+|during\\s+)?(?:the\\s+)?(?:past|last|previous)\\s+(\\d+\\s+)?(year|quarter|month|week|day)s?\\b",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern SINCE_YEAR = Pattern.compile("\\bsince\\s+((?:19|20)\\d{2})\\b",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern IN_YEAR = Pattern.compile("\\b(?:in|during)\\s+((?:19|20)\\d{2})\\b",
      Pattern.CASE_INSENSITIVE);
  // lookback cap for relative expressions, one hundred years
  static final int MAX_RELATIVE_DAYS = 100 * 365;
  private static final Set<String> QUESTION_WORDS = Set.of(
      "which", "what", "who", "how", "many", "companies", "company", "firms", "filings", "filing", "reports",
      "mention", "mentions", "mentioning", "mentioned", "discuss", "discusses", "discussing", "disclose",
      "discloses", "disclosed", "describe", "describing", "show", "find", "list", "identify", "all", "their",
      "have", "has", "had", "did", "does", "do", "about", "any", "that", "there", "were", "was", "are", "is",
      "and", "or");

  @Value
  public static class ParsedQuery {
    String searchText;
    Set<FormType> formTypes;
    /**
     * Date range implied by the text, {@code null} when none.
     */
    DateRange dateRange;
  }

  public ParsedQuery parse(String queryText, LocalDate today) {
    String text = StringUtils.defaultString(queryText);

    Set<FormType> formTypes = EnumSet.noneOf(FormType.class);
    Matcher forms = FORM.matcher(text);
    while (forms.find()) {
      formTypes.add(formType(forms.group(1)));
    }
    text = FORM.matcher(text).replaceAll(" ");

    DateRange dateRange = null;
    Matcher relative = RELATIVE_TIME.matcher(text);
    Matcher since = SINCE_YEAR.matcher(text);
    Matcher inYear = IN_YEAR.matcher(text);
    if (relative.find()) {
      dateRange = DateRange.trailing(relativeDays(relative.group(1), relative.group(2)), today);
      text = RELATIVE_TIME.matcher(text).replaceAll(" ");
    } else if (since.find()) {
      dateRange = DateRange.of(LocalDate.of(Integer.parseInt(since.group(1)), 1, 1), today);
      text = SINCE_YEAR.matcher(text).replaceAll(" ");
    } else if (inYear.find()) {
      int year = Integer.parseInt(inYear.group(1));
      dateRange = DateRange.of(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
      text = IN_YEAR.matcher(text).replaceAll(" ");
    }

    String searchText = Arrays.stream(StringUtils.split(text))
        .filter(word -> !QUESTION_WORDS.contains(StringUtils.strip(word.toLowerCase(Locale.ROOT), "?.,!;:'\"")))
        .collect(Collectors.joining(" "));
    searchText = StringUtils.strip(searchText, " ?.,!;:");
    return new ParsedQuery(searchText, formTypes, dateRange);
  }

  static int relativeDays(String count, String unit) {
    if (count == null) {
      return unitDays(unit);
    }
    String digits = StringUtils.defaultIfEmpty(StringUtils.stripStart(count.trim(), "0"), "0");
    if (digits.length() > 9) {
      return MAX_RELATIVE_DAYS;
    }
    return (int) Math.min(MAX_RELATIVE_DAYS, Long.parseLong(digits) * unitDays(unit));
  }

  static int unitDays(String unit) {
    return switch (unit.toLowerCase(Locale.ROOT)) {
      case "year" -> 365;
      case "quarter" -> 90;
      case "month" -> 30;
      case "week" -> 7;
      default -> 1;
    };
  }

  private static FormType formType(String mention) {
    String normalized = mention.toUpperCase(Locale.ROOT).replaceAll("\\s", "");
    if (normalized.startsWith("DEF")) {
      return FormType.DEF_14A;
    }
    if (!normalized.contains("-")) {
      normalized = normalized.replaceFirst("^(\\d+|S)", "$1-");
    }
    return FormType.fromValue(normalized);
  }
}
