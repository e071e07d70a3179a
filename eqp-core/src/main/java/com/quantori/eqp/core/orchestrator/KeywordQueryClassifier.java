package com.quantori.eqp.core.orchestrator;

import com.quantori.eqp.api.QueryClassifier;
import com.quantori.eqp.api.model.query.QueryPattern;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Heuristic classifier scoring company, thematic and metadata indicators of the query text.
 *
 * <p>The highest score wins; when both the company and the thematic score exceed
 * {@value #HYBRID_THRESHOLD} the query is hybrid. Without any score reaching
 * {@value #MIN_SCORE} the query is company specific when it names a company and thematic otherwise.
 */
@Slf4j
public class KeywordQueryClassifier implements QueryClassifier {
  static final double MIN_SCORE = 0.3;
  static final double HYBRID_THRESHOLD = 0.4;

  private static final Pattern KNOWN_COMPANY = Pattern.compile(
      "\\b(apple|microsoft|google|alphabet|amazon|tesla|meta|facebook|nvidia|netflix|oracle|salesforce"
          + "|adobe|intel|ibm|jpmorgan|goldman sachs|exxon|chevron|pfizer|walmart)(?:'s)?\\b",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern TICKER = Pattern.compile("\\b[A-Z]{2,5}\\b");
  private static final Set<String> NOT_TICKERS = Set.of(
      "AI", "ESG", "MD", "SEC", "US", "USA", "CEO", "CFO", "IPO", "GAAP", "FY", "Q1", "Q2", "Q3", "Q4",
      "DEF", "LLC", "INC", "ETF", "IT");

  private static final List<Pattern> COMPANY_INDICATORS = List.of(
      Pattern.compile("\\b[A-Z]{2,5}(?:'s)?\\s+(?:revenue|earnings|income|performance|results|filing|report"
          + "|10-k|10-q|8-k)", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\b(?:their|its)\\s+(?:latest|recent|last|current|annual|quarterly)",
          Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\bcompany(?:'s)?\\s+(?:latest|recent|last|performance|results|filing)",
          Pattern.CASE_INSENSITIVE));
  private static final Pattern POSSESSIVE = Pattern.compile("\\b(?:[A-Z][a-z]+|[A-Z]{2,5})'s\\b");

  private static final List<Pattern> THEMATIC_INDICATORS = List.of(
      Pattern.compile("\\b(?:all|every|which|what)\\s+(?:companies|company|filings?|10-ks?|10-qs?|8-ks?)",
          Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\b(?:companies|company|filings?)\\s+(?:that|which|with|containing|mentioning|discussing)",
          Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\b(?:show|find|list|identify)\\s+(?:all|companies|filings?)", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\b(?:across|among|between)\\s+(?:companies|multiple|various|different)",
          Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\b(?:industry|sector|market)\\b", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\b(?:compare|comparison|versus|vs\\.?)(?:\\s|$)", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\bin\\s+the\\s+(?:past|last)\\s+(?:\\d+\\s+)?(?:years?|quarters?|months?)",
          Pattern.CASE_INSENSITIVE));

  private static final List<Pattern> METADATA_INDICATORS = List.of(
      Pattern.compile("\\b(?:list|show|get|find)\\s+(?:the\\s+)?(?:filings?|reports?|documents?)",
          Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\b(?:last|recent|latest)\\s+(?:\\d+\\s+)?(?:filings?|reports?)", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\bfiled?\\s+(?:in|during|on|since|after|before)\\b", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\baccession\\s+numbers?", Pattern.CASE_INSENSITIVE),
      Pattern.compile("\\bfiling\\s+(?:dates?|history|list)", Pattern.CASE_INSENSITIVE));

  private static final Pattern TOPIC = Pattern.compile(
      "\\b(revenue recognition|revenue|cybersecurity|data breach|supply chain|climate|sustainability|esg"
          + "|artificial intelligence|machine learning|ai|litigation|regulatory|compliance|inflation"
          + "|interest rates?|liquidity|debt|goodwill|impairment|restructuring|layoffs|mergers?|acquisitions?"
          + "|risk factors?|competition|tariffs?|pandemic|covid)\\b",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern TIME_EXPRESSION = Pattern.compile(
      "\\b(?:(?:past|last|previous)\\s+(?:\\d+\\s+)?(?:years?|quarters?|months?|weeks?|days?)|(?:19|20)\\d{2}"
          + "|q[1-4]|fiscal year)\\b",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern FORM = Pattern.compile("\\b(?:10-?k|10-?q|8-?k|s-?1|20-?f|def 14a)\\b",
      Pattern.CASE_INSENSITIVE);

  @Override
  public QueryPattern classify(String queryText) {
    if (StringUtils.isBlank(queryText)) {
      throw new IllegalArgumentException("Query must not be blank.");
    }
    Signals signals = Signals.of(queryText);
    double company = companyScore(queryText, signals);
    double thematic = thematicScore(queryText, signals);
    double metadata = metadataScore(queryText, signals);
    double hybrid = Math.min(company + thematic, 1.0);

    QueryPattern pattern;
    if (Math.max(Math.max(company, thematic), Math.max(metadata, hybrid)) < MIN_SCORE) {
      pattern = signals.companies > 0 || signals.tickers > 0 ? QueryPattern.COMPANY_SPECIFIC : QueryPattern.THEMATIC;
    } else if (company > HYBRID_THRESHOLD && thematic > HYBRID_THRESHOLD) {
      pattern = QueryPattern.HYBRID;
    } else {
      pattern = QueryPattern.COMPANY_SPECIFIC;
      double best = company;
      if (thematic > best) {
        pattern = QueryPattern.THEMATIC;
        best = thematic;
      }
      if (metadata > best) {
        pattern = QueryPattern.METADATA_ONLY;
        best = metadata;
      }
      if (hybrid > best) {
        pattern = QueryPattern.HYBRID;
      }
    }
    log.debug("Classified query as {} [company={}, thematic={}, metadata={}]", pattern, company, thematic, metadata);
    return pattern;
  }

  private static double companyScore(String query, Signals signals) {
    double score = Math.min(signals.companies * 0.3, 0.6) + Math.min(signals.tickers * 0.25, 0.5);
    score += 0.2 * COMPANY_INDICATORS.stream().filter(indicator -> indicator.matcher(query).find()).count();
    if (POSSESSIVE.matcher(query).find()) {
      score += 0.25;
    }
    if (signals.companies == 1 && !query.toLowerCase(Locale.ROOT).contains("compan")) {
      score += 0.2;
    }
    return Math.min(score, 1.0);
  }

  private static double thematicScore(String query, Signals signals) {
    double score = 0.3 * THEMATIC_INDICATORS.stream().filter(indicator -> indicator.matcher(query).find()).count();
    String lower = query.toLowerCase(Locale.ROOT);
    if (lower.matches(".*\\bcompanies\\b.*")) {
      score += 0.25;
    }
    boolean unnamed = signals.companies == 0 && signals.tickers == 0;
    if (signals.topics > 0 && signals.companies == 0) {
      score += 0.3;
    }
    if (signals.timeExpressions > 0 && !lower.matches(".*\\b(?:their|its)\\b.*")) {
      score += 0.2;
    }
    if (signals.forms > 1) {
      score += 0.15;
    }
    if (unnamed && signals.topics > 0) {
      score += 0.4;
    }
    return Math.min(score, 1.0);
  }

  private static double metadataScore(String query, Signals signals) {
    double score = 0.3 * METADATA_INDICATORS.stream().filter(indicator -> indicator.matcher(query).find()).count();
    String lower = query.toLowerCase(Locale.ROOT);
    if (signals.topics == 0 && (lower.contains("list") || lower.contains("show") || lower.contains("filed"))) {
      score += 0.4;
    }
    return Math.min(score, 1.0);
  }

  private static final class Signals {
    private int companies;
    private int tickers;
    private int topics;
    private int timeExpressions;
    private int forms;

    static Signals of(String query) {
      Signals signals = new Signals();
      signals.companies = distinct(KNOWN_COMPANY.matcher(query)).size();
      Set<String> tickers = distinct(TICKER.matcher(query));
      tickers.removeIf(ticker -> NOT_TICKERS.contains(ticker.toUpperCase(Locale.ROOT)));
      signals.tickers = tickers.size();
      signals.topics = distinct(TOPIC.matcher(query)).size();
      signals.timeExpressions = distinct(TIME_EXPRESSION.matcher(query)).size();
      signals.forms = distinct(FORM.matcher(query)).size();
      return signals;
    }

    private static Set<String> distinct(Matcher matcher) {
      Set<String> found = new LinkedHashSet<>();
      while (matcher.find()) {
        found.add(matcher.group().toLowerCase(Locale.ROOT).replace("-", "").replace("'s", ""));
      }
      return found;
    }
  }
}
