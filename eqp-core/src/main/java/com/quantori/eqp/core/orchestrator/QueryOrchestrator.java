package com.quantori.eqp.core.orchestrator;

import com.quantori.eqp.api.CompanyLookup;
import com.quantori.eqp.api.DiscoveryFailedException;
import com.quantori.eqp.api.FilingMetadataLookup;
import com.quantori.eqp.api.InvalidCriteriaException;
import com.quantori.eqp.api.QueryClassifier;
import com.quantori.eqp.api.model.DiscoveryCriteria;
import com.quantori.eqp.api.model.SearchCriteria;
import com.quantori.eqp.api.model.SearchError;
import com.quantori.eqp.api.model.SearchResult;
import com.quantori.eqp.api.model.ThematicSearchParams;
import com.quantori.eqp.api.model.ThematicSearchResult;
import com.quantori.eqp.api.model.query.Citation;
import com.quantori.eqp.api.model.query.DirectLookupResult;
import com.quantori.eqp.api.model.query.QueryErrorCode;
import com.quantori.eqp.api.model.query.QueryMetadata;
import com.quantori.eqp.api.model.query.QueryOptions;
import com.quantori.eqp.api.model.query.QueryPattern;
import com.quantori.eqp.api.model.query.QueryPayload;
import com.quantori.eqp.api.model.query.QueryResult;
import com.quantori.eqp.api.model.query.ResponseDetail;
import com.quantori.eqp.api.model.query.SourceDescriptor;
import com.quantori.eqp.api.model.query.ThematicPayload;
import com.quantori.eqp.core.pipeline.ThematicSearchService;
import com.quantori.eqp.core.source.FilingFetcher;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Entry point for natural-language queries. Classifies the query, dispatches it to the handler of its
 * pattern and wraps the outcome into a {@link QueryResult}. Failures never escape as exceptions, they
 * are reported as unsuccessful envelopes with an error code.
 */
@Slf4j
public class QueryOrchestrator {
  static final int SUMMARY_MAX_RESULTS = 20;

  private final QueryClassifier classifier;
  private final ThematicSearchService thematicSearch;
  private final CompanyLookup companyLookup;
  private final FilingMetadataLookup metadataLookup;
  private final ThematicQueryParser parser = new ThematicQueryParser();
  private final Clock clock;

  public QueryOrchestrator(ThematicSearchService thematicSearch) {
    this(new KeywordQueryClassifier(), thematicSearch, null, null, Clock.systemUTC());
  }

  /**
   * Creates an orchestrator.
   *
   * @param classifier     query classifier
   * @param thematicSearch pipeline used for thematic queries
   * @param companyLookup  handler of company specific queries, {@code null} when not available
   * @param metadataLookup handler of metadata queries, {@code null} when not available
   * @param clock          source of timestamps and of the current date for relative time ranges
   */
  public QueryOrchestrator(QueryClassifier classifier, ThematicSearchService thematicSearch,
                           CompanyLookup companyLookup, FilingMetadataLookup metadataLookup, Clock clock) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.thematicSearch = Objects.requireNonNull(thematicSearch, "thematicSearch");
    this.companyLookup = companyLookup;
    this.metadataLookup = metadataLookup;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public CompletionStage<QueryResult> resolve(String queryText, QueryOptions options) {
    long started = System.nanoTime();
    QueryOptions opts = options == null ? QueryOptions.defaults() : options;

    QueryPattern pattern;
    try {
      if (StringUtils.isBlank(queryText)) {
        throw new IllegalArgumentException("Query must not be blank.");
      }
      pattern = Objects.requireNonNull(classifier.classify(queryText), "pattern");
    } catch (RuntimeException e) {
      log.warn("Query classification failed: {}", e.getMessage());
      return CompletableFuture.completedFuture(
          failure(null, QueryErrorCode.CLASSIFICATION_FAILED, e.getMessage(), started));
    }
    log.debug("Resolving {} query", pattern);

    CompletionStage<QueryResult> handled;
    try {
      handled = switch (pattern) {
        case THEMATIC -> resolveThematic(queryText, opts, started);
        case COMPANY_SPECIFIC -> companyLookup == null
            ? notImplemented(pattern, started)
            : resolveDirect(pattern, companyLookup.lookup(queryText, opts), opts, started);
        case METADATA_ONLY -> metadataLookup == null
            ? notImplemented(pattern, started)
            : resolveDirect(pattern, metadataLookup.lookup(queryText, opts), opts, started);
        case HYBRID -> notImplemented(pattern, started);
      };
    } catch (RuntimeException e) {
      handled = CompletableFuture.failedFuture(e);
    }
    return handled.exceptionally(error -> {
      Throwable cause = FilingFetcher.unwrap(error);
      log.warn("Resolving {} query failed", pattern, cause);
      return failure(pattern, errorCode(cause), cause.getMessage(), started);
    });
  }

  private CompletionStage<QueryResult> resolveThematic(String queryText, QueryOptions options, long started) {
    ThematicQueryParser.ParsedQuery parsed = parser.parse(queryText, LocalDate.now(clock));
    ThematicSearchParams params = ThematicSearchParams.builder()
        .query(StringUtils.defaultIfBlank(parsed.getSearchText(), queryText))
        .formTypes(firstNonEmpty(options.getFormTypes(), parsed.getFormTypes(), DiscoveryCriteria.DEFAULT_FORM_TYPES))
        .dateRange(options.getDateRange() != null ? options.getDateRange() : parsed.getDateRange())
        .sections(options.getSections() != null ? options.getSections() : Set.of())
        .maxResults(maxResults(options))
        .minScore(options.getMinScore() != null ? options.getMinScore() : SearchCriteria.DEFAULT_MIN_SCORE)
        .build();

    return thematicSearch.runThematicSearch(params, options.getProgressListener(), options.getCancellation())
        .thenApply(search -> {
          boolean summary = options.getResponseDetail() == ResponseDetail.SUMMARY;
          QueryMetadata metadata = QueryMetadata.builder()
              .executionTimeMillis(elapsedMillis(started))
              .externalCalls(search.getSourceCalls())
              .errors(search.getErrors().stream().map(QueryOrchestrator::describe).toList())
              .cancelled(search.isCancelled())
              .build();
          return QueryResult.builder()
              .success(true)
              .pattern(QueryPattern.THEMATIC)
              .data(new ThematicPayload(search))
              .sources(List.of(new SourceDescriptor(SourceDescriptor.SourceType.FILING_SOURCE,
                  thematicSearch.getSourceName(), clock.instant())))
              .citations(citations(search, summary))
              .metadata(metadata)
              .build();
        });
  }

  private <P extends QueryPayload> CompletionStage<QueryResult> resolveDirect(
      QueryPattern pattern, CompletionStage<DirectLookupResult<P>> lookup, QueryOptions options, long started) {
    boolean summary = options.getResponseDetail() == ResponseDetail.SUMMARY;
    return lookup.thenApply(result -> QueryResult.builder()
        .success(true)
        .pattern(pattern)
        .data(result.getPayload())
        .sources(result.getSources())
        .citations(summary ? withoutSnippets(result.getCitations()) : result.getCitations())
        .metadata(QueryMetadata.builder()
            .executionTimeMillis(elapsedMillis(started))
            .externalCalls(result.getExternalCalls())
            .build())
        .build());
  }

  private CompletionStage<QueryResult> notImplemented(QueryPattern pattern, long started) {
    log.info("No handler available for {} queries", pattern);
    return CompletableFuture.completedFuture(failure(pattern, QueryErrorCode.NOT_IMPLEMENTED,
        "No handler available for " + pattern + " queries", started));
  }

  private QueryResult failure(QueryPattern pattern, QueryErrorCode code, String message, long started) {
    return QueryResult.builder()
        .success(false)
        .pattern(pattern)
        .errorCode(code)
        .errorMessage(message)
        .metadata(QueryMetadata.builder()
            .executionTimeMillis(elapsedMillis(started))
            .errors(message == null ? List.of() : List.of(message))
            .build())
        .build();
  }

  static QueryErrorCode errorCode(Throwable error) {
    if (error instanceof InvalidCriteriaException) {
      return QueryErrorCode.CONFIGURATION_ERROR;
    }
    if (error instanceof DiscoveryFailedException) {
      return QueryErrorCode.DISCOVERY_FAILED;
    }
    return QueryErrorCode.EXECUTION_FAILED;
  }

  private static int maxResults(QueryOptions options) {
    if (options.getMaxResults() != null) {
      return options.getMaxResults();
    }
    return options.getResponseDetail() == ResponseDetail.SUMMARY
        ? SUMMARY_MAX_RESULTS
        : SearchCriteria.DEFAULT_MAX_RESULTS;
  }

  @SafeVarargs
  private static <T> Set<T> firstNonEmpty(Set<T>... candidates) {
    for (Set<T> candidate : candidates) {
      if (candidate != null && !candidate.isEmpty()) {
        return candidate;
      }
    }
    return Set.of();
  }

  private static List<Citation> citations(ThematicSearchResult search, boolean summary) {
    return search.getResults().stream()
        .map(result -> citation(result, summary))
        .toList();
  }

  private static Citation citation(SearchResult result, boolean summary) {
    return Citation.builder()
        .filingUrl(result.getSourceUrl())
        .accessionNumber(result.getFiling().getAccessionNumber())
        .companyName(result.getFiling().getCompanyName())
        .formType(result.getFiling().getFormType())
        .filedDate(result.getFiling().getFiledDate())
        .section(result.getSectionTitle())
        .snippet(summary ? null : result.getSnippet())
        .startChar(summary ? null : result.getSnippetStart())
        .endChar(summary ? null : result.getSnippetEnd())
        .text(result.getCitation())
        .build();
  }

  private static List<Citation> withoutSnippets(List<Citation> citations) {
    return citations.stream()
        .map(citation -> citation.toBuilder().snippet(null).startChar(null).endChar(null).build())
        .toList();
  }

  private static String describe(SearchError error) {
    return String.format("%s %s: %s", error.getType(), error.getItemId(), error.getMessage());
  }

  private static long elapsedMillis(long started) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
  }
}
