package com.quantori.eqp.core.pipeline;

import akka.actor.typed.ActorSystem;
import com.quantori.eqp.api.CancellationSignal;
import com.quantori.eqp.api.FilingSource;
import com.quantori.eqp.api.InvalidCriteriaException;
import com.quantori.eqp.api.ProgressListener;
import com.quantori.eqp.api.model.DiscoveryCriteria;
import com.quantori.eqp.api.model.Phase;
import com.quantori.eqp.api.model.SearchCriteria;
import com.quantori.eqp.api.model.SearchError;
import com.quantori.eqp.api.model.SearchResult;
import com.quantori.eqp.api.model.ThematicSearchParams;
import com.quantori.eqp.api.model.ThematicSearchResult;
import com.quantori.eqp.api.model.ThemeAggregation;
import com.quantori.eqp.core.aggregation.ThemeAggregator;
import com.quantori.eqp.core.configuration.LocalSystemProvider;
import com.quantori.eqp.core.configuration.PipelineSettings;
import com.quantori.eqp.core.configuration.SystemConfigurationProperties;
import com.quantori.eqp.core.discovery.DiscoveryOutcome;
import com.quantori.eqp.core.discovery.FilingDiscovery;
import com.quantori.eqp.core.progress.ProgressChannel;
import com.quantori.eqp.core.search.CrossDocumentSearch;
import com.quantori.eqp.core.search.SearchOutcome;
import com.quantori.eqp.core.source.FilingFetcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Runs discovery, cross-document search and aggregation one after another for a thematic query.
 *
 * <p>Each call is an independent run: it owns its call counter, progress channel and accumulated
 * state. The service is safe to use from several threads.
 */
@Slf4j
public class ThematicSearchService implements AutoCloseable {
  private final FilingSource source;
  private final PipelineSettings settings;
  private final ActorSystem<?> system;
  private final boolean ownsSystem;
  private final ThemeAggregator aggregator = new ThemeAggregator();

  /**
   * Creates a service with settings from the configuration and its own actor system, terminated on
   * {@link #close()}.
   */
  public ThematicSearchService(FilingSource source) {
    this(source, PipelineSettings.load(),
        new LocalSystemProvider().actorTypedSystem(SystemConfigurationProperties.builder().build()), true);
  }

  /**
   * Creates a service running on a caller managed actor system.
   */
  public ThematicSearchService(FilingSource source, PipelineSettings settings, ActorSystem<?> system) {
    this(source, settings, system, false);
  }

  private ThematicSearchService(FilingSource source, PipelineSettings settings, ActorSystem<?> system,
                                boolean ownsSystem) {
    settings.validate();
    this.source = Objects.requireNonNull(source, "source");
    this.settings = settings;
    this.system = system;
    this.ownsSystem = ownsSystem;
  }

  public String getSourceName() {
    return source.getSourceName();
  }

  public CompletionStage<ThematicSearchResult> runThematicSearch(ThematicSearchParams params,
                                                                 ProgressListener listener) {
    return runThematicSearch(params, listener, CancellationSignal.none());
  }

  /**
   * Starts a run.
   *
   * @param params       query and criteria
   * @param listener     receives progress, may be {@code null}
   * @param cancellation stops the run early, the partial result is returned with the cancelled flag
   * @return the result; fails with {@link com.quantori.eqp.api.DiscoveryFailedException} when the
   *     filing source is unusable
   * @throws InvalidCriteriaException when the parameters are inconsistent, before any work starts
   */
  public CompletionStage<ThematicSearchResult> runThematicSearch(ThematicSearchParams params,
                                                                 ProgressListener listener,
                                                                 CancellationSignal cancellation) {
    validate(params);
    long started = System.nanoTime();
    CancellationSignal signal = cancellation == null ? CancellationSignal.none() : cancellation;
    DiscoveryCriteria discoveryCriteria = params.toDiscoveryCriteria();
    FilingFetcher fetcher = new FilingFetcher(source, settings, system);
    ProgressChannel progress = ProgressChannel.open(system,
        listener == null ? ProgressListener.NO_OP : listener, settings.getProgressBufferSize());
    log.debug("Thematic search started [query={}]", params.getQuery());

    // a discovery that fails to start still goes through the handler below, which closes the channel
    CompletionStage<DiscoveryOutcome> discovery;
    try {
      discovery = new FilingDiscovery(fetcher, settings, system).discover(discoveryCriteria, progress, signal);
    } catch (RuntimeException e) {
      discovery = CompletableFuture.failedFuture(e);
    }

    CompletionStage<ThematicSearchResult> run = discovery
        .<ThematicSearchResult>thenCompose(discovered -> {
          SearchCriteria searchCriteria = params.toSearchCriteria(discovered.getFilings());
          if (discovered.getFilings().isEmpty() || discovered.isCancelled()) {
            log.debug("Skipping search [filings={}, cancelled={}]",
                discovered.getFilings().size(), discovered.isCancelled());
            SearchOutcome skipped = new SearchOutcome(List.of(), 0, List.of(), discovered.isCancelled());
            return CompletableFuture.completedFuture(
                result(params, discoveryCriteria, searchCriteria, discovered, skipped, List.of(), fetcher, started));
          }
          return new CrossDocumentSearch(fetcher, settings, system)
              .search(searchCriteria, progress, signal)
              .thenApply(searched -> {
                progress.offer(Phase.AGGREGATION, 0, 1, "aggregating");
                List<ThemeAggregation> aggregations = aggregator.aggregate(params.getQuery(), searched.getResults());
                progress.offer(Phase.AGGREGATION, 1, 1, "aggregated");
                return result(params, discoveryCriteria, searchCriteria, discovered, searched, aggregations,
                    fetcher, started);
              });
        });

    return run
        .handle((result, error) -> progress.complete().thenCompose(drained -> {
          if (error != null) {
            Throwable cause = FilingFetcher.unwrap(error);
            log.error("Thematic search failed [query={}]", params.getQuery(), cause);
            return CompletableFuture.<ThematicSearchResult>failedFuture(cause);
          }
          return CompletableFuture.completedFuture(result);
        }))
        .thenCompose(stage -> stage);
  }

  private ThematicSearchResult result(ThematicSearchParams params, DiscoveryCriteria discoveryCriteria,
                                      SearchCriteria searchCriteria, DiscoveryOutcome discovered,
                                      SearchOutcome searched, List<ThemeAggregation> aggregations,
                                      FilingFetcher fetcher, long started) {
    List<SearchResult> results = searched.getResults();
    List<SearchError> errors = new ArrayList<>(discovered.getErrors());
    errors.addAll(searched.getErrors());
    long companies = results.stream()
        .map(result -> result.getFiling().getCompanyName())
        .distinct()
        .count();
    ThematicSearchResult result = ThematicSearchResult.builder()
        .query(params.getQuery())
        .executionTimeMillis(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started))
        .totalFilingsScanned(discovered.getFilings().size())
        .matchingFilings(results.size())
        .companiesFound((int) companies)
        .results(results)
        .aggregations(aggregations)
        .discoveryCriteria(discoveryCriteria)
        .searchCriteria(searchCriteria)
        .errors(errors)
        .cancelled(discovered.isCancelled() || searched.isCancelled())
        .sourceCalls(fetcher.getCallCount())
        .build();
    log.debug("Thematic search completed [query={}, scanned={}, matching={}, errors={}, cancelled={}, {} ms]",
        result.getQuery(), result.getTotalFilingsScanned(), result.getMatchingFilings(), errors.size(),
        result.isCancelled(), result.getExecutionTimeMillis());
    return result;
  }

  static void validate(ThematicSearchParams params) {
    if (params == null) {
      throw new InvalidCriteriaException("Search parameters must be provided.");
    }
    if (StringUtils.isBlank(params.getQuery())) {
      throw new InvalidCriteriaException("Query must not be blank.");
    }
    if (params.getFormTypes() == null || params.getFormTypes().isEmpty()) {
      throw new InvalidCriteriaException("Form types must not be empty.");
    }
    requireElements(params.getFormTypes(), "Form types");
    requireElements(params.getIndustries(), "Industries");
    requireElements(params.getCompanies(), "Companies");
    requireElements(params.getSections(), "Sections");
    if (params.getSortBy() == null || params.getSortOrder() == null) {
      throw new InvalidCriteriaException("Sort key and order must be provided.");
    }
    if (params.getDateRange() != null && !params.getDateRange().isOrdered()) {
      throw new InvalidCriteriaException("Date range start must not be after its end.");
    }
    if (params.getMaxFilings() < 0) {
      throw new InvalidCriteriaException("Max filings must not be negative.");
    }
    if (params.getMaxResults() < 0) {
      throw new InvalidCriteriaException("Max results must not be negative.");
    }
    if (params.getMinScore() < 0 || params.getMinScore() > 1) {
      throw new InvalidCriteriaException("Min score must be within [0, 1].");
    }
    if (params.getSnippetLength() <= 0) {
      throw new InvalidCriteriaException("Snippet length must be positive.");
    }
  }

  private static void requireElements(Collection<?> values, String name) {
    if (values == null) {
      throw new InvalidCriteriaException(name + " must not be null.");
    }
    if (values.stream().anyMatch(Objects::isNull)) {
      throw new InvalidCriteriaException(name + " must not contain null values.");
    }
  }

  @Override
  public void close() {
    if (ownsSystem) {
      system.terminate();
    }
  }
}
