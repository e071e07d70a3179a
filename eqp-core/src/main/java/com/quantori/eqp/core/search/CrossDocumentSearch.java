package com.quantori.eqp.core.search;

import akka.actor.typed.ActorSystem;
import akka.stream.javadsl.Sink;
import akka.stream.javadsl.Source;
import com.quantori.eqp.api.CancellationSignal;
import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.ErrorType;
import com.quantori.eqp.api.model.Phase;
import com.quantori.eqp.api.model.SearchCriteria;
import com.quantori.eqp.api.model.SearchError;
import com.quantori.eqp.api.model.SearchResult;
import com.quantori.eqp.core.configuration.PipelineSettings;
import com.quantori.eqp.core.progress.ProgressChannel;
import com.quantori.eqp.core.progress.RemainingTime;
import com.quantori.eqp.core.source.FilingFetcher;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches the content of discovered filings and ranks their sections against a free-text query.
 *
 * <p>Up to {@code parallelism} filings are fetched at the same time. A filing that cannot be
 * fetched or scored is recorded as an error and skipped.
 */
@Slf4j
public class CrossDocumentSearch {
  private final FilingFetcher fetcher;
  private final PipelineSettings settings;
  private final ActorSystem<?> system;
  private final FilingScanner scanner;
  private final ResultRanker ranker = new ResultRanker();

  public CrossDocumentSearch(FilingFetcher fetcher, PipelineSettings settings, ActorSystem<?> system) {
    this.fetcher = fetcher;
    this.settings = settings;
    this.system = system;
    this.scanner = new FilingScanner(new RelevanceScorer(settings.getTermSaturation()));
  }

  public CompletionStage<SearchOutcome> search(SearchCriteria criteria, ProgressChannel progress,
                                               CancellationSignal cancellation) {
    List<DiscoveredFiling> filings = criteria.getFilings();
    if (filings.isEmpty() || criteria.getMaxResults() == 0) {
      return CompletableFuture.completedFuture(
          new SearchOutcome(List.of(), 0, List.of(), cancellation.isCancelled()));
    }
    List<String> terms = Terms.queryTerms(criteria.getQuery());
    int total = filings.size();
    List<SearchResult> raw = new ArrayList<>();
    List<SearchError> errors = new ArrayList<>();
    int[] processed = {0};
    RemainingTime remainingTime = RemainingTime.start();
    log.debug("Search started [filings={}, terms={}]", total, terms);

    return Source.from(filings)
        .takeWhile(filing -> !cancellation.isCancelled())
        .mapAsyncUnordered(settings.getParallelism(), filing -> scan(filing, criteria, terms))
        .map(scan -> {
          processed[0]++;
          if (scan.getError() != null) {
            errors.add(scan.getError());
          } else {
            raw.addAll(scan.getResults());
          }
          progress.offer(Phase.SEARCH, processed[0], total, scan.getFiling().getAccessionNumber(), remainingTime);
          return scan;
        })
        .runWith(Sink.ignore(), system)
        .thenApply(done -> {
          List<SearchResult> ranked = ranker.rank(raw, criteria);
          log.debug("Search completed [scanned={}, raw={}, ranked={}, errors={}]",
              processed[0], raw.size(), ranked.size(), errors.size());
          return new SearchOutcome(ranked, processed[0], List.copyOf(errors), cancellation.isCancelled());
        });
  }

  private CompletionStage<FilingScan> scan(DiscoveredFiling filing, SearchCriteria criteria, List<String> terms) {
    return fetcher.fetchContent(filing, criteria.getSections())
        .thenApply(content -> new FilingScan(filing, scanner.scan(filing, content, criteria, terms), null))
        .exceptionally(error -> {
          Throwable cause = FilingFetcher.unwrap(error);
          log.warn("Skipping filing {}: {}", filing.getAccessionNumber(), cause.toString());
          return new FilingScan(filing, List.of(),
              new SearchError(ErrorType.SEARCH_ITEM, fetcher.getSourceName(), filing.getAccessionNumber(),
                  String.valueOf(cause.getMessage())));
        });
  }

  @Value
  private static class FilingScan {
    DiscoveredFiling filing;
    List<SearchResult> results;
    SearchError error;
  }
}
