package com.quantori.eqp.core.discovery;

import akka.NotUsed;
import akka.actor.typed.ActorSystem;
import akka.japi.Pair;
import akka.stream.javadsl.Sink;
import akka.stream.javadsl.Source;
import com.quantori.eqp.api.CancellationSignal;
import com.quantori.eqp.api.DiscoveryFailedException;
import com.quantori.eqp.api.model.DiscoveryCriteria;
import com.quantori.eqp.api.model.FilingListRequest;
import com.quantori.eqp.core.configuration.PipelineSettings;
import com.quantori.eqp.core.progress.ProgressChannel;
import com.quantori.eqp.core.source.FilingFetcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import lombok.extern.slf4j.Slf4j;

/**
 * Enumerates filings matching structured criteria from a paged filing source.
 *
 * <p>The criteria are split into partitions, one per allowlisted company or a single one without an
 * allowlist. Partitions are paged independently and up to {@code parallelism} of them are fetched
 * at the same time. A failed page is recorded and skipped, an unrecoverable source error fails the
 * whole run with {@link DiscoveryFailedException}.
 */
@Slf4j
public class FilingDiscovery {
  private final FilingFetcher fetcher;
  private final PipelineSettings settings;
  private final ActorSystem<?> system;

  public FilingDiscovery(FilingFetcher fetcher, PipelineSettings settings, ActorSystem<?> system) {
    this.fetcher = fetcher;
    this.settings = settings;
    this.system = system;
  }

  public CompletionStage<DiscoveryOutcome> discover(DiscoveryCriteria criteria, ProgressChannel progress,
                                                    CancellationSignal cancellation) {
    if (criteria.getMaxResults() == 0 || cancellation.isCancelled()) {
      return CompletableFuture.completedFuture(DiscoveryOutcome.empty(cancellation.isCancelled()));
    }
    List<PartitionCursor> partitions = partitions(criteria);
    DiscoveryAccumulator accumulator = new DiscoveryAccumulator(criteria, partitions.size(), progress);
    log.debug("Discovery started [partitions={}, maxResults={}, source={}]",
        partitions.size(), criteria.getMaxResults(), fetcher.getSourceName());

    return Source.from(partitions)
        .flatMapMerge(settings.getParallelism(), partition -> pages(criteria, partition, cancellation))
        .map(accumulator::add)
        .takeWhile(unique -> unique < criteria.getMaxResults(), true)
        .runWith(Sink.ignore(), system)
        .handle((done, error) -> {
          if (error != null) {
            Throwable cause = FilingFetcher.unwrap(error);
            log.error("Discovery failed", cause);
            throw new DiscoveryFailedException("Discovery failed: " + cause.getMessage(), cause);
          }
          DiscoveryOutcome outcome = accumulator.outcome(cancellation.isCancelled());
          log.debug("Discovery completed [filings={}, pages={}, errors={}, cancelled={}]",
              outcome.getFilings().size(), outcome.getPagesFetched(), outcome.getErrors().size(),
              outcome.isCancelled());
          return outcome;
        });
  }

  private List<PartitionCursor> partitions(DiscoveryCriteria criteria) {
    List<PartitionCursor> partitions = new ArrayList<>();
    if (criteria.getCompanies().isEmpty()) {
      partitions.add(cursor(0, null, criteria));
      return partitions;
    }
    Set<String> companies = new LinkedHashSet<>();
    criteria.getCompanies().forEach(company -> companies.add(company.trim()));
    for (String company : companies) {
      partitions.add(cursor(partitions.size(), company, criteria));
    }
    return partitions;
  }

  private PartitionCursor cursor(int index, String company, DiscoveryCriteria criteria) {
    return new PartitionCursor(index, company, criteria, fetcher.getSourceName(),
        settings.getMaxConsecutivePageFailures());
  }

  private Source<PageResult, NotUsed> pages(DiscoveryCriteria criteria, PartitionCursor cursor,
                                            CancellationSignal cancellation) {
    return Source.unfoldAsync(0, page -> nextPage(criteria, cursor, page, cancellation));
  }

  private CompletionStage<Optional<Pair<Integer, PageResult>>> nextPage(
      DiscoveryCriteria criteria, PartitionCursor cursor, int page, CancellationSignal cancellation) {
    if (cursor.isDone() || cancellation.isCancelled()) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    FilingListRequest request = FilingListRequest.builder()
        .criteria(criteria)
        .company(cursor.getCompany())
        .page(page)
        .pageSize(settings.getPageSize())
        .build();
    return fetcher.listFilings(request)
        .handle((filingPage, error) -> Optional.of(Pair.create(page + 1, cursor.onPage(page, filingPage, error))));
  }
}
