package com.quantori.eqp.core.source;

import akka.actor.typed.ActorSystem;
import akka.actor.typed.DispatcherSelector;
import akka.pattern.Patterns;
import com.quantori.eqp.api.FilingSource;
import com.quantori.eqp.api.FilingSourceException;
import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.FilingContent;
import com.quantori.eqp.api.model.FilingListRequest;
import com.quantori.eqp.api.model.FilingPage;
import com.quantori.eqp.api.model.SectionType;
import com.quantori.eqp.core.configuration.PipelineSettings;
import com.quantori.eqp.core.configuration.RetrySettings;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Calls a {@link FilingSource} on the blocking dispatcher with a timeout and retries failed calls
 * with exponential backoff. One instance serves one pipeline run and counts the calls it made.
 */
@Slf4j
public class FilingFetcher {
  private final FilingSource source;
  private final Duration timeout;
  private final RetrySettings retry;
  private final ActorSystem<?> system;
  private final Executor blockingExecutor;
  private final AtomicInteger calls = new AtomicInteger();

  public FilingFetcher(FilingSource source, PipelineSettings settings, ActorSystem<?> system) {
    this.source = source;
    this.timeout = settings.getFetchTimeout();
    this.retry = settings.getRetry();
    this.system = system;
    this.blockingExecutor = system.dispatchers().lookup(DispatcherSelector.blocking());
  }

  public CompletionStage<FilingPage> listFilings(FilingListRequest request) {
    String label = String.format("page %d of %s", request.getPage(),
        request.getCompany() == null ? "all companies" : request.getCompany());
    return call(() -> source.listFilings(request), label, 1);
  }

  public CompletionStage<FilingContent> fetchContent(DiscoveredFiling filing, Set<SectionType> sections) {
    return call(() -> source.fetchFilingContent(filing, sections), filing.getAccessionNumber(), 1);
  }

  public String getSourceName() {
    return source.getSourceName();
  }

  /**
   * Number of source calls made so far, retries included.
   */
  public int getCallCount() {
    return calls.get();
  }

  private <T> CompletionStage<T> call(Supplier<T> request, String label, int attempt) {
    calls.incrementAndGet();
    CompletableFuture<T> future = CompletableFuture.supplyAsync(request, blockingExecutor)
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    return future.<CompletionStage<T>>handle((value, error) -> {
      if (error == null) {
        return CompletableFuture.completedFuture(value);
      }
      Throwable cause = unwrap(error);
      if (isUnrecoverable(cause) || attempt >= retry.getMaxAttempts()) {
        log.debug("Source call for {} failed after {} attempt(s): {}", label, attempt, cause.toString());
        return CompletableFuture.<T>failedFuture(cause);
      }
      Duration delay = retry.backoff(attempt);
      log.debug("Source call for {} failed, retrying in {} ms: {}", label, delay.toMillis(), cause.toString());
      return Patterns.after(delay, system.classicSystem().scheduler(), system.executionContext(),
          () -> call(request, label, attempt + 1));
    }).thenCompose(next -> next);
  }

  public static boolean isUnrecoverable(Throwable error) {
    return error instanceof FilingSourceException sourceException && sourceException.isUnrecoverable();
  }

  public static Throwable unwrap(Throwable error) {
    Throwable cause = error;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }
}
