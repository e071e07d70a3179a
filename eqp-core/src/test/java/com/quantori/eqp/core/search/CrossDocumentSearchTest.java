package com.quantori.eqp.core.search;

import static com.quantori.eqp.core.Filings.fastSettings;
import static com.quantori.eqp.core.Filings.filing;
import static org.assertj.core.api.Assertions.assertThat;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import com.quantori.eqp.api.CancellationSignal;
import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.ErrorType;
import com.quantori.eqp.api.model.FormType;
import com.quantori.eqp.api.model.Phase;
import com.quantori.eqp.api.model.ProgressUpdate;
import com.quantori.eqp.api.model.SearchCriteria;
import com.quantori.eqp.api.model.SearchResult;
import com.quantori.eqp.core.configuration.PipelineSettings;
import com.quantori.eqp.core.progress.ProgressChannel;
import com.quantori.eqp.core.source.FilingFetcher;
import com.quantori.eqp.core.source.memory.InMemoryFilingSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

class CrossDocumentSearchTest {
  private static final ActorTestKit testKit = ActorTestKit.create();

  private final List<ProgressUpdate> events = Collections.synchronizedList(new ArrayList<>());
  private final InMemoryFilingSource source = new InMemoryFilingSource();

  @AfterAll
  static void teardown() {
    testKit.shutdownTestKit();
  }

  @Test
  void returnsOnlyFilingsContainingTheQuery() throws Exception {
    DiscoveredFiling matching = filing("0001", "Acme Corp", FormType.TEN_K, "2024-02-01");
    DiscoveredFiling other = filing("0002", "Globex", FormType.TEN_K, "2024-03-01");
    source.add(matching, "Our revenue recognition policy changed. Revenue recognition follows ASC 606.");
    source.add(other, "Liquidity and capital resources remained adequate.");

    SearchOutcome outcome = search(SearchCriteria.builder()
        .filings(List.of(matching, other))
        .query("revenue recognition")
        .minScore(0.1)
        .build(), CancellationSignal.none());

    assertThat(outcome.getResults()).hasSize(1);
    SearchResult result = outcome.getResults().get(0);
    assertThat(result.getFiling().getAccessionNumber()).isEqualTo("0001");
    assertThat(result.getScore()).isPositive();
    assertThat(result.getMatchCount()).isEqualTo(4);
    assertThat(outcome.getFilingsScanned()).isEqualTo(2);
    assertThat(outcome.getErrors()).isEmpty();
  }

  @Test
  void skipsFilingsThatCannotBeFetched() throws Exception {
    DiscoveredFiling present = filing("0001", "Acme Corp", FormType.TEN_K, "2024-02-01");
    DiscoveredFiling missing = filing("0404", "Initech", FormType.TEN_K, "2024-03-01");
    source.add(present, "Supply chain disruption affected margins.");

    SearchOutcome outcome = search(SearchCriteria.builder()
        .filings(List.of(missing, present))
        .query("supply chain")
        .build(), CancellationSignal.none());

    assertThat(outcome.getResults()).extracting(r -> r.getFiling().getAccessionNumber()).containsExactly("0001");
    assertThat(outcome.getFilingsScanned()).isEqualTo(2);
    assertThat(outcome.getErrors()).hasSize(1);
    assertThat(outcome.getErrors().get(0).getType()).isEqualTo(ErrorType.SEARCH_ITEM);
    assertThat(outcome.getErrors().get(0).getItemId()).isEqualTo("0404");
    assertThat(outcome.getErrors().get(0).getSource()).isEqualTo(InMemoryFilingSource.DEFAULT_NAME);
  }

  @Test
  void reportsProgressForEveryFiling() throws Exception {
    List<DiscoveredFiling> filings = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      DiscoveredFiling filing = filing("000" + i, "Company " + i, FormType.TEN_Q, "2024-0" + (i + 1) + "-01");
      source.add(filing, "Inflation pressure on costs.");
      filings.add(filing);
    }

    search(SearchCriteria.builder().filings(filings).query("inflation").build(), CancellationSignal.none());

    assertThat(events).hasSize(5).allMatch(event -> event.phase() == Phase.SEARCH && event.total() == 5);
    assertThat(events).extracting(ProgressUpdate::completed).containsExactly(1, 2, 3, 4, 5);
    assertThat(events).allMatch(event -> event.estimatedSecondsRemaining() != null);
    assertThat(events.get(4).estimatedSecondsRemaining()).isZero();
  }

  @Test
  void cancelledSearchScansNothing() throws Exception {
    DiscoveredFiling filing = filing("0001", "Acme Corp", FormType.TEN_K, "2024-02-01");
    source.add(filing, "Climate risk disclosure.");
    CancellationSignal cancellation = new CancellationSignal();
    cancellation.cancel();

    SearchOutcome outcome = search(SearchCriteria.builder().filings(List.of(filing)).query("climate").build(),
        cancellation);

    assertThat(outcome.isCancelled()).isTrue();
    assertThat(outcome.getFilingsScanned()).isZero();
    assertThat(outcome.getResults()).isEmpty();
  }

  @Test
  void emptyCandidateListGivesEmptyOutcome() throws Exception {
    SearchOutcome outcome = search(SearchCriteria.builder().query("anything").build(), CancellationSignal.none());

    assertThat(outcome.getResults()).isEmpty();
    assertThat(outcome.getFilingsScanned()).isZero();
    assertThat(events).isEmpty();
  }

  private SearchOutcome search(SearchCriteria criteria, CancellationSignal cancellation) throws Exception {
    PipelineSettings settings = fastSettings();
    ProgressChannel progress = ProgressChannel.open(testKit.system(), events::add, 256);
    CrossDocumentSearch search = new CrossDocumentSearch(new FilingFetcher(source, settings, testKit.system()),
        settings, testKit.system());
    try {
      return search.search(criteria, progress, cancellation).toCompletableFuture().get(10, TimeUnit.SECONDS);
    } finally {
      progress.complete().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }
  }
}
