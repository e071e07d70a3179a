package com.quantori.eqp.core.pipeline;

import static com.quantori.eqp.core.Filings.fastSettings;
import static com.quantori.eqp.core.Filings.filing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import akka.actor.testkit.typed.javadsl.ActorTestKit;
import com.quantori.eqp.api.CancellationSignal;
import com.quantori.eqp.api.DiscoveryFailedException;
import com.quantori.eqp.api.FilingSource;
import com.quantori.eqp.api.FilingSourceException;
import com.quantori.eqp.api.InvalidCriteriaException;
import com.quantori.eqp.api.model.DateRange;
import com.quantori.eqp.api.model.DiscoveredFiling;
import com.quantori.eqp.api.model.FilingListRequest;
import com.quantori.eqp.api.model.FilingPage;
import com.quantori.eqp.api.model.FormType;
import com.quantori.eqp.api.model.Phase;
import com.quantori.eqp.api.model.ProgressUpdate;
import com.quantori.eqp.api.model.SearchResult;
import com.quantori.eqp.api.model.SectionType;
import com.quantori.eqp.api.model.ThematicSearchParams;
import com.quantori.eqp.api.model.ThematicSearchResult;
import com.quantori.eqp.core.source.memory.InMemoryFilingSource;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ThematicSearchServiceTest {
  private static final ActorTestKit testKit = ActorTestKit.create();

  private final List<ProgressUpdate> events = Collections.synchronizedList(new ArrayList<>());

  @AfterAll
  static void teardown() {
    testKit.shutdownTestKit();
  }

  @Test
  void runsDiscoverySearchAndAggregation() throws Exception {
    InMemoryFilingSource source = new InMemoryFilingSource()
        .add(filing("0001", "Acme Corp", FormType.TEN_K, "2024-02-01"),
            "Cybersecurity incidents and ransomware attacks could disrupt operations. "
                + "We invest in cybersecurity controls every year.")
        .add(filing("0002", "Globex", FormType.TEN_K, "2023-11-15"),
            "A cybersecurity breach at a vendor exposed customer data.")
        .add(filing("0003", "Initech", FormType.TEN_K, "2024-03-10"),
            "Demand for our products remained stable.");

    ThematicSearchResult result = run(source, ThematicSearchParams.builder()
        .query("cybersecurity")
        .formTypes(Set.of(FormType.TEN_K))
        .build(), CancellationSignal.none());

    assertThat(result.getTotalFilingsScanned()).isEqualTo(3);
    assertThat(result.getResults()).extracting(r -> r.getFiling().getAccessionNumber())
        .containsExactlyInAnyOrder("0001", "0002");
    assertThat(result.getResults()).isSortedAccordingTo((a, b) -> Double.compare(b.getScore(), a.getScore()));
    assertEquals(result.getResults().size(), result.getMatchingFilings());
    assertThat(result.getCompaniesFound()).isEqualTo(2);
    assertThat(result.getAggregations()).hasSize(1);
    assertThat(result.getAggregations().get(0).getCompaniesCount()).isEqualTo(2);
    assertThat(result.getErrors()).isEmpty();
    assertThat(result.isCancelled()).isFalse();
    assertThat(result.getSourceCalls()).isEqualTo(4);
    assertThat(result.getDiscoveryCriteria().getFormTypes()).containsExactly(FormType.TEN_K);
    assertThat(result.getSearchCriteria().getQuery()).isEqualTo("cybersecurity");
  }

  @Test
  void reportsPhasesInPipelineOrder() throws Exception {
    InMemoryFilingSource source = new InMemoryFilingSource();
    for (int i = 0; i < 4; i++) {
      source.add(filing("000" + i, "Company " + i, FormType.TEN_Q, "2024-0" + (i + 1) + "-01"),
          "Tariffs raised our input costs.");
    }

    run(source, ThematicSearchParams.builder().query("tariffs").build(), CancellationSignal.none());

    List<Phase> phases = events.stream().map(ProgressUpdate::phase).toList();
    assertThat(phases).isSorted().contains(Phase.DISCOVERY, Phase.SEARCH, Phase.AGGREGATION);
    assertThat(events.get(events.size() - 1)).isEqualTo(new ProgressUpdate(Phase.AGGREGATION, 1, 1, "aggregated"));
    assertThat(events.stream().filter(event -> event.phase() == Phase.SEARCH))
        .extracting(ProgressUpdate::completed)
        .containsExactly(1, 2, 3, 4);
  }

  @Test
  void skipsSearchWhenNothingIsDiscovered() throws Exception {
    FilingSource source = spy(new InMemoryFilingSource()
        .add(filing("0001", "Acme Corp", FormType.EIGHT_K, "2024-02-01"), "Cybersecurity incident."));

    ThematicSearchResult result = run(source, ThematicSearchParams.builder()
        .query("cybersecurity")
        .formTypes(Set.of(FormType.TEN_K))
        .build(), CancellationSignal.none());

    assertThat(result.getTotalFilingsScanned()).isZero();
    assertThat(result.getResults()).isEmpty();
    assertThat(result.getAggregations()).isEmpty();
    assertThat(result.getMatchingFilings()).isZero();
    verify(source, never()).fetchFilingContent(any(), any());
    assertThat(events).noneMatch(event -> event.phase() == Phase.SEARCH || event.phase() == Phase.AGGREGATION);
  }

  @Test
  void cancellationDuringDiscoveryReturnsPartialResult() throws Exception {
    CancellationSignal cancellation = new CancellationSignal();
    FilingSource source = mock(FilingSource.class);
    when(source.getSourceName()).thenReturn("paged-source");
    when(source.listFilings(any())).thenAnswer(invocation -> {
      FilingListRequest request = invocation.getArgument(0);
      if (request.getPage() == 1) {
        cancellation.cancel();
      }
      List<DiscoveredFiling> page = IntStream.range(0, 10)
          .mapToObj(i -> filing("p" + request.getPage() + "-" + i, "Company " + i, FormType.TEN_K, "2024-01-01"))
          .collect(Collectors.toList());
      return FilingPage.of(page, request.getPage() == 4);
    });

    ThematicSearchResult result = run(source, ThematicSearchParams.builder().query("climate").build(), cancellation);

    assertThat(result.isCancelled()).isTrue();
    assertThat(result.getTotalFilingsScanned()).isEqualTo(20);
    assertThat(result.getResults()).isEmpty();
    verify(source, never()).fetchFilingContent(any(), any());
  }

  @Test
  void unusableSourceFailsTheRun() {
    FilingSource source = mock(FilingSource.class);
    when(source.getSourceName()).thenReturn("broken-source");
    when(source.listFilings(any())).thenThrow(FilingSourceException.unrecoverable("Access denied"));

    ExecutionException error = assertThrows(ExecutionException.class,
        () -> run(source, ThematicSearchParams.builder().query("climate").build(), CancellationSignal.none()));

    assertThat(error.getCause()).isInstanceOf(DiscoveryFailedException.class);
  }

  @Test
  void zeroMaxFilingsGivesEmptyResult() throws Exception {
    InMemoryFilingSource source = new InMemoryFilingSource()
        .add(filing("0001", "Acme Corp", FormType.TEN_K, "2024-02-01"), "Climate risk.");

    ThematicSearchResult result = run(source, ThematicSearchParams.builder().query("climate").maxFilings(0).build(),
        CancellationSignal.none());

    assertThat(result.getTotalFilingsScanned()).isZero();
    assertThat(result.getResults()).isEmpty();
    assertThat(result.getSourceCalls()).isZero();
  }

  static Stream<Arguments> invalidParams() {
    ThematicSearchParams valid = ThematicSearchParams.builder().query("climate risk").build();
    return Stream.of(
        Arguments.of(valid.toBuilder().query(" ").build(), "Query must not be blank."),
        Arguments.of(valid.toBuilder().formTypes(Set.of()).build(), "Form types must not be empty."),
        Arguments.of(valid.toBuilder()
                .dateRange(DateRange.of(LocalDate.of(2024, 12, 31), LocalDate.of(2024, 1, 1))).build(),
            "Date range start must not be after its end."),
        Arguments.of(valid.toBuilder().maxFilings(-1).build(), "Max filings must not be negative."),
        Arguments.of(valid.toBuilder().maxResults(-1).build(), "Max results must not be negative."),
        Arguments.of(valid.toBuilder().minScore(1.5).build(), "Min score must be within [0, 1]."),
        Arguments.of(valid.toBuilder().snippetLength(0).build(), "Snippet length must be positive."),
        Arguments.of(valid.toBuilder().industries(null).build(), "Industries must not be null."),
        Arguments.of(valid.toBuilder().companies(null).build(), "Companies must not be null."),
        Arguments.of(valid.toBuilder().sections(null).build(), "Sections must not be null."),
        Arguments.of(valid.toBuilder().companies(Arrays.asList("ACME", null)).build(),
            "Companies must not contain null values."),
        Arguments.of(valid.toBuilder().sections(new HashSet<>(Arrays.asList(SectionType.RISK_FACTORS, null))).build(),
            "Sections must not contain null values."),
        Arguments.of(valid.toBuilder().formTypes(new HashSet<>(Arrays.asList(FormType.TEN_K, null))).build(),
            "Form types must not contain null values."),
        Arguments.of(valid.toBuilder().sortBy(null).build(), "Sort key and order must be provided."));
  }

  @ParameterizedTest
  @MethodSource("invalidParams")
  void rejectsInvalidParamsBeforeAnySourceCall(ThematicSearchParams params, String message) {
    FilingSource source = mock(FilingSource.class);
    ThematicSearchService service = new ThematicSearchService(source, fastSettings(), testKit.system());

    InvalidCriteriaException error = assertThrows(InvalidCriteriaException.class,
        () -> service.runThematicSearch(params, events::add));

    assertThat(error).hasMessage(message);
    verify(source, never()).listFilings(any());
  }

  @Test
  void discoveryFailingToStartFailsTheRunOnceProgressIsClosed() {
    FilingSource source = mock(FilingSource.class);
    when(source.getSourceName()).thenThrow(new IllegalStateException("source not initialised"));
    ThematicSearchService service = new ThematicSearchService(source, fastSettings(), testKit.system());

    CompletableFuture<ThematicSearchResult> run = service.runThematicSearch(
        ThematicSearchParams.builder().query("climate").build(), events::add).toCompletableFuture();

    ExecutionException error = assertThrows(ExecutionException.class, () -> run.get(10, TimeUnit.SECONDS));
    assertThat(error.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("source not initialised");
    assertThat(events).isEmpty();
    verify(source, never()).listFilings(any());
  }

  @Test
  void serviceOwningItsSystemTerminatesItOnClose() {
    ThematicSearchService service = new ThematicSearchService(new InMemoryFilingSource());
    assertThat(service.getSourceName()).isEqualTo(InMemoryFilingSource.DEFAULT_NAME);
    service.close();
  }

  private ThematicSearchResult run(FilingSource source, ThematicSearchParams params, CancellationSignal cancellation)
      throws Exception {
    ThematicSearchService service = new ThematicSearchService(source, fastSettings(), testKit.system());
    ThematicSearchResult result = service.runThematicSearch(params, events::add, cancellation)
        .toCompletableFuture()
        .get(10, TimeUnit.SECONDS);
    for (SearchResult searchResult : result.getResults()) {
      assertThat(searchResult.getScore()).isBetween(0.0, 1.0);
    }
    return result;
  }
}
