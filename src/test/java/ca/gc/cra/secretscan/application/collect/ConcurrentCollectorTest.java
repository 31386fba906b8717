package ca.gc.cra.secretscan.application.collect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.secretscan.application.port.DetailFetcher;
import ca.gc.cra.secretscan.application.port.ThrottlingClassifier;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import ca.gc.cra.secretscan.domain.resource.ResourceType;
import ca.gc.cra.secretscan.testutil.RecordingMetricsPort;
import ca.gc.cra.secretscan.testutil.ResourceFixtures;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConcurrentCollectorTest {
  private static final ResourceType TYPE = ResourceType.GLUE_JOB;
  private static final String SCOPE = TYPE.id();

  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
  }

  @Test
  void fetchesEveryItemAcrossPages() throws Exception {
    List<ResourceRef> first = ResourceFixtures.refs(TYPE, "a", 7);
    List<ResourceRef> second = ResourceFixtures.refs(TYPE, "b", 5);

    CollectionResult result = collector(3).collect(
        SCOPE, ResourceFixtures.pages(List.of(first, second)), detailOf(), CancellationSignal.create());

    assertEquals(12, result.enumerated());
    assertEquals(12, result.details().size());
    Set<String> ids = result.details().stream().map(d -> d.ref().id()).collect(Collectors.toSet());
    assertTrue(ids.contains("a-6") && ids.contains("b-4"));
    assertTrue(result.failures().isEmpty());
    assertEquals(2, metrics.count("collector." + SCOPE + ".pages"));
    assertEquals(12, metrics.count("collector." + SCOPE + ".fetched"));
  }

  @Test
  void duplicateRefsAreFetchedEachTime() throws Exception {
    ResourceRef ref = ResourceRef.of(TYPE, "etl-nightly");
    AtomicInteger fetches = new AtomicInteger();
    DetailFetcher fetcher = r -> {
      fetches.incrementAndGet();
      return ResourceDetail.builder(r).build();
    };

    CollectionResult result = collector(2).collect(
        SCOPE, ResourceFixtures.pages(List.of(List.of(ref, ref), List.of(ref))), fetcher,
        CancellationSignal.create());

    assertEquals(3, result.enumerated());
    assertEquals(3, result.details().size());
    assertEquals(3, fetches.get());
    assertTrue(result.details().stream().allMatch(d -> d.ref().equals(ref)));
  }

  @Test
  void emptyListingYieldsEmptyResult() throws Exception {
    CollectionResult result = collector(2).collect(
        SCOPE, ResourceFixtures.pages(List.of(List.of())), detailOf(), CancellationSignal.create());

    assertEquals(0, result.enumerated());
    assertTrue(result.details().isEmpty());
  }

  @Test
  void failedItemsAreSkippedAndRecorded() throws Exception {
    DetailFetcher fetcher = ref -> {
      if (ref.id().equals("a-2")) {
        throw new IllegalStateException("no such job");
      }
      return ResourceDetail.builder(ref).build();
    };

    CollectionResult result = collector(2).collect(
        SCOPE, ResourceFixtures.pages(List.of(ResourceFixtures.refs(TYPE, "a", 5))), fetcher,
        CancellationSignal.create());

    assertEquals(4, result.details().size());
    assertEquals(1, result.failures().size());
    assertEquals("a-2", result.failures().get(0).ref().id());
    assertEquals(1, metrics.count("collector." + SCOPE + ".failed"));
  }

  @Test
  void listingFailureDiscardsPartialResults() {
    IllegalStateException cause = new IllegalStateException("AccessDenied");

    EnumerationException ex = assertThrows(EnumerationException.class, () -> collector(2).collect(
        SCOPE,
        ResourceFixtures.failingAfter(ResourceFixtures.refs(TYPE, "a", 3), cause),
        detailOf(),
        CancellationSignal.create()));

    assertEquals(1, ex.pagesFetched());
    assertEquals(cause, ex.getCause());
    assertEquals(1, metrics.count("collector." + SCOPE + ".enumeration.failed"));
  }

  @Test
  void inFlightFetchesNeverExceedConcurrency() throws Exception {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    DetailFetcher fetcher = ref -> {
      int now = inFlight.incrementAndGet();
      peak.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(5);
        return ResourceDetail.builder(ref).build();
      } finally {
        inFlight.decrementAndGet();
      }
    };

    CollectionResult result = collector(3).collect(
        SCOPE, ResourceFixtures.pages(List.of(ResourceFixtures.refs(TYPE, "a", 30))), fetcher,
        CancellationSignal.create());

    assertEquals(30, result.details().size());
    assertTrue(peak.get() <= 3, "peak concurrency was " + peak.get());
  }

  @Test
  void singleWorkerProcessesEverything() throws Exception {
    CollectionResult result = collector(1).collect(
        SCOPE, ResourceFixtures.pages(List.of(ResourceFixtures.refs(TYPE, "a", 10))), detailOf(),
        CancellationSignal.create());

    assertEquals(10, result.details().size());
  }

  @Test
  void throttledFetchesAreRetried() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    DetailFetcher fetcher = ref -> {
      if (calls.incrementAndGet() == 1) {
        throw new IllegalStateException("Rate exceeded");
      }
      return ResourceDetail.builder(ref).build();
    };
    RetryPolicy retry = new RetryPolicy(
        3, Duration.ZERO, failure -> failure.getMessage().contains("Rate exceeded"),
        BackoffSleeper.CANCELLABLE, metrics);

    CollectionResult result = new ConcurrentCollector(CollectorSettings.ofConcurrency(1), retry, metrics)
        .collect(SCOPE, ResourceFixtures.pages(List.of(ResourceFixtures.refs(TYPE, "a", 1))), fetcher,
            CancellationSignal.create());

    assertEquals(1, result.details().size());
    assertEquals(1, metrics.count("retry.throttled"));
  }

  @Test
  void errorOnLastItemFailsTheRun() {
    AssertionError boom = new AssertionError("corrupt payload");
    DetailFetcher fetcher = ref -> {
      if (ref.id().equals("a-2")) {
        throw boom;
      }
      return ResourceDetail.builder(ref).build();
    };

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> collector(1).collect(
        SCOPE, ResourceFixtures.pages(List.of(ResourceFixtures.refs(TYPE, "a", 3))), fetcher,
        CancellationSignal.create()));

    assertSame(boom, ex.getCause());
    assertEquals(1, metrics.count("collector." + SCOPE + ".worker.uncaught"));
  }

  @Test
  void cancelledCallerAbortsCollection() {
    CancellationSignal signal = CancellationSignal.create();
    signal.cancel("shutdown requested");

    CancellationException ex = assertThrows(CancellationException.class, () -> collector(2).collect(
        SCOPE, ResourceFixtures.pages(List.of(ResourceFixtures.refs(TYPE, "a", 5))), detailOf(), signal));

    assertTrue(ex.getMessage().contains("shutdown requested"));
  }

  @Test
  void rejectsNonPositiveConcurrency() {
    assertThrows(IllegalArgumentException.class, () -> CollectorSettings.ofConcurrency(0));
  }

  private ConcurrentCollector collector(int concurrency) {
    RetryPolicy retry = new RetryPolicy(
        1, Duration.ZERO, ThrottlingClassifier.NEVER, BackoffSleeper.CANCELLABLE, metrics);
    return new ConcurrentCollector(CollectorSettings.ofConcurrency(concurrency), retry, metrics);
  }

  private static DetailFetcher detailOf() {
    return ref -> ResourceDetail.builder(ref).label("Name", ref.id()).build();
  }
}
