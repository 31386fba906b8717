package ca.gc.cra.secretscan.application.collect;

import ca.gc.cra.secretscan.application.port.DetailFetcher;
import ca.gc.cra.secretscan.application.port.ListingSource;
import ca.gc.cra.secretscan.application.port.MetricsPort;
import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import ca.gc.cra.secretscan.domain.resource.ResourceRef;
import ca.gc.cra.secretscan.infrastructure.exec.ExecutorFactories;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Drives a paginated listing through a bounded worker pool that fetches every item's
 * detail.
 * <p><strong>Why:</strong> Detail calls dominate scan time; fanning them out while bounding concurrency keeps
 * throughput high without overrunning AWS API limits.</p>
 * <p><strong>Role:</strong> Application service invoked once per resource type by {@code ScanUseCase}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Feed listing pages, in order, into an {@link ArrayBlockingQueue} of capacity {@code concurrency}.</li>
 *   <li>Run exactly {@code concurrency} workers that fetch details through the {@link RetryPolicy}.</li>
 *   <li>Skip items whose fetch fails; abandon the whole run when the listing itself fails.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are immutable and may run several collections concurrently;
 * every {@link #collect} call owns its queue, pool and {@link ResultAggregator}.</p>
 * <p><strong>Performance:</strong> The aggregator lock covers only the append, never the remote call.</p>
 * <p><strong>Observability:</strong> Emits {@code collector.<scope>.*} counters, fetch latency and queue
 * high-water observations; sets MDC keys {@code pipeline} and {@code resourceType}.</p>
 *
 * @since 0.1.0
 */
public final class ConcurrentCollector {
  private static final Logger log = LoggerFactory.getLogger(ConcurrentCollector.class);

  private static final long WORKER_IDLE_POLL_MILLIS = 25L;
  private static final long ENQUEUE_POLL_MILLIS = 25L;
  private static final long SHUTDOWN_POLL_MILLIS = 250L;

  private final CollectorSettings settings;
  private final RetryPolicy retryPolicy;
  private final MetricsPort metrics;

  /**
   * Creates a collector.
   *
   * @param settings worker count and thread naming
   * @param retryPolicy retry policy wrapped around every detail fetch
   * @param metrics metrics sink
   */
  public ConcurrentCollector(CollectorSettings settings, RetryPolicy retryPolicy, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Collects details using {@code "default"} as the metric and log scope.
   *
   * @see #collect(String, ListingSource, DetailFetcher, CancellationSignal)
   */
  public CollectionResult collect(ListingSource source, DetailFetcher fetcher, CancellationSignal cancellation)
      throws EnumerationException, InterruptedException {
    return collect("default", source, fetcher, cancellation);
  }

  /**
   * Enumerates {@code source} and fetches every reference's detail.
   *
   * <p>Returns only after the listing is exhausted and every worker has drained the queue and exited. The
   * result has no defined order and is not de-duplicated.</p>
   *
   * @param scope label used in metric keys, MDC and thread names (usually the resource type id)
   * @param source listing source; driven from the calling thread
   * @param fetcher thread-safe detail fetcher
   * @param cancellation caller cancellation signal
   * @return every fetched detail plus the skipped items
   * @throws EnumerationException when the listing source fails; partial results are discarded
   * @throws CancellationException when {@code cancellation} fires before the run completes
   * @throws InterruptedException when the calling thread is interrupted
   * @throws IllegalStateException when a worker thread dies from an uncaught error
   */
  public CollectionResult collect(
      String scope, ListingSource source, DetailFetcher fetcher, CancellationSignal cancellation)
      throws EnumerationException, InterruptedException {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(fetcher, "fetcher");
    Objects.requireNonNull(cancellation, "cancellation");
    return new Run(scope, fetcher, cancellation).execute(source);
  }

  private final class Run {
    private final String scope;
    private final DetailFetcher fetcher;
    private final CancellationSignal caller;
    private final CancellationSignal signal;
    private final BlockingQueue<ResourceRef> queue;
    private final ResultAggregator aggregator = new ResultAggregator();
    private final AtomicBoolean feederDone = new AtomicBoolean();
    private final AtomicReference<Throwable> workerCrash = new AtomicReference<>();
    private final AtomicInteger queueHighWaterMark = new AtomicInteger();
    private int enumerated;
    private int pages;

    private Run(String scope, DetailFetcher fetcher, CancellationSignal caller) {
      this.scope = scope;
      this.fetcher = fetcher;
      this.caller = caller;
      this.signal = caller.child();
      this.queue = new ArrayBlockingQueue<>(settings.concurrency());
    }

    CollectionResult execute(ListingSource source) throws EnumerationException, InterruptedException {
      MDC.put("pipeline", "scan");
      MDC.put("resourceType", scope);
      long startNanos = System.nanoTime();
      ExecutorService executor = ExecutorFactories.newWorkerPool(
          settings.concurrency(), settings.threadPrefix() + "-" + scope, this::handleWorkerCrash);
      EnumerationException enumerationFailure = null;
      boolean interrupted = false;
      try {
        for (int i = 0; i < settings.concurrency(); i++) {
          executor.execute(new Worker());
        }
        log.debug("Started {} collector workers for {}", settings.concurrency(), scope);
        feed(source);
      } catch (EnumerationException ex) {
        enumerationFailure = ex;
        signal.cancel("listing failed");
      } catch (InterruptedException ie) {
        interrupted = true;
        signal.cancel("interrupted");
      } finally {
        feederDone.set(true);
        interrupted |= awaitWorkers(executor);
        metrics.observe("collector.queue.highWater", queueHighWaterMark.get());
        MDC.remove("resourceType");
        MDC.remove("pipeline");
      }

      if (interrupted) {
        throw new InterruptedException("Collection of " + scope + " interrupted");
      }
      Throwable crash = workerCrash.get();
      if (crash != null) {
        throw new IllegalStateException("Collector worker for " + scope + " crashed", crash);
      }
      if (enumerationFailure != null) {
        metrics.increment("collector." + scope + ".enumeration.failed");
        log.error("Listing {} failed after {} pages; discarding {} fetched details",
            scope, pages, aggregator.size());
        throw enumerationFailure;
      }
      if (caller.isCancelled()) {
        throw new CancellationException(
            "Collection of " + scope + " cancelled: " + caller.reason().orElse("cancelled"));
      }

      CollectionResult result = aggregator.toResult(enumerated);
      log.info("Collected {} {} details ({} enumerated, {} failed) in {} ms",
          result.details().size(),
          scope,
          enumerated,
          result.failures().size(),
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
      return result;
    }

    private void feed(ListingSource source) throws EnumerationException, InterruptedException {
      while (!signal.isCancelled() && workerCrash.get() == null) {
        ListingSource.Page page;
        try {
          page = source.nextPage();
        } catch (InterruptedException ie) {
          throw ie;
        } catch (Exception ex) {
          throw new EnumerationException("Failed to list " + scope + ": " + ex.getMessage(), pages, ex);
        }
        if (page == null) {
          throw new EnumerationException(
              "Listing " + scope + " returned no page", pages, new IllegalStateException("null page"));
        }
        pages++;
        metrics.increment("collector." + scope + ".pages");
        for (ResourceRef ref : page.items()) {
          if (!enqueue(ref)) {
            return;
          }
          enumerated++;
          metrics.increment("collector." + scope + ".enumerated");
        }
        if (!page.hasMore()) {
          return;
        }
      }
    }

    private boolean enqueue(ResourceRef ref) throws InterruptedException {
      while (true) {
        if (signal.isCancelled() || workerCrash.get() != null) {
          return false;
        }
        if (queue.offer(ref, ENQUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
          updateQueueHighWater(queue.size());
          return true;
        }
      }
    }

    private boolean awaitWorkers(ExecutorService executor) {
      executor.shutdown();
      boolean interrupted = false;
      while (true) {
        try {
          if (executor.awaitTermination(SHUTDOWN_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            break;
          }
        } catch (InterruptedException ie) {
          interrupted = true;
          signal.cancel("interrupted");
          executor.shutdownNow();
        }
      }
      queue.clear();
      return interrupted;
    }

    private void updateQueueHighWater(int depth) {
      int previous;
      do {
        previous = queueHighWaterMark.get();
        if (depth <= previous) {
          return;
        }
      } while (!queueHighWaterMark.compareAndSet(previous, depth));
    }

    private void handleWorkerCrash(Thread thread, Throwable throwable) {
      metrics.increment("collector." + scope + ".worker.uncaught");
      log.error("Collector worker {} threw an uncaught exception", thread.getName(), throwable);
      if (workerCrash.compareAndSet(null, throwable)) {
        signal.cancel("worker crashed");
      }
    }

    private final class Worker implements Runnable {
      @Override
      public void run() {
        MDC.put("pipeline", "scan");
        MDC.put("resourceType", scope);
        try {
          while (!signal.isCancelled()) {
            ResourceRef ref = queue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (ref == null) {
              if (feederDone.get() && queue.isEmpty()) {
                break;
              }
              continue;
            }
            process(ref);
          }
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          metrics.increment("collector." + scope + ".worker.interrupted");
        } catch (RuntimeException | Error crash) {
          // recorded before the pool sees the worker exit, so awaitWorkers cannot outrun it
          handleWorkerCrash(Thread.currentThread(), crash);
        } finally {
          MDC.remove("resourceType");
          MDC.remove("pipeline");
        }
      }

      private void process(ResourceRef ref) throws InterruptedException {
        long startNanos = System.nanoTime();
        try {
          ResourceDetail detail = retryPolicy.execute(() -> fetcher.fetch(ref), signal);
          if (detail == null) {
            throw new ItemFetchException("fetcher returned no detail", 1, null, false);
          }
          aggregator.add(detail);
          metrics.increment("collector." + scope + ".fetched");
          metrics.observe("collector.fetch.latencyNanos", System.nanoTime() - startNanos);
        } catch (ItemFetchException ex) {
          if (ex.cancelled()) {
            log.debug("Abandoned {} {} after cancellation", scope, ref.id());
            return;
          }
          metrics.increment("collector." + scope + ".failed");
          log.warn("Skipping {} {} after {} attempt(s): {}", scope, ref.id(), ex.attempts(), ex.getMessage());
          aggregator.recordFailure(new CollectionResult.ItemFailure(ref, ex));
        }
      }
    }
  }
}
