package ca.gc.cra.secretscan.application.collect;

import ca.gc.cra.secretscan.domain.resource.ResourceDetail;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only result store shared by the workers of one collection run.
 *
 * <p>Every mutation happens inside a single lock-guarded critical section that only covers the append;
 * callers must never hold it across remote work.</p>
 *
 * @since 0.1.0
 */
final class ResultAggregator {
  private final ReentrantLock lock = new ReentrantLock();
  private final List<ResourceDetail> details = new ArrayList<>();
  private final List<CollectionResult.ItemFailure> failures = new ArrayList<>();

  void add(ResourceDetail detail) {
    Objects.requireNonNull(detail, "detail");
    lock.lock();
    try {
      details.add(detail);
    } finally {
      lock.unlock();
    }
  }

  void recordFailure(CollectionResult.ItemFailure failure) {
    Objects.requireNonNull(failure, "failure");
    lock.lock();
    try {
      failures.add(failure);
    } finally {
      lock.unlock();
    }
  }

  CollectionResult toResult(int enumerated) {
    lock.lock();
    try {
      return new CollectionResult(details, enumerated, failures);
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return details.size();
    } finally {
      lock.unlock();
    }
  }
}
