package ca.gc.cra.secretscan.application.collect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {

  @Test
  void parentCancellationReachesChildren() {
    CancellationSignal parent = CancellationSignal.create();
    CancellationSignal child = parent.child();

    parent.cancel("shutdown");

    assertTrue(child.isCancelled());
    assertEquals("shutdown", child.reason().orElseThrow());
  }

  @Test
  void childCancellationLeavesParentRunning() {
    CancellationSignal parent = CancellationSignal.create();
    CancellationSignal child = parent.child();

    child.cancel("listing failed");

    assertTrue(child.isCancelled());
    assertFalse(parent.isCancelled());
  }

  @Test
  void childOfCancelledParentStartsCancelled() {
    CancellationSignal parent = CancellationSignal.create();
    parent.cancel("done");

    assertTrue(parent.child().isCancelled());
  }

  @Test
  void firstReasonWins() {
    CancellationSignal signal = CancellationSignal.create();
    signal.cancel("first");
    signal.cancel("second");

    assertEquals("first", signal.reason().orElseThrow());
  }

  @Test
  void awaitReturnsImmediatelyOnceCancelled() throws Exception {
    CancellationSignal signal = CancellationSignal.create();
    signal.cancel("now");

    assertTrue(signal.await(Duration.ofMinutes(5)));
  }

  @Test
  void awaitTimesOutWhileActive() throws Exception {
    assertFalse(CancellationSignal.create().await(Duration.ofMillis(10)));
  }

  @Test
  void deadlineCancelsSignal() throws Exception {
    CancellationSignal signal = CancellationSignal.withTimeout(Duration.ofMillis(20));

    assertTrue(signal.await(Duration.ofSeconds(5)));
    assertEquals("deadline exceeded", signal.reason().orElseThrow());
  }

  @Test
  void timeoutMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> CancellationSignal.withTimeout(Duration.ZERO));
  }
}
