package dev.ragservice.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeadlineGuardTest {

  private ExecutorService executor;
  private DeadlineGuard guard;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
    guard = new DeadlineGuard(executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static String sleepThen(long millis, String value) throws InterruptedException {
    Thread.sleep(millis);
    return value;
  }

  @Test
  void runsCallsConcurrently() {
    BoundedResults<String> results =
        guard.runBounded(
            List.of(
                BoundedCall.of("dense", () -> sleepThen(300, "d")),
                BoundedCall.of("sparse", () -> sleepThen(300, "s"))),
            Duration.ofSeconds(2));

    assertThat(results.outcome("dense").value()).isEqualTo("d");
    assertThat(results.outcome("sparse").value()).isEqualTo("s");
    assertThat(results.elapsedMillis()).isLessThan(550);
  }

  @Test
  void reportsOutcomesInSubmissionOrder() {
    BoundedResults<String> results =
        guard.runBounded(
            List.of(
                BoundedCall.of("slow", () -> sleepThen(100, "1")),
                BoundedCall.of("fast", () -> "2")),
            Duration.ofSeconds(1));

    assertThat(results.outcomes()).extracting(Outcome::name).containsExactly("slow", "fast");
  }

  @Test
  void timedOutCallIsCancelledAndInterrupted() throws Exception {
    CountDownLatch interrupted = new CountDownLatch(1);
    BoundedCall<String> stuck =
        BoundedCall.of(
            "sparse",
            () -> {
              try {
                Thread.sleep(10_000);
                return "never";
              } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
              }
            });

    BoundedResults<String> results =
        guard.runBounded(List.of(stuck, BoundedCall.of("dense", () -> "d")), Duration.ofMillis(150));

    Outcome<String> sparse = results.outcome("sparse");
    assertThat(sparse.isTimedOut()).isTrue();
    assertThat(sparse.valueOr("fallback")).isEqualTo("fallback");
    assertThat(sparse.describe()).startsWith("sparse: timed out after");
    assertThat(results.outcome("dense").isCompleted()).isTrue();
    assertThat(results.hasUsableResult()).isTrue();
    assertThat(results.elapsedMillis()).isLessThan(1_000);
    assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void abandonHookRunsOnlyForCallsGivenUpOn() {
    AtomicInteger abandonedSlow = new AtomicInteger();
    AtomicInteger abandonedFast = new AtomicInteger();

    BoundedResults<String> results =
        guard.runBounded(
            List.of(
                new BoundedCall<String>(
                    "slow",
                    () -> sleepThen(2_000, "s"),
                    Duration.ofMillis(50),
                    abandonedSlow::incrementAndGet),
                new BoundedCall<String>("fast", () -> "f", null, abandonedFast::incrementAndGet)),
            Duration.ofSeconds(1));

    assertThat(results.outcome("slow").isTimedOut()).isTrue();
    assertThat(abandonedSlow).hasValue(1);
    assertThat(abandonedFast).hasValue(0);
  }

  @Test
  void subBudgetCutsOneCallShorterThanTheOverallBudget() {
    BoundedResults<String> results =
        guard.runBounded(
            List.of(
                BoundedCall.of("dense", () -> sleepThen(200, "d")),
                BoundedCall.of("sparse", () -> sleepThen(2_000, "s"), Duration.ofMillis(50))),
            Duration.ofSeconds(1));

    assertThat(results.outcome("dense").isCompleted()).isTrue();
    assertThat(results.outcome("sparse").isTimedOut()).isTrue();
    assertThat(results.elapsedMillis()).isLessThan(800);
  }

  @Test
  void subBudgetLargerThanBudgetIsCappedByBudget() {
    BoundedResults<String> results =
        guard.runBounded(
            List.of(BoundedCall.of("dense", () -> sleepThen(2_000, "d"), Duration.ofSeconds(5))),
            Duration.ofMillis(100));

    assertThat(results.outcome("dense").isTimedOut()).isTrue();
    assertThat(results.elapsedMillis()).isLessThan(1_000);
  }

  @Test
  void failedCallCarriesItsCause() {
    BoundedResults<String> results =
        guard.runBounded(
            List.of(
                BoundedCall.of(
                    "dense",
                    () -> {
                      throw new IllegalStateException("index offline");
                    })),
            Duration.ofSeconds(1));

    Outcome<String> dense = results.outcome("dense");
    assertThat(dense.isFailed()).isTrue();
    assertThat(dense.error()).isInstanceOf(IllegalStateException.class).hasMessage("index offline");
    assertThat(dense.describe()).isEqualTo("dense: failed (IllegalStateException: index offline)");
    assertThat(results.hasUsableResult()).isFalse();
  }

  @Test
  void circuitOpenRejectionIsRecognisable() {
    BoundedResults<String> results =
        guard.runBounded(
            List.of(
                BoundedCall.of(
                    "dense",
                    () -> {
                      throw new CircuitOpenException("vector-store");
                    })),
            Duration.ofSeconds(1));

    assertThat(results.outcome("dense").isCircuitOpen()).isTrue();
  }

  @Test
  void rejectedSubmissionIsReportedAsFailure() {
    ExecutorService closed = Executors.newSingleThreadExecutor();
    closed.shutdown();
    DeadlineGuard saturated = new DeadlineGuard(closed);

    BoundedResults<String> results =
        saturated.runBounded(List.of(BoundedCall.of("dense", () -> "d")), Duration.ofSeconds(1));

    assertThat(results.outcome("dense").isFailed()).isTrue();
    assertThat(results.outcome("dense").error()).isInstanceOf(RejectedExecutionException.class);
  }

  @Test
  void unknownOutcomeNameThrows() {
    BoundedResults<String> results =
        guard.runBounded(List.of(BoundedCall.of("dense", () -> "d")), Duration.ofSeconds(1));

    assertThatThrownBy(() -> results.outcome("sparse")).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThatThrownBy(
            () -> guard.runBounded(List.of(BoundedCall.of("dense", () -> "d")), Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> guard.deadline(Duration.ofMillis(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void deadlineCountsDown() throws InterruptedException {
    Deadline deadline = guard.deadline(Duration.ofMillis(100));

    assertThat(deadline.isExpired()).isFalse();
    assertThat(deadline.remaining()).isLessThanOrEqualTo(Duration.ofMillis(100));

    Thread.sleep(150);

    assertThat(deadline.isExpired()).isTrue();
    assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
    assertThat(deadline.elapsedMillis()).isGreaterThanOrEqualTo(100);
  }
}
