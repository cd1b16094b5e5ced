package dev.ragservice.resilience;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs independent operations concurrently under a shared wall-clock budget.
 *
 * <p>All calls are submitted to the fan-out executor before any result is awaited, so the total wait
 * is bounded by the budget rather than the sum of the calls. A call still running when its
 * (sub-)deadline passes is cancelled with {@link Future#cancel(boolean) cancel(true)} and its
 * {@link BoundedCall#onAbandon()} hook runs on the awaiting thread. Blocking I/O does not always
 * honour the interrupt, so a call guarded by a {@link BreakerCall} has its breaker outcome settled
 * by that hook rather than by the worker. Timeouts are reported as {@link
 * Outcome.Status#TIMED_OUT}, never thrown.
 */
@Component
public class DeadlineGuard {

  private static final Logger log = LoggerFactory.getLogger(DeadlineGuard.class);

  private final ExecutorService executor;

  public DeadlineGuard(@Qualifier("fanOutExecutor") ExecutorService executor) {
    this.executor = executor;
  }

  /**
   * Runs every call concurrently and collects one outcome per call.
   *
   * <p>Each call may wait at most {@code min(call.subBudget, budget)} from the moment the batch was
   * submitted. A call rejected by the executor is reported as {@link Outcome.Status#FAILED}.
   *
   * @param calls the operations to run, in the order their outcomes are reported
   * @param budget the overall budget
   * @return outcomes in submission order; check {@link BoundedResults#hasUsableResult()}
   */
  public <T> BoundedResults<T> runBounded(List<BoundedCall<T>> calls, Duration budget) {
    if (budget.isNegative() || budget.isZero()) {
      throw new IllegalArgumentException("budget must be positive");
    }
    long start = System.nanoTime();
    List<Future<T>> futures = new ArrayList<>(calls.size());
    for (BoundedCall<T> call : calls) {
      futures.add(submit(call));
    }

    List<Outcome<T>> outcomes = new ArrayList<>(calls.size());
    for (int i = 0; i < calls.size(); i++) {
      BoundedCall<T> call = calls.get(i);
      Duration limit = budget;
      Duration subBudget = call.subBudget();
      if (subBudget != null && subBudget.compareTo(budget) < 0) {
        limit = subBudget;
      }
      outcomes.add(await(call, futures.get(i), start, start + limit.toNanos()));
    }
    return new BoundedResults<>(outcomes, millisSince(start));
  }

  /** Starts a deadline for a stage that consumes a stream rather than a single result. */
  public Deadline deadline(Duration budget) {
    if (budget.isNegative() || budget.isZero()) {
      throw new IllegalArgumentException("budget must be positive");
    }
    return Deadline.after(budget);
  }

  private <T> Future<T> submit(BoundedCall<T> call) {
    try {
      return executor.submit(call.operation());
    } catch (RejectedExecutionException e) {
      log.warn("Fan-out executor rejected call '{}': {}", call.name(), e.getMessage());
      return CompletableFuture.failedFuture(e);
    }
  }

  private <T> Outcome<T> await(
      BoundedCall<T> call, Future<T> future, long start, long deadlineNanos) {
    String name = call.name();
    long remaining = deadlineNanos - System.nanoTime();
    try {
      T value = future.get(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
      return Outcome.completed(name, value, millisSince(start));
    } catch (TimeoutException e) {
      future.cancel(true);
      abandon(call);
      double elapsed = millisSince(start);
      log.debug("Call '{}' cancelled after {}ms", name, Math.round(elapsed));
      return Outcome.timedOut(name, elapsed);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return Outcome.failed(name, cause, millisSince(start));
    } catch (CancellationException e) {
      abandon(call);
      return Outcome.timedOut(name, millisSince(start));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      abandon(call);
      return Outcome.failed(name, e, millisSince(start));
    }
  }

  private static void abandon(BoundedCall<?> call) {
    Runnable hook = call.onAbandon();
    if (hook != null) {
      hook.run();
    }
  }

  private static double millisSince(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }
}
