package dev.ragservice.summary;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link GenerationStream} fed by push callbacks.
 *
 * <p>A producer thread calls {@link #emit}, {@link #complete()} and {@link #fail}; a single
 * consumer pulls with {@link #next}. After {@link #close()} producer calls are ignored, the queue is
 * cleared and the close hook runs once.
 */
public class QueueingGenerationStream implements GenerationStream {

  private static final Object COMPLETED = new Object();

  private final BlockingQueue<Object> events = new LinkedBlockingQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final Runnable onClose;
  private boolean finished;

  public QueueingGenerationStream(Runnable onClose) {
    this.onClose = onClose;
  }

  public QueueingGenerationStream() {
    this(() -> {});
  }

  // --- producer side ---

  public void emit(String fragment) {
    if (!closed.get() && fragment != null && !fragment.isEmpty()) {
      events.offer(fragment);
    }
  }

  public void complete() {
    if (!closed.get()) {
      events.offer(COMPLETED);
    }
  }

  public void fail(Throwable error) {
    if (!closed.get()) {
      events.offer(new Failure(error));
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  // --- consumer side ---

  @Override
  public Optional<String> next(Duration timeout) throws TimeoutException, InterruptedException {
    if (closed.get()) {
      throw new IllegalStateException("Generation stream is closed");
    }
    if (finished) {
      return Optional.empty();
    }
    Object event = events.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    if (event == null) {
      throw new TimeoutException("No generated output within " + timeout.toMillis() + "ms");
    }
    if (event == COMPLETED) {
      finished = true;
      return Optional.empty();
    }
    if (event instanceof Failure failure) {
      finished = true;
      throw new GenerationException("Summary generation failed", failure.error());
    }
    return Optional.of((String) event);
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      events.clear();
      onClose.run();
    }
  }

  private record Failure(Throwable error) {}
}
