package dev.ragservice.summary;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Finite, non-restartable sequence of generated text fragments.
 *
 * <p>The consumer pulls fragments with a timeout and closes the stream when it stops reading,
 * whether or not the sequence finished; closing tells the producer to stop and drops anything it
 * emits afterwards.
 */
public interface GenerationStream extends AutoCloseable {

  /**
   * Waits for the next fragment.
   *
   * @param timeout how long to wait
   * @return the next fragment, or empty once the sequence has completed normally
   * @throws TimeoutException if no fragment or completion arrived within {@code timeout}
   * @throws InterruptedException if the consumer thread was interrupted while waiting
   * @throws GenerationException if the producer failed
   */
  Optional<String> next(Duration timeout) throws TimeoutException, InterruptedException;

  @Override
  void close();
}
