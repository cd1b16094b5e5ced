package dev.ragservice.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the injectable {@link Clock} and the thread pools used for request fan-out and streamed
 * responses.
 *
 * <p>Both pools hand tasks directly to a thread ({@link SynchronousQueue}) and abort when saturated,
 * so a task is never parked in a queue while its deadline runs out.
 */
@Configuration
public class ConcurrencyConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Pool running the retrieval branches of a search.
   *
   * @param maxThreads upper bound on concurrently running branch calls
   */
  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService fanOutExecutor(
      @Value("${ragservice.executor.max-threads:64}") int maxThreads) {
    return boundedPool("fan-out-", maxThreads);
  }

  /**
   * Pool driving server-sent-event summary streams, one task per open stream.
   *
   * @param maxStreams upper bound on concurrently open summary streams
   */
  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService streamingExecutor(
      @Value("${ragservice.executor.max-streams:32}") int maxStreams) {
    return boundedPool("summary-stream-", maxStreams);
  }

  private static ExecutorService boundedPool(String prefix, int maxThreads) {
    if (maxThreads < 2) {
      throw new IllegalStateException(prefix + " pool needs at least 2 threads, got: " + maxThreads);
    }
    return new ThreadPoolExecutor(
        0,
        maxThreads,
        60L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        daemonThreads(prefix),
        new ThreadPoolExecutor.AbortPolicy());
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
