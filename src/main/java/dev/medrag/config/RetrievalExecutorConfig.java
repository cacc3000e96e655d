package dev.medrag.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Bounded thread pools for the parallel retrieval paths and for corpus tokenization.
 *
 * <p>Both pools have named threads and a bounded queue. When a queue is full the task is rejected
 * with {@link RejectedExecutionException} rather than run on the caller; callers turn a rejection
 * into an empty path result.
 */
@Configuration
public class RetrievalExecutorConfig {

  private static final Logger log = LoggerFactory.getLogger(RetrievalExecutorConfig.class);

  static final int MAX_TOKENIZER_THREADS = 8;

  /**
   * Pool running the vector, lexical and rule paths of each request.
   *
   * @param threads worker threads
   * @param queueCapacity pending path tasks allowed before rejection
   */
  @Bean(name = "retrievalExecutor", destroyMethod = "shutdown")
  public ThreadPoolExecutor retrievalExecutor(
      @Value("${medrag.executor.retrieval-threads:6}") int threads,
      @Value("${medrag.executor.retrieval-queue-capacity:100}") int queueCapacity) {
    return buildExecutor("retrieval-", threads, queueCapacity);
  }

  /**
   * Pool tokenizing the corpus during lexical index builds.
   *
   * @param threads worker threads; 0 means {@code min(processors - 1, 8)}, at least 1
   */
  @Bean(name = "tokenizerExecutor", destroyMethod = "shutdown")
  public ThreadPoolExecutor tokenizerExecutor(
      @Value("${medrag.executor.tokenizer-threads:0}") int threads) {
    int workers = threads > 0 ? threads : defaultTokenizerThreads();
    return buildExecutor("tokenizer-", workers, Integer.MAX_VALUE);
  }

  static int defaultTokenizerThreads() {
    int processors = Runtime.getRuntime().availableProcessors();
    return Math.max(1, Math.min(processors - 1, MAX_TOKENIZER_THREADS));
  }

  private ThreadPoolExecutor buildExecutor(String prefix, int threads, int queueCapacity) {
    int size = Math.max(1, threads);
    int queue = Math.max(1, queueCapacity);
    ThreadPoolExecutor executor =
        new ThreadPoolExecutor(
            size,
            size,
            30L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(queue),
            new NamedThreadFactory(prefix),
            new LoggingRejectionHandler(prefix));
    executor.allowCoreThreadTimeOut(true);
    log.info("Thread pool '{}' initialized: threads={}, queue={}", prefix, size, queue);
    return executor;
  }

  /** Logs the overload and throws, leaving the fallback decision to the submitter. */
  static final class LoggingRejectionHandler implements RejectedExecutionHandler {
    private final String poolName;

    LoggingRejectionHandler(String poolName) {
      this.poolName = poolName;
    }

    @Override
    public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
      log.warn(
          "Task rejected from pool '{}': active={}, queued={}",
          poolName,
          executor.getActiveCount(),
          executor.getQueue().size());
      throw new RejectedExecutionException("Thread pool '" + poolName + "' is saturated");
    }
  }

  private static final class NamedThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger();

    private NamedThreadFactory(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
