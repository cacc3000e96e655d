package dev.medrag.search;

import dev.medrag.evidence.EvidenceFusion;
import dev.medrag.evidence.EvidenceItem;
import dev.medrag.lexical.LexicalRetriever;
import dev.medrag.rerank.Reranker;
import dev.medrag.rule.RuleMatch;
import dev.medrag.rule.RuleRetriever;
import dev.medrag.vector.VectorRetriever;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Multi-path retrieval: vector, lexical and rule paths in parallel, then fusion and reranking.
 *
 * <p>Pipeline: submit the three paths to the retrieval pool -> await each against one shared
 * deadline -> fuse in path-priority order with content-hash dedup -> rerank down to {@code topK}
 * when more candidates than that survive. A path that is rejected by the pool, fails, or misses
 * the deadline contributes nothing and is cancelled, which interrupts its worker; the request
 * itself never fails because of a path.
 */
@Service
public class RetrievalEngine {

  private static final Logger log = LoggerFactory.getLogger(RetrievalEngine.class);

  private final VectorRetriever vectorRetriever;
  private final LexicalRetriever lexicalRetriever;
  private final RuleRetriever ruleRetriever;
  private final Reranker reranker;
  private final RetrievalProperties properties;
  private final ExecutorService executor;

  public RetrievalEngine(
      VectorRetriever vectorRetriever,
      LexicalRetriever lexicalRetriever,
      RuleRetriever ruleRetriever,
      Reranker reranker,
      RetrievalProperties properties,
      @Qualifier("retrievalExecutor") ExecutorService executor) {
    this.vectorRetriever = vectorRetriever;
    this.lexicalRetriever = lexicalRetriever;
    this.ruleRetriever = ruleRetriever;
    this.reranker = reranker;
    this.properties = properties;
    this.executor = executor;
  }

  /**
   * Retrieves evidence for an optimized query.
   *
   * @param query optimized query
   * @param topK display budget after reranking
   * @return fused, reranked evidence plus the rule classification
   */
  public RetrievalOutcome retrieve(@Nullable String query, int topK) {
    if (query == null || query.isBlank()) {
      return RetrievalOutcome.empty();
    }
    int candidates = properties.getTopKRetrieval();
    double threshold = properties.getSimilarityThreshold();
    long deadline = System.nanoTime() + properties.getPathTimeout().toNanos();

    Future<List<EvidenceItem>> vectorFuture =
        submit("vector", () -> vectorRetriever.search(query, candidates, threshold), List.of());
    Future<List<EvidenceItem>> lexicalFuture =
        submit("lexical", () -> lexicalRetriever.search(query, candidates), List.of());
    Future<RuleMatch> ruleFuture =
        submit("rule", () -> ruleRetriever.match(query), RuleMatch.none());

    List<EvidenceItem> vector = await("vector", vectorFuture, deadline, List.of());
    List<EvidenceItem> lexical = await("lexical", lexicalFuture, deadline, List.of());
    RuleMatch rule = await("rule", ruleFuture, deadline, RuleMatch.none());

    List<EvidenceItem> fused = EvidenceFusion.fuse(vector, lexical, rule.evidence());
    List<EvidenceItem> ranked = reranker.rerank(query, fused, topK);
    log.debug(
        "Retrieved vector={}, lexical={}, rule={}, fused={}, returned={} for '{}'",
        vector.size(),
        lexical.size(),
        rule.evidence().size(),
        fused.size(),
        ranked.size(),
        query);
    return new RetrievalOutcome(ranked, rule.category(), rule.emergency(), fused.size());
  }

  // Plain executor futures: cancel(true) interrupts the worker running an abandoned path.
  private <T> Future<T> submit(String path, Callable<T> task, T fallback) {
    try {
      return executor.submit(task);
    } catch (RejectedExecutionException e) {
      log.warn("Retrieval pool overloaded, skipping {} path: {}", path, e.getMessage());
      return CompletableFuture.completedFuture(fallback);
    }
  }

  private <T> T await(String path, Future<T> future, long deadlineNanos, T fallback) {
    long remaining = deadlineNanos - System.nanoTime();
    if (remaining <= 0 && !future.isDone()) {
      log.warn("Deadline passed before the {} path finished, skipping it", path);
      future.cancel(true);
      return fallback;
    }
    try {
      return future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the {} path", path);
      future.cancel(true);
      return fallback;
    } catch (TimeoutException e) {
      log.warn("{} path timed out after {} ms", path, properties.getPathTimeout().toMillis());
      future.cancel(true);
      return fallback;
    } catch (ExecutionException e) {
      log.warn("{} path failed: {}", path, e.getCause() == null ? e : e.getCause().getMessage());
      return fallback;
    }
  }
}
