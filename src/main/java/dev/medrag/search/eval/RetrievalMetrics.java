package dev.medrag.search.eval;

import java.util.List;
import java.util.Set;

/**
 * Binary-relevance retrieval metrics.
 *
 * <p>All methods are pure functions over the ranked retrieved ids and the set of relevant ids.
 */
public final class RetrievalMetrics {

  private RetrievalMetrics() {}

  /** Result record containing all four metrics computed at once. */
  public record MetricsResult(double recallAtK, double precisionAtK, double mrr, double hitRate) {}

  /** Recall@k: fraction of relevant documents found in top-k results. */
  public static double recallAtK(List<String> retrievedIds, Set<String> relevantIds, int k) {
    if (relevantIds.isEmpty()) {
      return 0.0;
    }
    long found = truncate(retrievedIds, k).stream().filter(relevantIds::contains).count();
    return (double) found / relevantIds.size();
  }

  /** Precision@k: fraction of top-k results that are relevant. */
  public static double precisionAtK(List<String> retrievedIds, Set<String> relevantIds, int k) {
    List<String> topK = truncate(retrievedIds, k);
    if (topK.isEmpty()) {
      return 0.0;
    }
    long found = topK.stream().filter(relevantIds::contains).count();
    return (double) found / topK.size();
  }

  /** MRR: reciprocal rank of the first relevant result (for a single query). */
  public static double mrr(List<String> retrievedIds, Set<String> relevantIds, int k) {
    List<String> topK = truncate(retrievedIds, k);
    for (int i = 0; i < topK.size(); i++) {
      if (relevantIds.contains(topK.get(i))) {
        return 1.0 / (i + 1);
      }
    }
    return 0.0;
  }

  /** Hit Rate: 1.0 if at least one relevant document in top-k, else 0.0. */
  public static double hitRate(List<String> retrievedIds, Set<String> relevantIds, int k) {
    return mrr(retrievedIds, relevantIds, k) > 0.0 ? 1.0 : 0.0;
  }

  /** Computes all four metrics at once. */
  public static MetricsResult computeAll(
      List<String> retrievedIds, Set<String> relevantIds, int k) {
    return new MetricsResult(
        recallAtK(retrievedIds, relevantIds, k),
        precisionAtK(retrievedIds, relevantIds, k),
        mrr(retrievedIds, relevantIds, k),
        hitRate(retrievedIds, relevantIds, k));
  }

  private static List<String> truncate(List<String> ids, int k) {
    return ids.subList(0, Math.max(0, Math.min(k, ids.size())));
  }
}
