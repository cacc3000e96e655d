package dev.medrag.rerank;

import dev.medrag.evidence.EvidenceItem;
import java.util.List;

/**
 * Reorders fused evidence by relevance to the query and cuts it to the display budget.
 *
 * <p>Implementations return the input list itself when it already fits in {@code topK}, and fall
 * back to {@link ScoreOrdering#topByScore} instead of throwing.
 */
public interface Reranker {

  /**
   * Reranks candidates.
   *
   * @param query optimized query
   * @param items fused candidates
   * @param topK display budget
   * @return at most {@code topK} items drawn from {@code items}
   */
  List<EvidenceItem> rerank(String query, List<EvidenceItem> items, int topK);
}
