package dev.medrag.search;

import dev.medrag.evidence.EvidenceItem;
import dev.medrag.rule.RuleCategory;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Result of one multi-path retrieval.
 *
 * @param evidence fused and reranked evidence, at most the requested display budget
 * @param matchedCategory rule category of the query, if any
 * @param emergency true when the query contained an emergency keyword
 * @param candidateCount number of fused candidates before reranking
 */
public record RetrievalOutcome(
    List<EvidenceItem> evidence,
    @Nullable RuleCategory matchedCategory,
    boolean emergency,
    int candidateCount) {

  public RetrievalOutcome {
    evidence = List.copyOf(evidence);
  }

  public static RetrievalOutcome empty() {
    return new RetrievalOutcome(List.of(), null, false, 0);
  }
}
