package dev.medrag.search;

import dev.medrag.evidence.EvidenceItem;
import dev.medrag.gate.ConfidenceDecision;
import dev.medrag.rule.RuleCategory;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Evidence collected for one question.
 *
 * @param question the original question, to be used for answering and caching
 * @param optimizedQuery the string the retrieval paths actually searched with
 * @param evidence internal evidence first, followed by any augmentation results
 * @param decision confidence gate outcome over the internal evidence
 * @param augmented true when augmentation added at least one external item
 * @param matchedCategory rule category of the query, if any
 * @param emergency true when the query contained an emergency keyword
 */
public record EvidenceResult(
    String question,
    String optimizedQuery,
    List<EvidenceItem> evidence,
    ConfidenceDecision decision,
    boolean augmented,
    @Nullable RuleCategory matchedCategory,
    boolean emergency) {

  public EvidenceResult {
    evidence = List.copyOf(evidence);
  }
}
