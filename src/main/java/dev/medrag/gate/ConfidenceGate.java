package dev.medrag.gate;

import dev.medrag.evidence.EvidenceItem;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether retrieved evidence is strong enough to answer from.
 *
 * <p>Augmentation is needed when the list is empty, when no item carries a score, or when the
 * highest score is strictly below the threshold. A score equal to the threshold passes. The maximum
 * is taken over raw path-local scores regardless of origin.
 */
public final class ConfidenceGate {

  public static final double DEFAULT_THRESHOLD = 0.5;

  private ConfidenceGate() {}

  public static boolean needsAugmentation(List<EvidenceItem> items, double threshold) {
    return evaluate(items, threshold).needsAugmentation();
  }

  public static ConfidenceDecision evaluate(List<EvidenceItem> items, double threshold) {
    Double max =
        items.stream()
            .map(EvidenceItem::score)
            .filter(Objects::nonNull)
            .max(Double::compare)
            .orElse(null);
    if (max == null) {
      return new ConfidenceDecision(true, null);
    }
    return new ConfidenceDecision(max < threshold, max);
  }
}
