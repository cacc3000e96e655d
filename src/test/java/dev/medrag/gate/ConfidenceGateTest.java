package dev.medrag.gate;

import static org.assertj.core.api.Assertions.assertThat;

import dev.medrag.evidence.EvidenceItem;
import dev.medrag.evidence.EvidenceOrigin;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfidenceGateTest {

  @Test
  void emptyEvidenceNeedsAugmentation() {
    assertThat(ConfidenceGate.needsAugmentation(List.of(), 0.5)).isTrue();
  }

  @Test
  void scoreEqualToThresholdPasses() {
    assertThat(ConfidenceGate.needsAugmentation(List.of(scored(0.5)), 0.5)).isFalse();
  }

  @Test
  void itemsWithoutScoresNeedAugmentation() {
    ConfidenceDecision decision = ConfidenceGate.evaluate(List.of(scored(null)), 0.5);

    assertThat(decision.needsAugmentation()).isTrue();
    assertThat(decision.maxScore()).isNull();
  }

  @Test
  void maximumBelowThresholdNeedsAugmentation() {
    ConfidenceDecision decision =
        ConfidenceGate.evaluate(List.of(scored(0.31), scored(null), scored(0.49)), 0.5);

    assertThat(decision.needsAugmentation()).isTrue();
    assertThat(decision.maxScore()).isEqualTo(0.49);
  }

  @Test
  void oneConfidentItemIsEnough() {
    ConfidenceDecision decision =
        ConfidenceGate.evaluate(
            List.of(scored(0.1), scored(0.91)), ConfidenceGate.DEFAULT_THRESHOLD);

    assertThat(decision.needsAugmentation()).isFalse();
    assertThat(decision.maxScore()).isEqualTo(0.91);
  }

  private static EvidenceItem scored(Double score) {
    return new EvidenceItem(EvidenceOrigin.VECTOR, "content " + score, score);
  }
}
