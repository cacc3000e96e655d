package dev.medrag.evidence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvidenceItemTest {

  @Test
  void metadataIsCopiedAndNullValuesDropped() {
    Map<String, Object> source = new HashMap<>();
    source.put("name", "感冒");
    source.put("cure_way", null);

    EvidenceItem item = new EvidenceItem(EvidenceOrigin.LEXICAL, "content", 1.2, source);
    source.put("late", "value");

    assertThat(item.metadata()).containsOnlyKeys("name");
    assertThatThrownBy(() -> item.metadata().put("x", "y"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void missingScoreReadsAsZero() {
    assertThat(new EvidenceItem(EvidenceOrigin.EXTERNAL, "snippet", null).scoreOrZero())
        .isEqualTo(0.0);
  }

  @Test
  void withMetadataLeavesOriginalUntouched() {
    EvidenceItem item = new EvidenceItem(EvidenceOrigin.VECTOR, "content", 0.8, Map.of("id", "d1"));

    EvidenceItem extended = item.withMetadata("rerank_score", 3.5);

    assertThat(item.metadata()).containsOnlyKeys("id");
    assertThat(extended.metadata()).containsEntry("id", "d1").containsEntry("rerank_score", 3.5);
    assertThat(extended.score()).isEqualTo(0.8);
  }

  @Test
  void rejectsMissingContent() {
    assertThatThrownBy(() -> new EvidenceItem(EvidenceOrigin.RULE, null, null))
        .isInstanceOf(NullPointerException.class);
  }
}
