package dev.medrag.rerank;

import dev.medrag.evidence.EvidenceItem;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Fallback ordering used whenever a model-based rerank is unavailable. */
public final class ScoreOrdering {

  private ScoreOrdering() {}

  /**
   * Orders by descending score, missing scores counting as zero; equal scores keep input order.
   *
   * @return the first {@code topK} items of that order
   */
  public static List<EvidenceItem> topByScore(List<EvidenceItem> items, int topK) {
    List<EvidenceItem> sorted = new ArrayList<>(items);
    sorted.sort(Comparator.comparingDouble(EvidenceItem::scoreOrZero).reversed());
    return List.copyOf(sorted.subList(0, Math.max(0, Math.min(topK, sorted.size()))));
  }
}
