package dev.medrag.evidence;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges the outputs of the retrieval paths into one deduplicated list.
 *
 * <p>Paths are concatenated in priority order (vector, lexical, rule). An item whose content hash
 * was already seen is dropped, so the first occurrence wins and first-appearance order is kept.
 * Scores are carried through untouched; fusion never compares them across paths.
 *
 * <p>This is a pure, stateless function with no Spring dependencies.
 */
public final class EvidenceFusion {

  private EvidenceFusion() {}

  /**
   * Fuses the three path results in path-priority order.
   *
   * @param vector dense-similarity results
   * @param lexical BM25 results
   * @param rule rule-triggered results
   * @return deduplicated evidence, never larger than the sum of the inputs
   */
  public static List<EvidenceItem> fuse(
      List<EvidenceItem> vector, List<EvidenceItem> lexical, List<EvidenceItem> rule) {
    return fuse(List.of(vector, lexical, rule));
  }

  /** Fuses any number of path results, earlier lists taking priority. */
  public static List<EvidenceItem> fuse(List<List<EvidenceItem>> pathResults) {
    Set<String> seen = new HashSet<>();
    List<EvidenceItem> fused = new ArrayList<>();
    for (List<EvidenceItem> path : pathResults) {
      for (EvidenceItem item : path) {
        if (seen.add(ContentHasher.sha256(item.content()))) {
          fused.add(item);
        }
      }
    }
    return List.copyOf(fused);
  }
}
