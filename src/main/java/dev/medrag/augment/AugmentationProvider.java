package dev.medrag.augment;

import dev.medrag.evidence.EvidenceItem;
import java.util.List;

/** External evidence source consulted when internal retrieval is not confident. */
public interface AugmentationProvider {

  /**
   * Searches the external source.
   *
   * @param query optimized query
   * @return {@code EXTERNAL} evidence without scores; empty when unavailable
   */
  List<EvidenceItem> search(String query);
}
