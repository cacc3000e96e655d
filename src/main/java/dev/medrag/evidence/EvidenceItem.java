package dev.medrag.evidence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One piece of retrieved evidence.
 *
 * <p>The score is local to the producing path: cosine-derived similarity for {@link
 * EvidenceOrigin#VECTOR}, raw BM25 for {@link EvidenceOrigin#LEXICAL}, absent for external
 * results. Scores from different origins are not on a common scale.
 *
 * @param origin the path that produced this item
 * @param content display text, also the deduplication key
 * @param score path-local relevance score, or null when the path does not score
 * @param metadata auxiliary fields (document id, name, department, url, ...), insertion-ordered
 */
public record EvidenceItem(
    EvidenceOrigin origin, String content, @Nullable Double score, Map<String, Object> metadata) {

  public EvidenceItem {
    Objects.requireNonNull(origin, "origin");
    Objects.requireNonNull(content, "content");
    metadata = copyOf(metadata);
  }

  public EvidenceItem(EvidenceOrigin origin, String content, @Nullable Double score) {
    this(origin, content, score, Map.of());
  }

  /** Score with a missing value read as {@code 0.0}, used when ordering by score. */
  public double scoreOrZero() {
    return score == null ? 0.0 : score;
  }

  /** Returns a copy of this item with one extra metadata entry. */
  public EvidenceItem withMetadata(String key, Object value) {
    Map<String, Object> extended = new LinkedHashMap<>(metadata);
    extended.put(key, value);
    return new EvidenceItem(origin, content, score, extended);
  }

  private static Map<String, Object> copyOf(@Nullable Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    source.forEach(
        (key, value) -> {
          if (key != null && value != null) {
            copy.put(key, value);
          }
        });
    return Collections.unmodifiableMap(copy);
  }
}
