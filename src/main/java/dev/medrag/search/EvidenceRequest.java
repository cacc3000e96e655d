package dev.medrag.search;

import dev.medrag.query.DialogueTurn;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A consultation question to collect evidence for.
 *
 * @param question the user's question as asked (must not be null or blank)
 * @param history prior dialogue turns, oldest first
 * @param topK evidence items to return; null means the configured default (must be >= 1 when set)
 */
public record EvidenceRequest(
    String question, List<DialogueTurn> history, @Nullable Integer topK) {

  /** Compact constructor validating input. */
  public EvidenceRequest {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }
    if (topK != null && topK < 1) {
      throw new IllegalArgumentException("topK must be at least 1");
    }
    history = history == null ? List.of() : List.copyOf(history);
  }

  /** Convenience constructor without history, using the default topK. */
  public EvidenceRequest(String question) {
    this(question, List.of(), null);
  }
}
