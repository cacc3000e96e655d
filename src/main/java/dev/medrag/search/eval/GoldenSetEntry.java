package dev.medrag.search.eval;

import java.util.List;

/**
 * A golden-set question with the ids of the knowledge-base documents that answer it.
 *
 * @param question consultation question as a patient would ask it
 * @param relevantIds ids of the relevant documents
 */
public record GoldenSetEntry(String question, List<String> relevantIds) {
  public GoldenSetEntry {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Golden set question must not be blank");
    }
    relevantIds = relevantIds == null ? List.of() : List.copyOf(relevantIds);
  }
}
