package dev.medrag.search.eval;

import java.util.List;

/**
 * Per-question evaluation result.
 *
 * @param question the golden-set question
 * @param optimizedQuery the query the retrieval paths searched with
 * @param retrievedIds ids of the retrieved documents, best first
 * @param metrics metrics at the evaluation depth
 */
public record EvaluationResult(
    String question,
    String optimizedQuery,
    List<String> retrievedIds,
    RetrievalMetrics.MetricsResult metrics) {}
