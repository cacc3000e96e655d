package dev.medrag.search.eval;

import java.util.List;

/**
 * Aggregate evaluation summary.
 *
 * @param depth number of evidence items retrieved per question
 * @param meanRecall average recall@depth
 * @param meanPrecision average precision@depth
 * @param meanMrr average reciprocal rank
 * @param hitRate fraction of questions with at least one relevant document retrieved
 * @param results per-question results in golden-set order
 */
public record EvaluationSummary(
    int depth,
    double meanRecall,
    double meanPrecision,
    double meanMrr,
    double hitRate,
    List<EvaluationResult> results) {}
