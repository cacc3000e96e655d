package dev.medrag.search.eval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.medrag.evidence.EvidenceItem;
import dev.medrag.query.QueryOptimizer;
import dev.medrag.search.RetrievalEngine;
import dev.medrag.search.RetrievalOutcome;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

/**
 * Runs the golden set through query optimization and multi-path retrieval and scores the result.
 *
 * <p>Augmentation is never consulted, so runs are reproducible against a fixed knowledge base.
 * Retrieved evidence is mapped back to documents through the {@code id} metadata key; a question
 * whose retrieval fails counts as an empty retrieval.
 */
@Service
public class RetrievalEvaluationService {

  private static final Logger log = LoggerFactory.getLogger(RetrievalEvaluationService.class);

  private static final String GOLDEN_SET_PATH = "eval/golden-set.json";

  private final QueryOptimizer queryOptimizer;
  private final RetrievalEngine retrievalEngine;
  private final ObjectMapper objectMapper;
  private final int depth;

  public RetrievalEvaluationService(
      QueryOptimizer queryOptimizer,
      RetrievalEngine retrievalEngine,
      ObjectMapper objectMapper,
      @Value("${medrag.eval.depth:5}") int depth) {
    this.queryOptimizer = queryOptimizer;
    this.retrievalEngine = retrievalEngine;
    this.objectMapper = objectMapper;
    this.depth = depth;
  }

  /**
   * Evaluates retrieval over the bundled golden set.
   *
   * @return per-question results and their means
   * @throws IOException if the golden set cannot be read
   */
  public EvaluationSummary evaluate() throws IOException {
    List<GoldenSetEntry> goldenSet = loadGoldenSet();
    log.info("Loaded golden set with {} questions", goldenSet.size());
    return evaluate(goldenSet);
  }

  EvaluationSummary evaluate(List<GoldenSetEntry> goldenSet) {
    List<EvaluationResult> results = new ArrayList<>(goldenSet.size());
    for (GoldenSetEntry entry : goldenSet) {
      results.add(evaluateQuestion(entry));
    }

    EvaluationSummary summary =
        new EvaluationSummary(
            depth,
            avg(results, r -> r.metrics().recallAtK()),
            avg(results, r -> r.metrics().precisionAtK()),
            avg(results, r -> r.metrics().mrr()),
            avg(results, r -> r.metrics().hitRate()),
            results);
    log.info(
        "Evaluation complete: recall@{}={}, precision@{}={}, mrr={}, hitRate={}",
        depth,
        summary.meanRecall(),
        depth,
        summary.meanPrecision(),
        summary.meanMrr(),
        summary.hitRate());
    return summary;
  }

  private List<GoldenSetEntry> loadGoldenSet() throws IOException {
    ClassPathResource resource = new ClassPathResource(GOLDEN_SET_PATH);
    try (InputStream is = resource.getInputStream()) {
      return objectMapper.readValue(is, new TypeReference<List<GoldenSetEntry>>() {});
    }
  }

  private EvaluationResult evaluateQuestion(GoldenSetEntry entry) {
    String optimized =
        Objects.requireNonNullElse(
            queryOptimizer.optimize(entry.question(), List.of()), entry.question());
    List<String> retrievedIds = new ArrayList<>();
    try {
      RetrievalOutcome outcome = retrievalEngine.retrieve(optimized, depth);
      for (EvidenceItem item : outcome.evidence()) {
        Object id = item.metadata().get("id");
        if (id != null) {
          retrievedIds.add(id.toString());
        }
      }
    } catch (RuntimeException e) {
      log.warn("Retrieval failed for golden question '{}': {}", entry.question(), e.getMessage());
    }
    RetrievalMetrics.MetricsResult metrics =
        RetrievalMetrics.computeAll(retrievedIds, new HashSet<>(entry.relevantIds()), depth);
    return new EvaluationResult(entry.question(), optimized, retrievedIds, metrics);
  }

  private static double avg(
      List<EvaluationResult> results, ToDoubleFunction<EvaluationResult> metric) {
    return results.stream().mapToDouble(metric).average().orElse(0.0);
  }
}
