package dev.medrag.search;

import dev.medrag.augment.AugmentationProvider;
import dev.medrag.evidence.EvidenceItem;
import dev.medrag.gate.ConfidenceDecision;
import dev.medrag.gate.ConfidenceGate;
import dev.medrag.query.QueryOptimizer;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Collects the evidence an answer should be grounded on.
 *
 * <p>Pipeline: optimize the question -> multi-path retrieval -> confidence gate -> external
 * augmentation when the internal evidence is missing or weak. Augmentation results are appended
 * after the internal evidence and never replace it.
 */
@Service
public class EvidenceService {

  private static final Logger log = LoggerFactory.getLogger(EvidenceService.class);

  private final QueryOptimizer queryOptimizer;
  private final RetrievalEngine retrievalEngine;
  private final AugmentationProvider augmentationProvider;
  private final RetrievalProperties properties;
  private final boolean augmentEnabled;

  public EvidenceService(
      QueryOptimizer queryOptimizer,
      RetrievalEngine retrievalEngine,
      AugmentationProvider augmentationProvider,
      RetrievalProperties properties,
      @Value("${medrag.augment.enabled:true}") boolean augmentEnabled) {
    this.queryOptimizer = queryOptimizer;
    this.retrievalEngine = retrievalEngine;
    this.augmentationProvider = augmentationProvider;
    this.properties = properties;
    this.augmentEnabled = augmentEnabled;
  }

  /**
   * Collects evidence for a question.
   *
   * @param request the question, its dialogue history and the display budget
   * @return the evidence and how it was obtained
   */
  public EvidenceResult collect(EvidenceRequest request) {
    int topK = request.topK() != null ? request.topK() : properties.getTopKRerank();
    String optimized = queryOptimizer.optimize(request.question(), request.history());
    if (optimized == null || optimized.isBlank()) {
      optimized = request.question().strip();
    }

    RetrievalOutcome outcome = retrievalEngine.retrieve(optimized, topK);
    ConfidenceDecision decision =
        ConfidenceGate.evaluate(outcome.evidence(), properties.getConfidenceThreshold());

    List<EvidenceItem> evidence = new ArrayList<>(outcome.evidence());
    boolean augmented = false;
    if (decision.needsAugmentation() && augmentEnabled) {
      List<EvidenceItem> external = augment(optimized);
      evidence.addAll(external);
      augmented = !external.isEmpty();
    }

    log.info(
        "Collected {} evidence items (max score {}, augmented={}) for '{}'",
        evidence.size(),
        decision.maxScore(),
        augmented,
        optimized);
    return new EvidenceResult(
        request.question(),
        optimized,
        evidence,
        decision,
        augmented,
        outcome.matchedCategory(),
        outcome.emergency());
  }

  private List<EvidenceItem> augment(String query) {
    try {
      return augmentationProvider.search(query);
    } catch (RuntimeException e) {
      log.warn("Augmentation failed for '{}': {}", query, e.getMessage());
      return List.of();
    }
  }
}
