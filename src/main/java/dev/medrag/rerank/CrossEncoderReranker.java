package dev.medrag.rerank;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.medrag.evidence.EvidenceItem;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Reranks with an in-process ONNX cross-encoder.
 *
 * <p>Every query-candidate pair is scored by the {@link ScoringModel}; candidates are ordered by
 * that score and cut to {@code topK}. The cross-encoder score is recorded under the {@code
 * rerank_score} metadata key while the item's own path score is left as it was. Model failures fall
 * back to score order.
 *
 * @see dev.langchain4j.model.scoring.ScoringModel
 */
@Service
@ConditionalOnProperty(prefix = "medrag.rerank", name = "strategy", havingValue = "cross-encoder")
public class CrossEncoderReranker implements Reranker {

  private static final Logger log = LoggerFactory.getLogger(CrossEncoderReranker.class);

  static final String RERANK_SCORE_KEY = "rerank_score";

  private final ScoringModel scoringModel;

  public CrossEncoderReranker(ScoringModel scoringModel) {
    this.scoringModel = scoringModel;
  }

  @Override
  public List<EvidenceItem> rerank(String query, List<EvidenceItem> items, int topK) {
    if (items.size() <= topK) {
      return items;
    }
    try {
      List<TextSegment> segments = items.stream().map(i -> TextSegment.from(i.content())).toList();
      Response<List<Double>> scores = scoringModel.scoreAll(segments, query);
      List<Double> values = scores.content();
      if (values == null || values.size() != items.size()) {
        log.warn(
            "Cross-encoder returned {} scores for {} candidates", sizeOf(values), items.size());
        return ScoreOrdering.topByScore(items, topK);
      }

      return IntStream.range(0, items.size())
          .boxed()
          .sorted(Comparator.comparingDouble((Integer i) -> values.get(i)).reversed())
          .limit(topK)
          .map(i -> items.get(i).withMetadata(RERANK_SCORE_KEY, values.get(i)))
          .toList();
    } catch (RuntimeException e) {
      log.warn("Cross-encoder rerank failed, falling back to score order: {}", e.getMessage());
      return ScoreOrdering.topByScore(items, topK);
    }
  }

  private static int sizeOf(List<Double> values) {
    return values == null ? 0 : values.size();
  }
}
