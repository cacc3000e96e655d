package dev.medrag.vector;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.medrag.evidence.EvidenceItem;
import dev.medrag.evidence.EvidenceOrigin;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Dense retrieval path.
 *
 * <p>Embeds the query, asks the {@link VectorStore} for the nearest documents and converts each
 * distance to {@code similarity = 1 / (1 + distance)}. Candidates below the similarity threshold
 * are dropped. Any failure of the embedding model or the store yields an empty result.
 */
@Service
public class VectorRetriever {

  private static final Logger log = LoggerFactory.getLogger(VectorRetriever.class);

  /**
   * Query instruction recommended by the bge-small-zh-v1.5 model card. Prepended to queries only,
   * never to documents.
   */
  static final String BGE_ZH_QUERY_PREFIX = "为这个句子生成表示以用于检索相关文章：";

  private final EmbeddingModel embeddingModel;
  private final VectorStore vectorStore;
  private final String queryPrefix;

  public VectorRetriever(
      EmbeddingModel embeddingModel,
      VectorStore vectorStore,
      @Value("${medrag.vector.query-prefix:" + BGE_ZH_QUERY_PREFIX + "}") String queryPrefix) {
    this.embeddingModel = embeddingModel;
    this.vectorStore = vectorStore;
    this.queryPrefix = queryPrefix;
  }

  /**
   * Searches the vector store.
   *
   * @param query optimized query
   * @param topK maximum neighbors to request
   * @param similarityThreshold minimum similarity to keep, inclusive
   * @return vector evidence ordered by the store, scored by similarity
   */
  public List<EvidenceItem> search(@Nullable String query, int topK, double similarityThreshold) {
    if (query == null || query.isBlank() || topK <= 0) {
      return List.of();
    }
    try {
      Embedding embedding = embeddingModel.embed(queryPrefix + query).content();
      List<VectorNeighbor> neighbors = vectorStore.nearestNeighbors(embedding, topK);

      List<EvidenceItem> results = new ArrayList<>(neighbors.size());
      for (VectorNeighbor neighbor : neighbors) {
        double similarity = similarity(neighbor.distance());
        if (!Double.isFinite(similarity) || similarity < similarityThreshold) {
          continue;
        }
        results.add(
            new EvidenceItem(
                EvidenceOrigin.VECTOR,
                neighbor.document().displayText(),
                similarity,
                neighbor.document().evidenceMetadata(EvidenceOrigin.VECTOR)));
      }
      log.debug(
          "Vector path kept {} of {} neighbors for '{}'", results.size(), neighbors.size(), query);
      return results;
    } catch (RuntimeException e) {
      log.warn("Vector search failed for '{}': {}", query, e.getMessage());
      return List.of();
    }
  }

  static double similarity(double distance) {
    return 1.0 / (1.0 + Math.max(0.0, distance));
  }
}
