package dev.medrag.vector;

import dev.langchain4j.data.embedding.Embedding;
import java.util.List;

/** Nearest-neighbor lookup over the embedded knowledge base. */
public interface VectorStore {

  /**
   * Returns up to {@code k} neighbors of the query embedding, closest first.
   *
   * @param queryEmbedding embedding in the same space as the corpus
   * @param k maximum number of neighbors
   * @return neighbors with their native distance
   */
  List<VectorNeighbor> nearestNeighbors(Embedding queryEmbedding, int k);
}
