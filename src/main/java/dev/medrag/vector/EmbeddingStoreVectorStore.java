package dev.medrag.vector;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.medrag.corpus.CorpusDocument;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * {@link VectorStore} over a LangChain4j {@link EmbeddingStore}.
 *
 * <p>LangChain4j reports cosine relevance {@code r = (2 - d) / 2} rather than the native cosine
 * distance {@code d}, so the distance is recovered as {@code d = 2 - 2r}.
 */
@Component
public class EmbeddingStoreVectorStore implements VectorStore {

  private final EmbeddingStore<TextSegment> embeddingStore;

  public EmbeddingStoreVectorStore(EmbeddingStore<TextSegment> embeddingStore) {
    this.embeddingStore = embeddingStore;
  }

  @Override
  public List<VectorNeighbor> nearestNeighbors(Embedding queryEmbedding, int k) {
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder().queryEmbedding(queryEmbedding).maxResults(k).build();
    return embeddingStore.search(request).matches().stream().map(this::toNeighbor).toList();
  }

  private VectorNeighbor toNeighbor(EmbeddingMatch<TextSegment> match) {
    double distance = Math.max(0.0, 2.0 - 2.0 * match.score());
    return new VectorNeighbor(distance, toDocument(match));
  }

  private static CorpusDocument toDocument(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    if (segment == null) {
      return new CorpusDocument(match.embeddingId(), "");
    }
    Map<String, Object> fields = new LinkedHashMap<>(segment.metadata().toMap());
    Object declaredId = fields.remove("id");
    fields.remove("content");
    String id = declaredId != null ? declaredId.toString() : match.embeddingId();
    return new CorpusDocument(id, segment.text(), fields);
  }
}
