package dev.medrag.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallzhv15q.BgeSmallZhV15QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import dev.medrag.corpus.MedicalDocument;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Configures the model and vector store beans.
 *
 * <p>Embeddings come from the ONNX bge-small-zh-v1.5 quantized model (512 dimensions) running
 * in-process. Query rewriting and reranking use an OpenAI-compatible chat endpoint. The
 * {@link PgVectorEmbeddingStore} opens the existing knowledge-base table and shares the
 * application's HikariCP {@link DataSource}.
 *
 * @see dev.medrag.vector.VectorRetriever
 */
@Configuration
public class ModelConfig {

    static final int EMBEDDING_DIMENSION = 512;

    /**
     * Provides the in-process ONNX embedding model (bge-small-zh-v1.5 quantized, 512 dimensions).
     *
     * @return a ready-to-use embedding model requiring no external API
     */
    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallZhV15QuantizedEmbeddingModel();
    }

    /**
     * Provides the chat model used for query rewriting and LLM reranking.
     *
     * @param baseUrl   OpenAI-compatible API base URL
     * @param apiKey    API key for that endpoint
     * @param modelName chat model name
     * @param timeout   per-call timeout; a timed-out call counts as a failure
     * @return a low-temperature chat model
     */
    @Bean
    public ChatModel chatModel(
            @Value("${medrag.llm.base-url}") String baseUrl,
            @Value("${medrag.llm.api-key}") String apiKey,
            @Value("${medrag.llm.model-name}") String modelName,
            @Value("${medrag.llm.timeout:30s}") Duration timeout) {
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(0.1)
                .timeout(timeout)
                .maxRetries(0)
                .build();
    }

    /**
     * Provides the in-process ONNX cross-encoder used when
     * {@code medrag.rerank.strategy=cross-encoder}.
     *
     * @param modelPath     path to the ONNX model file
     * @param tokenizerPath path to the tokenizer JSON file
     * @return a ready-to-use scoring model for cross-encoder reranking
     */
    @Bean
    @ConditionalOnProperty(
            prefix = "medrag.rerank",
            name = "strategy",
            havingValue = "cross-encoder")
    public ScoringModel scoringModel(
            @Value("${medrag.reranker.model-path}") String modelPath,
            @Value("${medrag.reranker.tokenizer-path}") String tokenizerPath) {
        return new OnnxScoringModel(modelPath, tokenizerPath);
    }

    /**
     * Opens the pgvector knowledge-base table.
     *
     * <p>The table is owned by the ingestion tooling; {@code createTable} and {@code useIndex}
     * are disabled so this service never alters the schema. It is the same table the lexical
     * snapshot reads through {@link MedicalDocument}, so both paths search one corpus.
     *
     * @param dataSource the shared HikariCP data source (no duplicate pool)
     * @return an embedding store backed by pgvector
     */
    @Bean
    public EmbeddingStore<TextSegment> embeddingStore(DataSource dataSource) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table(MedicalDocument.TABLE_NAME)
                .dimension(EMBEDDING_DIMENSION)
                .createTable(false)
                .useIndex(false)
                .build();
    }
}
