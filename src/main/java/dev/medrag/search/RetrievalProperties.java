package dev.medrag.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the retrieval pipeline.
 *
 * <p>Properties are bound from {@code medrag.retrieval.*} in application.yml.
 *
 * <ul>
 *   <li>{@code top-k-retrieval} - candidates requested from each path (default 10, bounded [1,
 *       100])
 *   <li>{@code top-k-rerank} - evidence items returned after reranking when the request does not
 *       say (default 3, bounded [1, 50])
 *   <li>{@code similarity-threshold} - minimum vector similarity kept by the vector path (default
 *       0.7)
 *   <li>{@code confidence-threshold} - maximum score below which augmentation is requested
 *       (default 0.5)
 *   <li>{@code path-timeout} - per-request deadline shared by the parallel paths (default 10s)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "medrag.retrieval")
public class RetrievalProperties {

  private int topKRetrieval = 10;
  private int topKRerank = 3;
  private double similarityThreshold = 0.7;
  private double confidenceThreshold = 0.5;
  private Duration pathTimeout = Duration.ofSeconds(10);

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (topKRetrieval < 1 || topKRetrieval > 100) {
      throw new IllegalStateException(
          "medrag.retrieval.top-k-retrieval must be in [1, 100], got: " + topKRetrieval);
    }
    if (topKRerank < 1 || topKRerank > 50) {
      throw new IllegalStateException(
          "medrag.retrieval.top-k-rerank must be in [1, 50], got: " + topKRerank);
    }
    if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
      throw new IllegalStateException(
          "medrag.retrieval.similarity-threshold must be in [0.0, 1.0], got: "
              + similarityThreshold);
    }
    if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
      throw new IllegalStateException(
          "medrag.retrieval.confidence-threshold must be in [0.0, 1.0], got: "
              + confidenceThreshold);
    }
    if (pathTimeout == null || pathTimeout.isNegative() || pathTimeout.isZero()) {
      throw new IllegalStateException(
          "medrag.retrieval.path-timeout must be positive, got: " + pathTimeout);
    }
  }

  public int getTopKRetrieval() {
    return topKRetrieval;
  }

  public void setTopKRetrieval(int topKRetrieval) {
    this.topKRetrieval = topKRetrieval;
  }

  public int getTopKRerank() {
    return topKRerank;
  }

  public void setTopKRerank(int topKRerank) {
    this.topKRerank = topKRerank;
  }

  public double getSimilarityThreshold() {
    return similarityThreshold;
  }

  public void setSimilarityThreshold(double similarityThreshold) {
    this.similarityThreshold = similarityThreshold;
  }

  public double getConfidenceThreshold() {
    return confidenceThreshold;
  }

  public void setConfidenceThreshold(double confidenceThreshold) {
    this.confidenceThreshold = confidenceThreshold;
  }

  public Duration getPathTimeout() {
    return pathTimeout;
  }

  public void setPathTimeout(Duration pathTimeout) {
    this.pathTimeout = pathTimeout;
  }
}
