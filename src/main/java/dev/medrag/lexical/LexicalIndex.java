package dev.medrag.lexical;

import dev.medrag.corpus.CorpusDocument;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable Okapi BM25 index over one corpus snapshot.
 *
 * <p>Uses k1 = 1.5, b = 0.75 and the non-negative idf {@code ln(1 + (N - n + 0.5) / (n + 0.5))},
 * so any document sharing a term with the query scores above zero even in a one-document corpus.
 * Instances are never mutated after construction; a rebuild produces a new instance.
 */
public final class LexicalIndex {

  static final double K1 = 1.5;
  static final double B = 0.75;

  private final long generation;
  private final Instant builtAt;
  private final List<CorpusDocument> documents;
  private final List<Map<String, Integer>> termFrequencies;
  private final int[] documentLengths;
  private final Map<String, Double> idf;
  private final double averageDocumentLength;

  /**
   * A document with its BM25 score.
   *
   * @param position zero-based corpus position
   * @param document the scored document
   * @param score BM25 score, always positive in search results
   */
  public record ScoredDocument(int position, CorpusDocument document, double score) {}

  /**
   * Builds the index.
   *
   * @param generation monotonic build number
   * @param builtAt build completion time
   * @param documents corpus in stable order
   * @param tokens one term list per document, same order
   */
  public LexicalIndex(
      long generation, Instant builtAt, List<CorpusDocument> documents, List<List<String>> tokens) {
    if (documents.size() != tokens.size()) {
      throw new IllegalArgumentException(
          "Got " + tokens.size() + " token lists for " + documents.size() + " documents");
    }
    this.generation = generation;
    this.builtAt = builtAt;
    this.documents = List.copyOf(documents);
    this.documentLengths = new int[documents.size()];

    List<Map<String, Integer>> frequencies = new ArrayList<>(documents.size());
    Map<String, Integer> documentFrequencies = new HashMap<>();
    long totalLength = 0;
    for (int i = 0; i < tokens.size(); i++) {
      List<String> docTokens = tokens.get(i);
      Map<String, Integer> tf = new HashMap<>();
      for (String token : docTokens) {
        tf.merge(token, 1, Integer::sum);
      }
      for (String term : tf.keySet()) {
        documentFrequencies.merge(term, 1, Integer::sum);
      }
      frequencies.add(Map.copyOf(tf));
      documentLengths[i] = docTokens.size();
      totalLength += docTokens.size();
    }
    this.termFrequencies = List.copyOf(frequencies);
    this.averageDocumentLength =
        documents.isEmpty() ? 0.0 : (double) totalLength / documents.size();

    int n = documents.size();
    Map<String, Double> weights = new HashMap<>();
    documentFrequencies.forEach(
        (term, df) -> weights.put(term, Math.log(1.0 + (n - df + 0.5) / (df + 0.5))));
    this.idf = Map.copyOf(weights);
  }

  /**
   * Scores every document against the query terms. Repeated query terms count repeatedly.
   *
   * @return one score per document, in corpus order
   */
  public double[] scores(List<String> queryTokens) {
    double[] scores = new double[documents.size()];
    for (String term : queryTokens) {
      Double weight = idf.get(term);
      if (weight == null) {
        continue;
      }
      for (int i = 0; i < scores.length; i++) {
        Integer tf = termFrequencies.get(i).get(term);
        if (tf == null) {
          continue;
        }
        double lengthRatio =
            averageDocumentLength == 0.0 ? 1.0 : documentLengths[i] / averageDocumentLength;
        double norm = K1 * (1.0 - B + B * lengthRatio);
        scores[i] += weight * (tf * (K1 + 1.0)) / (tf + norm);
      }
    }
    return scores;
  }

  /**
   * Returns the best-scoring documents.
   *
   * <p>Only documents with a score strictly above zero are returned, ordered by descending score;
   * equal scores keep corpus order.
   *
   * @param queryTokens tokenized query
   * @param topK maximum number of results
   * @return at most {@code topK} scored documents
   */
  public List<ScoredDocument> search(List<String> queryTokens, int topK) {
    if (topK <= 0 || queryTokens.isEmpty()) {
      return List.of();
    }
    double[] scores = scores(queryTokens);
    List<ScoredDocument> hits = new ArrayList<>();
    for (int i = 0; i < scores.length; i++) {
      if (scores[i] > 0.0) {
        hits.add(new ScoredDocument(i, documents.get(i), scores[i]));
      }
    }
    hits.sort(
        Comparator.comparingDouble(ScoredDocument::score)
            .reversed()
            .thenComparingInt(ScoredDocument::position));
    return List.copyOf(hits.subList(0, Math.min(topK, hits.size())));
  }

  public long generation() {
    return generation;
  }

  public Instant builtAt() {
    return builtAt;
  }

  public int size() {
    return documents.size();
  }

  public CorpusDocument document(int position) {
    return documents.get(position);
  }
}
