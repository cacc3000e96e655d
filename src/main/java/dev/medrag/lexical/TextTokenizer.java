package dev.medrag.lexical;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.cjk.CJKAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Splits Chinese and mixed-script text into index terms.
 *
 * <p>Backed by Lucene's {@link CJKAnalyzer}: runs of Han characters become overlapping bigrams
 * ({@code 我发热了} yields {@code 我发}, {@code 发热}, {@code 热了}), full-width forms are folded and
 * Latin words are lower-cased. The same instance tokenizes documents and queries, which keeps both
 * sides of BM25 in one vocabulary. Lucene analyzers reuse per-thread components, so a single
 * instance is safe to share across tokenizer workers.
 */
@Component
public class TextTokenizer implements AutoCloseable {

  private static final String FIELD = "content";

  private final Analyzer analyzer;

  public TextTokenizer() {
    this(new CJKAnalyzer());
  }

  TextTokenizer(Analyzer analyzer) {
    this.analyzer = analyzer;
  }

  /**
   * Tokenizes one text.
   *
   * @param text input, may be null
   * @return terms in text order; empty for null or blank input
   * @throws UncheckedIOException if the analyzer fails
   */
  public List<String> tokenize(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<String> terms = new ArrayList<>();
    try (TokenStream stream = analyzer.tokenStream(FIELD, text)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      while (stream.incrementToken()) {
        terms.add(term.toString());
      }
      stream.end();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to tokenize text", e);
    }
    return terms;
  }

  @Override
  public void close() {
    analyzer.close();
  }
}
