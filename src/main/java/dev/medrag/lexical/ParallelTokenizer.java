package dev.medrag.lexical;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tokenizes a whole corpus, fanning out over the bounded tokenizer pool when it pays off.
 *
 * <p>Texts are split into contiguous chunks, each chunk is tokenized on one worker, and the chunk
 * results are joined back in submission order, so the output always lines up with the input.
 * Corpora smaller than the parallel threshold, or a pool with a single worker, are tokenized on the
 * calling thread.
 */
@Component
public class ParallelTokenizer {

  private static final Logger log = LoggerFactory.getLogger(ParallelTokenizer.class);

  /** Chunks submitted per worker; smaller chunks even out uneven document lengths. */
  static final int CHUNKS_PER_WORKER = 4;

  private final TextTokenizer tokenizer;
  private final ThreadPoolExecutor executor;
  private final int parallelThreshold;

  public ParallelTokenizer(
      TextTokenizer tokenizer,
      @Qualifier("tokenizerExecutor") ThreadPoolExecutor executor,
      @Value("${medrag.lexical.parallel-threshold:100}") int parallelThreshold) {
    this.tokenizer = tokenizer;
    this.executor = executor;
    this.parallelThreshold = parallelThreshold;
  }

  /**
   * Tokenizes every text.
   *
   * @param texts texts in corpus order
   * @return one term list per input text, same order
   */
  public List<List<String>> tokenizeAll(List<String> texts) {
    int workers = Math.min(executor.getMaximumPoolSize(), texts.size());
    if (texts.size() < parallelThreshold || workers <= 1) {
      return tokenizeChunk(texts);
    }

    int chunkCount = workers * CHUNKS_PER_WORKER;
    int chunkSize = (texts.size() + chunkCount - 1) / chunkCount;
    List<CompletableFuture<List<List<String>>>> futures = new ArrayList<>();
    for (int start = 0; start < texts.size(); start += chunkSize) {
      List<String> chunk = texts.subList(start, Math.min(start + chunkSize, texts.size()));
      futures.add(CompletableFuture.supplyAsync(() -> tokenizeChunk(chunk), executor));
    }
    log.debug(
        "Tokenizing {} texts in {} chunks on {} workers", texts.size(), futures.size(), workers);

    List<List<String>> result = new ArrayList<>(texts.size());
    for (CompletableFuture<List<List<String>>> future : futures) {
      result.addAll(future.join());
    }
    return result;
  }

  private List<List<String>> tokenizeChunk(List<String> chunk) {
    List<List<String>> tokenized = new ArrayList<>(chunk.size());
    for (String text : chunk) {
      tokenized.add(tokenizer.tokenize(text));
    }
    return tokenized;
  }
}
