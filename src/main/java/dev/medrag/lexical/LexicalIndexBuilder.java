package dev.medrag.lexical;

import dev.medrag.corpus.CorpusDocument;
import dev.medrag.corpus.CorpusPage;
import dev.medrag.corpus.CorpusSnapshotProvider;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link LexicalIndex} from a fresh corpus snapshot.
 *
 * <p>The snapshot is read in fixed-size pages until a short or empty page, stopping at the
 * configured document cap. A corpus larger than the cap is truncated with a warning.
 * Tokenization is delegated to {@link ParallelTokenizer}.
 */
@Component
public class LexicalIndexBuilder {

  private static final Logger log = LoggerFactory.getLogger(LexicalIndexBuilder.class);

  private final CorpusSnapshotProvider snapshotProvider;
  private final ParallelTokenizer tokenizer;
  private final Clock clock;
  private final int batchSize;
  private final int maxDocuments;

  public LexicalIndexBuilder(
      CorpusSnapshotProvider snapshotProvider,
      ParallelTokenizer tokenizer,
      Clock clock,
      @Value("${medrag.lexical.batch-size:2000}") int batchSize,
      @Value("${medrag.lexical.max-documents:50000}") int maxDocuments) {
    if (batchSize < 1 || maxDocuments < 1) {
      throw new IllegalStateException(
          "medrag.lexical.batch-size and max-documents must be positive, got: "
              + batchSize
              + ", "
              + maxDocuments);
    }
    this.snapshotProvider = snapshotProvider;
    this.tokenizer = tokenizer;
    this.clock = clock;
    this.batchSize = batchSize;
    this.maxDocuments = maxDocuments;
  }

  /**
   * Reads the snapshot and builds an index.
   *
   * @param generation generation number to stamp on the index
   * @return the index, or empty when the corpus has no documents
   */
  public Optional<LexicalIndex> build(long generation) {
    long start = System.nanoTime();
    List<CorpusDocument> documents = fetchSnapshot();
    if (documents.isEmpty()) {
      log.info("Corpus is empty, lexical index not built");
      return Optional.empty();
    }

    List<String> texts = documents.stream().map(CorpusDocument::content).toList();
    List<List<String>> tokens = tokenizer.tokenizeAll(texts);
    LexicalIndex index = new LexicalIndex(generation, clock.instant(), documents, tokens);

    log.info(
        "Built lexical index generation {} over {} documents in {} ms",
        generation,
        index.size(),
        (System.nanoTime() - start) / 1_000_000);
    return Optional.of(index);
  }

  List<CorpusDocument> fetchSnapshot() {
    List<CorpusDocument> documents = new ArrayList<>();
    boolean exhausted = false;
    int pageIndex = 0;
    while (documents.size() < maxDocuments) {
      CorpusPage page = snapshotProvider.fetchPage(pageIndex, batchSize);
      documents.addAll(page.documents());
      pageIndex++;
      if (page.last() || page.documents().size() < batchSize) {
        exhausted = true;
        break;
      }
    }
    boolean truncated =
        documents.size() > maxDocuments || (!exhausted && hasMoreDocuments(pageIndex));
    if (truncated) {
      log.warn(
          "Corpus exceeds {} documents, lexical index truncated to the first {}",
          maxDocuments,
          maxDocuments);
      return new ArrayList<>(documents.subList(0, maxDocuments));
    }
    return documents;
  }

  // The cap landed on a page boundary; only the next page tells whether anything was left out.
  private boolean hasMoreDocuments(int nextPageIndex) {
    return !snapshotProvider.fetchPage(nextPageIndex, batchSize).documents().isEmpty();
  }
}
