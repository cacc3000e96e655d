package dev.medrag.lexical;

import dev.medrag.evidence.EvidenceItem;
import dev.medrag.evidence.EvidenceOrigin;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Lexical retrieval path: BM25 search over the currently published {@link LexicalIndex}.
 *
 * <p>The index is held in an {@link AtomicReference}. A rebuild constructs the next generation
 * off to the side and publishes it with a single {@code set}; searches read the reference once and
 * keep using that instance, so they never block and never see a partially built index. Rebuilds
 * are serialized by a lock that searches do not take. A failed rebuild keeps the previous
 * generation; an empty corpus unsets the index.
 */
@Service
public class LexicalRetriever {

  private static final Logger log = LoggerFactory.getLogger(LexicalRetriever.class);

  private final AtomicReference<@Nullable LexicalIndex> current = new AtomicReference<>();
  private final AtomicLong generations = new AtomicLong();
  private final ReentrantLock rebuildLock = new ReentrantLock();

  private final LexicalIndexBuilder indexBuilder;
  private final TextTokenizer tokenizer;
  private final boolean buildOnStartup;

  public LexicalRetriever(
      LexicalIndexBuilder indexBuilder,
      TextTokenizer tokenizer,
      @Value("${medrag.lexical.build-on-startup:true}") boolean buildOnStartup) {
    this.indexBuilder = indexBuilder;
    this.tokenizer = tokenizer;
    this.buildOnStartup = buildOnStartup;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void buildOnReady() {
    if (buildOnStartup) {
      rebuild();
    }
  }

  /**
   * Searches the published index.
   *
   * @param query optimized query
   * @param topK maximum number of results
   * @return lexical evidence with positive BM25 scores, best first; empty when the index is unset
   */
  public List<EvidenceItem> search(@Nullable String query, int topK) {
    LexicalIndex index = current.get();
    if (index == null || query == null || query.isBlank() || topK <= 0) {
      return List.of();
    }
    try {
      List<String> queryTokens = tokenizer.tokenize(query);
      List<EvidenceItem> results =
          index.search(queryTokens, topK).stream()
              .map(
                  hit ->
                      new EvidenceItem(
                          EvidenceOrigin.LEXICAL,
                          hit.document().displayText(),
                          hit.score(),
                          hit.document().evidenceMetadata(EvidenceOrigin.LEXICAL)))
              .toList();
      log.debug("Lexical path returned {} results for '{}'", results.size(), query);
      return results;
    } catch (RuntimeException e) {
      log.warn("Lexical search failed for '{}': {}", query, e.getMessage());
      return List.of();
    }
  }

  /**
   * Builds and publishes the next index generation. Concurrent callers wait for the running build
   * and then build again.
   *
   * @return status of the index published after this call
   */
  public LexicalIndexStatus rebuild() {
    rebuildLock.lock();
    try {
      long generation = generations.incrementAndGet();
      Optional<LexicalIndex> built = indexBuilder.build(generation);
      current.set(built.orElse(null));
    } catch (RuntimeException e) {
      log.error("Lexical index rebuild failed, keeping the previous generation", e);
    } finally {
      rebuildLock.unlock();
    }
    return status();
  }

  public LexicalIndexStatus status() {
    return LexicalIndexStatus.of(current.get());
  }

  /** The published index, if any. */
  public Optional<LexicalIndex> currentIndex() {
    return Optional.ofNullable(current.get());
  }
}
