package dev.medrag.lexical;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Snapshot of the published lexical index.
 *
 * @param generation generation of the published index, 0 when none was ever published
 * @param documentCount documents in the published index
 * @param builtAt build time of the published index, null when unset
 */
public record LexicalIndexStatus(long generation, int documentCount, @Nullable Instant builtAt) {

  static LexicalIndexStatus of(@Nullable LexicalIndex index) {
    if (index == null) {
      return new LexicalIndexStatus(0, 0, null);
    }
    return new LexicalIndexStatus(index.generation(), index.size(), index.builtAt());
  }

  public boolean ready() {
    return builtAt != null;
  }
}
