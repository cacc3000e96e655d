package dev.medrag.corpus;

import java.util.List;

/**
 * One batch of the corpus snapshot.
 *
 * @param documents documents in stable corpus order
 * @param last true when no further page exists
 */
public record CorpusPage(List<CorpusDocument> documents, boolean last) {
  public CorpusPage {
    documents = documents == null ? List.of() : List.copyOf(documents);
  }
}
