package dev.medrag.corpus;

/**
 * Read-only access to the full knowledge base in a stable order, page by page.
 *
 * <p>Used to build the lexical index. Implementations must return pages in the same order on
 * every call so that document positions are reproducible.
 */
public interface CorpusSnapshotProvider {

  /**
   * Fetches one page of the corpus.
   *
   * @param pageIndex zero-based page number
   * @param pageSize maximum documents per page
   * @return the page; an empty page means the corpus is exhausted
   */
  CorpusPage fetchPage(int pageIndex, int pageSize);
}
