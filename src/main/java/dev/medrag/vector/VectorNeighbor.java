package dev.medrag.vector;

import dev.medrag.corpus.CorpusDocument;

/**
 * A nearest-neighbor hit from the vector store.
 *
 * @param distance native distance reported by the store, smaller is closer
 * @param document the matched document
 */
public record VectorNeighbor(double distance, CorpusDocument document) {}
