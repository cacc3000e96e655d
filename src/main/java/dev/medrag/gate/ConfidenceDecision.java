package dev.medrag.gate;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of the confidence check over a final evidence list.
 *
 * @param needsAugmentation true when an external source should be consulted
 * @param maxScore highest non-null score among the evaluated items, or null if none had a score
 */
public record ConfidenceDecision(boolean needsAugmentation, @Nullable Double maxScore) {}
