package dev.medrag.rule;

import dev.medrag.evidence.EvidenceItem;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Result of running the rule path over a query.
 *
 * @param evidence rule evidence, currently always empty
 * @param category first category in table order with a keyword hit
 * @param matchedKeywords every keyword that hit, across all categories, in table order
 * @param emergency true when any emergency keyword hit
 */
public record RuleMatch(
    List<EvidenceItem> evidence,
    @Nullable RuleCategory category,
    List<String> matchedKeywords,
    boolean emergency) {

  public RuleMatch {
    evidence = List.copyOf(evidence);
    matchedKeywords = List.copyOf(matchedKeywords);
  }

  public static RuleMatch none() {
    return new RuleMatch(List.of(), null, List.of(), false);
  }

  public Optional<RuleCategory> matchedCategory() {
    return Optional.ofNullable(category);
  }
}
