package dev.medrag.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rule-triggered retrieval path.
 *
 * <p>Classifies the query by plain substring matching against the {@link RuleTable}. The first
 * category in table order with a hit is reported; emergency keywords are flagged whichever
 * category came first. The path does not contribute evidence of its own.
 */
@Service
public class RuleRetriever {

  private static final Logger log = LoggerFactory.getLogger(RuleRetriever.class);

  private final RuleTable ruleTable;

  public RuleRetriever(RuleTable ruleTable) {
    this.ruleTable = ruleTable;
  }

  /**
   * Matches the query against the rule table.
   *
   * @param query optimized query
   * @return the match, {@link RuleMatch#none()} for blank input or no hit
   */
  public RuleMatch match(@Nullable String query) {
    if (query == null || query.isBlank()) {
      return RuleMatch.none();
    }

    RuleCategory first = null;
    boolean emergency = false;
    List<String> matched = new ArrayList<>();
    for (Map.Entry<RuleCategory, List<String>> entry : ruleTable.keywords().entrySet()) {
      for (String keyword : entry.getValue()) {
        if (!query.contains(keyword)) {
          continue;
        }
        matched.add(keyword);
        if (first == null) {
          first = entry.getKey();
        }
        if (entry.getKey() == RuleCategory.EMERGENCY) {
          emergency = true;
        }
      }
    }

    if (first == null) {
      return RuleMatch.none();
    }
    if (emergency) {
      log.warn("Emergency keywords in query '{}': {}", query, matched);
    } else {
      log.debug("Rule path matched {} via {}", first, matched);
    }
    return new RuleMatch(List.of(), first, matched, emergency);
  }
}
