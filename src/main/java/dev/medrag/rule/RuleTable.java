package dev.medrag.rule;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered mapping from {@link RuleCategory} to trigger keywords.
 *
 * <p>Iteration order is the order of the source table and decides which category wins when a
 * query hits several.
 */
public final class RuleTable {

  private final Map<RuleCategory, List<String>> keywords;

  public RuleTable(Map<RuleCategory, List<String>> keywords) {
    Map<RuleCategory, List<String>> copy = new LinkedHashMap<>();
    keywords.forEach(
        (category, list) -> {
          if (category == null) {
            throw new IllegalStateException("Rule table contains an unknown category");
          }
          if (list == null || list.isEmpty()) {
            throw new IllegalStateException("Rule category " + category + " has no keywords");
          }
          for (String keyword : list) {
            if (keyword == null || keyword.isBlank()) {
              throw new IllegalStateException("Rule category " + category + " has a blank keyword");
            }
          }
          copy.put(category, List.copyOf(list));
        });
    this.keywords = Collections.unmodifiableMap(copy);
  }

  /**
   * Reads an ordered JSON object of category name to keyword array.
   *
   * @throws IOException if the stream is not such an object or names an unknown category
   */
  public static RuleTable fromJson(InputStream json, ObjectMapper objectMapper)
      throws IOException {
    LinkedHashMap<RuleCategory, List<String>> keywords =
        objectMapper.readValue(
            json, new TypeReference<LinkedHashMap<RuleCategory, List<String>>>() {});
    return new RuleTable(keywords);
  }

  public Map<RuleCategory, List<String>> keywords() {
    return keywords;
  }
}
