package dev.medrag.query;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces colloquial medical phrasing with the standard terms used by the knowledge base.
 *
 * <p>Entries are applied as literal substring replacements in table order, one pass each. The
 * table is checked when it is loaded: identity entries are dropped and no standard term may
 * contain a colloquial key, so normalizing an already normalized string changes nothing.
 */
public class SynonymNormalizer {

  private static final Logger log = LoggerFactory.getLogger(SynonymNormalizer.class);

  private final Map<String, String> entries;

  public SynonymNormalizer(Map<String, String> entries) {
    this.entries = Collections.unmodifiableMap(validated(entries));
  }

  /**
   * Reads an ordered JSON object of colloquial-to-standard pairs.
   *
   * @throws IOException if the stream is not a JSON object of strings
   * @throws IllegalStateException if the table is inconsistent
   */
  public static SynonymNormalizer fromJson(InputStream json, ObjectMapper objectMapper)
      throws IOException {
    LinkedHashMap<String, String> entries =
        objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, String>>() {});
    return new SynonymNormalizer(entries);
  }

  /**
   * Applies every table entry in order. Null or blank input is returned unchanged.
   *
   * @param text query text
   * @return normalized text
   */
  public @Nullable String normalize(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return text;
    }
    String result = text;
    for (Map.Entry<String, String> entry : entries.entrySet()) {
      result = result.replace(entry.getKey(), entry.getValue());
    }
    return result;
  }

  public Map<String, String> entries() {
    return entries;
  }

  private static LinkedHashMap<String, String> validated(Map<String, String> source) {
    LinkedHashMap<String, String> kept = new LinkedHashMap<>();
    source.forEach(
        (colloquial, standard) -> {
          if (colloquial == null || colloquial.isBlank()) {
            throw new IllegalStateException("Synonym table contains a blank colloquial term");
          }
          if (standard == null || standard.isBlank()) {
            throw new IllegalStateException("Synonym '" + colloquial + "' maps to a blank term");
          }
          if (colloquial.equals(standard)) {
            log.debug("Dropping identity synonym entry '{}'", colloquial);
            return;
          }
          kept.put(colloquial, standard);
        });

    for (String standard : kept.values()) {
      for (String colloquial : kept.keySet()) {
        if (standard.contains(colloquial)) {
          throw new IllegalStateException(
              "Standard term '"
                  + standard
                  + "' contains colloquial term '"
                  + colloquial
                  + "'; normalization would not be idempotent");
        }
      }
    }
    return kept;
  }
}
