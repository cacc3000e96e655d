package dev.medrag.corpus;

import dev.medrag.evidence.EvidenceOrigin;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A knowledge-base entry as seen by the retrieval paths.
 *
 * @param id stable document identifier
 * @param content the indexed text
 * @param fields auxiliary attributes ({@code name}, {@code category_primary}, {@code symptoms},
 *     {@code cure_department}, {@code cure_way}, ...), insertion-ordered
 */
public record CorpusDocument(String id, String content, Map<String, Object> fields) {

  public static final String NAME_FIELD = "name";

  public CorpusDocument {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(content, "content");
    Map<String, Object> copy = new LinkedHashMap<>();
    if (fields != null) {
      fields.forEach(
          (key, value) -> {
            if (key != null && value != null) {
              copy.put(key, value);
            }
          });
    }
    fields = Collections.unmodifiableMap(copy);
  }

  public CorpusDocument(String id, String content) {
    this(id, content, Map.of());
  }

  /** Content prefixed with {@code 【name】} on its own line when the document has a name. */
  public String displayText() {
    Object name = fields.get(NAME_FIELD);
    if (name == null || name.toString().isBlank()) {
      return content;
    }
    return "【" + name + "】\n" + content;
  }

  /** Evidence metadata: retrieval type, document id, then the auxiliary fields. */
  public Map<String, Object> evidenceMetadata(EvidenceOrigin origin) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("retrieval_type", origin.retrievalType());
    metadata.put("id", id);
    metadata.putAll(fields);
    return metadata;
  }
}
