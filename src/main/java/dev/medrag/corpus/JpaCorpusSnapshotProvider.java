package dev.medrag.corpus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads the corpus snapshot from the vector collection table, ordered by embedding id.
 *
 * <p>The JSONB metadata is parsed with Jackson. A {@code id} entry in the metadata is used as the
 * document id when present, falling back to the embedding id; the {@code content} entry, if any,
 * is ignored in favor of the embedded text. Rows with unreadable metadata keep their text and lose
 * their auxiliary fields.
 */
@Component
public class JpaCorpusSnapshotProvider implements CorpusSnapshotProvider {

  private static final Logger log = LoggerFactory.getLogger(JpaCorpusSnapshotProvider.class);

  private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE =
      new TypeReference<>() {};

  private final MedicalDocumentRepository repository;
  private final ObjectMapper objectMapper;

  public JpaCorpusSnapshotProvider(
      MedicalDocumentRepository repository, ObjectMapper objectMapper) {
    this.repository = repository;
    this.objectMapper = objectMapper;
  }

  @Override
  @Transactional(readOnly = true)
  public CorpusPage fetchPage(int pageIndex, int pageSize) {
    Slice<MedicalDocument> slice =
        repository.findAllBy(PageRequest.of(pageIndex, pageSize, Sort.by("id")));
    List<CorpusDocument> documents =
        slice.getContent().stream().map(this::toCorpusDocument).toList();
    return new CorpusPage(documents, !slice.hasNext());
  }

  CorpusDocument toCorpusDocument(MedicalDocument row) {
    Map<String, Object> fields = parseMetadata(row);
    Object declaredId = fields.remove("id");
    fields.remove("content");
    String id = declaredId != null ? declaredId.toString() : row.getId().toString();
    String text = row.getText() == null ? "" : row.getText();
    return new CorpusDocument(id, text, fields);
  }

  private Map<String, Object> parseMetadata(MedicalDocument row) {
    if (row.getMetadata() == null || row.getMetadata().isBlank()) {
      return new LinkedHashMap<>();
    }
    try {
      return objectMapper.readValue(row.getMetadata(), METADATA_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable metadata on document {}: {}", row.getId(), e.getOriginalMessage());
      return new LinkedHashMap<>();
    }
  }
}
