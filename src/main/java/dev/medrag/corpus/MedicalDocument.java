package dev.medrag.corpus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Read-only view of a row in the vector collection.
 *
 * <p>The embedding column belongs to LangChain4j's {@code PgVectorEmbeddingStore} and is not
 * mapped. Rows are written by the ingestion tooling; this service never inserts or updates them.
 *
 * @see MedicalDocumentRepository
 */
@Entity
@Immutable
@Table(name = MedicalDocument.TABLE_NAME)
public class MedicalDocument {

  public static final String TABLE_NAME = "medical_documents";

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  protected MedicalDocument() {
    // JPA requires no-arg constructor
  }

  public MedicalDocument(UUID id, String text, String metadata) {
    this.id = id;
    this.text = text;
    this.metadata = metadata;
  }

  public UUID getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public String getMetadata() {
    return metadata;
  }
}
