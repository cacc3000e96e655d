package dev.medrag.corpus;

import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link MedicalDocument} rows. */
public interface MedicalDocumentRepository extends JpaRepository<MedicalDocument, UUID> {

  /** Pages through the collection without issuing a count query. */
  Slice<MedicalDocument> findAllBy(Pageable pageable);
}
