package dev.medrag.corpus;

import static org.assertj.core.api.Assertions.assertThat;

import dev.medrag.evidence.EvidenceOrigin;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CorpusDocumentTest {

  @Test
  void displayTextPrefixesTheName() {
    CorpusDocument document =
        new CorpusDocument("med-1", "高烧不退需就医", Map.of(CorpusDocument.NAME_FIELD, "发热"));

    assertThat(document.displayText()).isEqualTo("【发热】\n高烧不退需就医");
  }

  @Test
  void displayTextWithoutNameIsTheContent() {
    assertThat(new CorpusDocument("med-1", "高烧不退需就医").displayText()).isEqualTo("高烧不退需就医");
    assertThat(
            new CorpusDocument("med-1", "内容", Map.of(CorpusDocument.NAME_FIELD, " "))
                .displayText())
        .isEqualTo("内容");
  }

  @Test
  void evidenceMetadataLeadsWithTypeAndId() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("name", "流行性感冒");
    fields.put("cure_department", "呼吸内科");
    CorpusDocument document = new CorpusDocument("med-9", "内容", fields);

    assertThat(document.evidenceMetadata(EvidenceOrigin.LEXICAL).keySet())
        .containsExactly("retrieval_type", "id", "name", "cure_department");
    assertThat(document.evidenceMetadata(EvidenceOrigin.LEXICAL))
        .containsEntry("retrieval_type", "keyword");
  }

  @Test
  void nullFieldValuesAreDropped() {
    Map<String, Object> fields = new HashMap<>();
    fields.put("name", null);
    fields.put("symptoms", "发热");

    assertThat(new CorpusDocument("med-1", "内容", fields).fields()).containsOnlyKeys("symptoms");
  }
}
