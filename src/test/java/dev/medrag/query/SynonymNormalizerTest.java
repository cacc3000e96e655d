package dev.medrag.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class SynonymNormalizerTest {

  private static SynonymNormalizer normalizer;

  @BeforeAll
  static void loadBundledTable() throws IOException {
    try (InputStream json = new ClassPathResource("medical/synonyms.json").getInputStream()) {
      normalizer = SynonymNormalizer.fromJson(json, new ObjectMapper());
    }
  }

  @Test
  void replacesColloquialTerms() {
    assertThat(normalizer.normalize("我发烧了")).isEqualTo("我发热了");
    assertThat(normalizer.normalize("脑袋疼还拉肚子")).isEqualTo("头痛还腹泻");
  }

  @Test
  void longerPhraseWinsWhenListedFirst() {
    assertThat(normalizer.normalize("恶心想吐")).isEqualTo("恶心 呕吐");
    assertThat(normalizer.normalize("有点想吐")).isEqualTo("有点恶心");
  }

  @Test
  void blankAndNullInputAreReturnedUnchanged() {
    assertThat(normalizer.normalize(null)).isNull();
    assertThat(normalizer.normalize("   ")).isEqualTo("   ");
  }

  @Test
  void identityEntriesAreDropped() {
    Map<String, String> table = new LinkedHashMap<>();
    table.put("咳嗽", "咳嗽");
    table.put("发烧", "发热");

    assertThat(new SynonymNormalizer(table).entries()).containsOnlyKeys("发烧");
  }

  @Test
  void rejectsStandardTermContainingColloquialTerm() {
    Map<String, String> table = new LinkedHashMap<>();
    table.put("头疼", "头痛");
    table.put("痛", "疼痛");

    assertThatThrownBy(() -> new SynonymNormalizer(table))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("idempotent");
  }

  @Test
  void bundledTableHasNoIdentityEntries() {
    normalizer.entries().forEach((k, v) -> assertThat(k).isNotEqualTo(v));
  }
}
