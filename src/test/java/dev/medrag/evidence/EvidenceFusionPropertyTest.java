package dev.medrag.evidence;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

class EvidenceFusionPropertyTest {

  private static final List<String> CONTENT_POOL =
      List.of("感冒", "发热", "咳嗽", "头痛", "腹泻", "乏力", "【流感】\n高热");

  @Property
  void fusedListNeverGrowsAndNeverRepeatsContent(
      @ForAll("pathResults") List<List<EvidenceItem>> paths) {
    List<EvidenceItem> fused = EvidenceFusion.fuse(paths);

    int total = paths.stream().mapToInt(List::size).sum();
    assertThat(fused).hasSizeLessThanOrEqualTo(total);
    assertThat(fused.stream().map(item -> ContentHasher.sha256(item.content())))
        .doesNotHaveDuplicates();
  }

  @Property
  void firstAppearanceOrderIsKept(@ForAll("pathResults") List<List<EvidenceItem>> paths) {
    Set<String> expected = new LinkedHashSet<>();
    paths.forEach(path -> path.forEach(item -> expected.add(item.content())));

    assertThat(EvidenceFusion.fuse(paths))
        .extracting(EvidenceItem::content)
        .containsExactlyElementsOf(expected);
  }

  @Property
  void survivorComesFromTheHighestPriorityPath(
      @ForAll("pathResults") List<List<EvidenceItem>> paths) {
    for (EvidenceItem survivor : EvidenceFusion.fuse(paths)) {
      EvidenceOrigin firstOrigin =
          paths.stream()
              .flatMap(List::stream)
              .filter(item -> item.content().equals(survivor.content()))
              .findFirst()
              .orElseThrow()
              .origin();
      assertThat(survivor.origin()).isEqualTo(firstOrigin);
    }
  }

  @Provide
  Arbitrary<List<List<EvidenceItem>>> pathResults() {
    return Combinators.combine(
            path(EvidenceOrigin.VECTOR), path(EvidenceOrigin.LEXICAL), path(EvidenceOrigin.RULE))
        .as((vector, lexical, rule) -> List.of(vector, lexical, rule));
  }

  private static Arbitrary<List<EvidenceItem>> path(EvidenceOrigin origin) {
    return Combinators.combine(Arbitraries.of(CONTENT_POOL), Arbitraries.doubles().between(0, 1))
        .as((content, score) -> new EvidenceItem(origin, content, score))
        .list()
        .ofMaxSize(6);
  }
}
