package dev.medrag.search.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.medrag.evidence.EvidenceItem;
import dev.medrag.evidence.EvidenceOrigin;
import dev.medrag.query.QueryOptimizer;
import dev.medrag.search.RetrievalEngine;
import dev.medrag.search.RetrievalOutcome;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetrievalEvaluationServiceTest {

  @Mock QueryOptimizer queryOptimizer;
  @Mock RetrievalEngine retrievalEngine;

  private RetrievalEvaluationService service;

  @BeforeEach
  void setUp() {
    service =
        new RetrievalEvaluationService(queryOptimizer, retrievalEngine, new ObjectMapper(), 3);
  }

  @Test
  void scoresEachQuestionAndAveragesTheMetrics() {
    given(queryOptimizer.optimize("我发烧了", List.of())).willReturn("发热");
    given(queryOptimizer.optimize("头疼吃什么药", List.of())).willReturn("头痛 用药");
    given(retrievalEngine.retrieve("发热", 3)).willReturn(outcome("med-0001", "med-0009"));
    given(retrievalEngine.retrieve("头痛 用药", 3)).willReturn(outcome("med-0007"));

    EvaluationSummary summary =
        service.evaluate(
            List.of(
                new GoldenSetEntry("我发烧了", List.of("med-0001")),
                new GoldenSetEntry("头疼吃什么药", List.of("med-0014"))));

    assertThat(summary.depth()).isEqualTo(3);
    assertThat(summary.results()).hasSize(2);
    EvaluationResult first = summary.results().get(0);
    assertThat(first.optimizedQuery()).isEqualTo("发热");
    assertThat(first.retrievedIds()).containsExactly("med-0001", "med-0009");
    assertThat(first.metrics().mrr()).isEqualTo(1.0);
    assertThat(summary.meanRecall()).isCloseTo(0.5, within(1e-9));
    assertThat(summary.meanPrecision()).isCloseTo(0.25, within(1e-9));
    assertThat(summary.hitRate()).isCloseTo(0.5, within(1e-9));
  }

  @Test
  void failedRetrievalCountsAsEmpty() {
    given(queryOptimizer.optimize(anyString(), anyList())).willReturn("发热");
    given(retrievalEngine.retrieve(anyString(), anyInt()))
        .willThrow(new IllegalStateException("pool closed"));

    EvaluationSummary summary =
        service.evaluate(List.of(new GoldenSetEntry("我发烧了", List.of("med-0001"))));

    assertThat(summary.results().get(0).retrievedIds()).isEmpty();
    assertThat(summary.meanMrr()).isZero();
  }

  @Test
  void evidenceWithoutIdIsSkipped() {
    given(queryOptimizer.optimize(anyString(), anyList())).willReturn("发热");
    EvidenceItem web = new EvidenceItem(EvidenceOrigin.EXTERNAL, "网页", null, Map.of());
    given(retrievalEngine.retrieve(anyString(), anyInt()))
        .willReturn(new RetrievalOutcome(List.of(web, item("med-0001")), null, false, 2));

    EvaluationSummary summary =
        service.evaluate(List.of(new GoldenSetEntry("我发烧了", List.of("med-0001"))));

    assertThat(summary.results().get(0).retrievedIds()).containsExactly("med-0001");
  }

  @Test
  void emptyGoldenSetYieldsZeroMeans() {
    EvaluationSummary summary = service.evaluate(List.of());

    assertThat(summary.results()).isEmpty();
    assertThat(summary.meanRecall()).isZero();
  }

  @Test
  void bundledGoldenSetLoads() throws Exception {
    given(queryOptimizer.optimize(anyString(), anyList())).willAnswer(inv -> inv.getArgument(0));
    given(retrievalEngine.retrieve(anyString(), anyInt())).willReturn(RetrievalOutcome.empty());

    EvaluationSummary summary = service.evaluate();

    assertThat(summary.results()).hasSize(8);
    assertThat(summary.results()).allSatisfy(r -> assertThat(r.question()).isNotBlank());
  }

  private static RetrievalOutcome outcome(String... ids) {
    List<EvidenceItem> items =
        Arrays.stream(ids).map(RetrievalEvaluationServiceTest::item).toList();
    return new RetrievalOutcome(items, null, false, items.size());
  }

  private static EvidenceItem item(String id) {
    return new EvidenceItem(EvidenceOrigin.VECTOR, "内容 " + id, 0.8, Map.of("id", id));
  }
}
