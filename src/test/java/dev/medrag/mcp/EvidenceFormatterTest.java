package dev.medrag.mcp;

import static org.assertj.core.api.Assertions.assertThat;

import dev.medrag.evidence.EvidenceItem;
import dev.medrag.evidence.EvidenceOrigin;
import dev.medrag.gate.ConfidenceDecision;
import dev.medrag.rule.RuleCategory;
import dev.medrag.search.EvidenceResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvidenceFormatterTest {

  private final EvidenceFormatter formatter = new EvidenceFormatter(5000);

  @Test
  void knowledgeBaseItemShowsPathAndScore() {
    EvidenceItem item =
        new EvidenceItem(EvidenceOrigin.LEXICAL, "感冒 发热 咳嗽", 2.34567, Map.of("id", "d1"));

    String output = formatter.formatItems(List.of(item));

    assertThat(output).isEqualTo("## [1] 【知识库】 keyword | score: 2.346\n\n感冒 发热 咳嗽\n\n---\n");
  }

  @Test
  void webItemShowsTitleAndSource() {
    EvidenceItem item =
        new EvidenceItem(
            EvidenceOrigin.EXTERNAL,
            "多喝水，注意休息",
            null,
            Map.of("title", "感冒护理", "url", "https://health.example.cn/cold"));

    String output = formatter.formatItems(List.of(item));

    assertThat(output)
        .startsWith("## [1] 【联网搜索】 感冒护理\n\n")
        .contains("来源: https://health.example.cn/cold\n")
        .doesNotContain("score");
  }

  @Test
  void itemsAreNumberedInOrder() {
    List<EvidenceItem> items =
        List.of(
            new EvidenceItem(EvidenceOrigin.VECTOR, "第一条", 0.9),
            new EvidenceItem(EvidenceOrigin.LEXICAL, "第二条", 1.2));

    String output = formatter.formatItems(items);

    assertThat(output.indexOf("## [1] 【知识库】 vector")).isLessThan(output.indexOf("## [2]"));
  }

  @Test
  void stopsBeforeTheItemThatWouldExceedTheBudget() {
    EvidenceFormatter small = new EvidenceFormatter(60);
    List<EvidenceItem> items =
        List.of(
            new EvidenceItem(EvidenceOrigin.VECTOR, "短内容", 0.9),
            new EvidenceItem(EvidenceOrigin.VECTOR, "长".repeat(200), 0.8));

    String output = small.formatItems(items);

    assertThat(output).contains("短内容").doesNotContain("## [2]");
  }

  @Test
  void oversizedFirstItemIsCutToTheBudget() {
    EvidenceFormatter small = new EvidenceFormatter(20);
    EvidenceItem huge = new EvidenceItem(EvidenceOrigin.VECTOR, "长".repeat(500), 0.9);

    String output = small.formatItems(List.of(huge));

    assertThat(output).hasSize(30).startsWith("## [1]");
  }

  @Test
  void emergencyNoticeComesFirst() {
    EvidenceResult result =
        new EvidenceResult(
            "病人休克了",
            "休克",
            List.of(new EvidenceItem(EvidenceOrigin.VECTOR, "休克的急救处理", 0.9)),
            new ConfidenceDecision(false, 0.9),
            false,
            RuleCategory.EMERGENCY,
            true);

    assertThat(formatter.format(result))
        .startsWith(EvidenceFormatter.EMERGENCY_NOTICE + "问题类别: 紧急\n\n")
        .contains("休克的急救处理");
  }

  @Test
  void unclassifiedQueryHasNoCategoryLine() {
    EvidenceResult result =
        new EvidenceResult(
            "最近睡不好",
            "失眠",
            List.of(new EvidenceItem(EvidenceOrigin.LEXICAL, "失眠的调理", 1.7)),
            new ConfidenceDecision(false, 1.7),
            false,
            null,
            false);

    assertThat(formatter.format(result))
        .startsWith("## [1] 【知识库】 keyword")
        .doesNotContain(EvidenceFormatter.CATEGORY_PREFIX);
  }

  @Test
  void estimatesOneTokenPerOneAndAHalfCharacters() {
    assertThat(formatter.estimateTokens("")).isZero();
    assertThat(formatter.estimateTokens("abc")).isEqualTo(2);
    assertThat(formatter.estimateTokens("abcd")).isEqualTo(3);
  }
}
