package dev.medrag.mcp;

import dev.medrag.evidence.EvidenceItem;
import dev.medrag.evidence.EvidenceOrigin;
import dev.medrag.search.EvidenceResult;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders collected evidence as text for an MCP client, within a token budget.
 *
 * <p>Token usage is estimated at 1.5 characters per token, a conservative figure for mostly
 * Chinese text. Each item is labelled with its provenance ({@code 【知识库】} for internal paths,
 * {@code 【联网搜索】} for external results) and items are appended until the budget is reached. If
 * even the first item exceeds the budget it is cut at the character level so at least one item is
 * always returned.
 */
@Component
public class EvidenceFormatter {

  static final String KNOWLEDGE_BASE_LABEL = "【知识库】";
  static final String WEB_SEARCH_LABEL = "【联网搜索】";
  static final String CATEGORY_PREFIX = "问题类别: ";
  static final String EMERGENCY_NOTICE =
      "⚠ 问题涉及急症相关内容，如情况紧急请立即拨打 120 或前往最近的急诊就医。\n\n";

  private static final double CHARS_PER_TOKEN = 1.5;

  private final int tokenBudget;

  public EvidenceFormatter(@Value("${medrag.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats a collected result: emergency notice when flagged, the matched rule category, then
   * the evidence items.
   *
   * @param result collected evidence
   * @return formatted text, possibly with only the notice when there is no evidence
   */
  public String format(EvidenceResult result) {
    StringBuilder output = new StringBuilder();
    if (result.emergency()) {
      output.append(EMERGENCY_NOTICE);
    }
    if (result.matchedCategory() != null) {
      output.append(CATEGORY_PREFIX).append(result.matchedCategory().label()).append("\n\n");
    }
    return output.append(formatItems(result.evidence())).toString();
  }

  /**
   * Formats items until the token budget is used up.
   *
   * @param items evidence in display order
   * @return formatted text, empty for no items
   */
  public String formatItems(List<EvidenceItem> items) {
    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;

    for (int i = 0; i < items.size(); i++) {
      String formatted = formatItem(i + 1, items.get(i));
      int itemTokens = estimateTokens(formatted);

      if (i == 0 && itemTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }
      if (estimatedTokens + itemTokens > tokenBudget) {
        break;
      }
      output.append(formatted);
      estimatedTokens += itemTokens;
    }
    return output.toString();
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatItem(int index, EvidenceItem item) {
    StringBuilder header = new StringBuilder();
    header.append("## [").append(index).append("] ");
    if (item.origin() == EvidenceOrigin.EXTERNAL) {
      Object title = item.metadata().getOrDefault("title", "");
      header.append(WEB_SEARCH_LABEL).append(' ').append(title);
    } else {
      header.append(KNOWLEDGE_BASE_LABEL).append(' ').append(item.origin().retrievalType());
    }
    if (item.score() != null) {
      header.append(String.format(Locale.ROOT, " | score: %.3f", item.score()));
    }
    header.append("\n\n").append(item.content()).append('\n');
    Object url = item.metadata().get("url");
    if (url != null && !url.toString().isBlank()) {
      header.append("来源: ").append(url).append('\n');
    }
    return header.append("\n---\n").toString();
  }
}
