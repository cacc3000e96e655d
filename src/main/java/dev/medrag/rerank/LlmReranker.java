package dev.medrag.rerank;

import dev.langchain4j.model.chat.ChatModel;
import dev.medrag.evidence.EvidenceItem;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Reranks by asking the chat model which candidates are most relevant.
 *
 * <p>One prompt lists every candidate as {@code [i] <preview>...} and asks for the {@code topK}
 * best indices, comma-separated. The reply is parsed by {@link RerankIndexParser}. An exception,
 * a blank reply or a reply without any usable index falls back to score order.
 */
@Service
@ConditionalOnProperty(
    prefix = "medrag.rerank",
    name = "strategy",
    havingValue = "llm",
    matchIfMissing = true)
public class LlmReranker implements Reranker {

  private static final Logger log = LoggerFactory.getLogger(LlmReranker.class);

  static final String RERANK_PROMPT =
      """
      你是一个医疗问诊助手。用户问题是：%s

      以下是候选知识片段：
      %s

      请根据相关性对这些知识片段排序，返回最相关的%d个片段的序号，用逗号分隔。
      只返回序号，不要其他内容。例如：0,3,5""";

  private final ChatModel chatModel;
  private final int previewChars;

  public LlmReranker(
      ChatModel chatModel, @Value("${medrag.rerank.preview-chars:200}") int previewChars) {
    this.chatModel = chatModel;
    this.previewChars = previewChars;
  }

  @Override
  public List<EvidenceItem> rerank(String query, List<EvidenceItem> items, int topK) {
    if (items.size() <= topK) {
      return items;
    }
    try {
      String reply = chatModel.chat(buildPrompt(query, items, topK));
      List<Integer> indices = RerankIndexParser.parse(reply, items.size(), topK);
      if (indices.isEmpty()) {
        log.warn("Rerank reply had no usable index, falling back to score order: '{}'", reply);
        return ScoreOrdering.topByScore(items, topK);
      }
      log.debug("LLM rerank picked {} of {} candidates: {}", indices.size(), items.size(), indices);
      return indices.stream().map(items::get).toList();
    } catch (RuntimeException e) {
      log.warn("LLM rerank failed, falling back to score order: {}", e.getMessage());
      return ScoreOrdering.topByScore(items, topK);
    }
  }

  String buildPrompt(String query, List<EvidenceItem> items, int topK) {
    StringBuilder candidates = new StringBuilder();
    for (int i = 0; i < items.size(); i++) {
      String content = items.get(i).content();
      String preview =
          content.length() > previewChars ? content.substring(0, previewChars) : content;
      if (i > 0) {
        candidates.append('\n');
      }
      candidates.append('[').append(i).append("] ").append(preview).append("...");
    }
    return RERANK_PROMPT.formatted(query, candidates, topK);
  }
}
