package dev.medrag.query;

import dev.langchain4j.model.chat.ChatModel;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Turns a raw consultation question into the string used for retrieval.
 *
 * <p>Two optional stages run in order: an LLM rewrite that keeps the medical facts and resolves
 * references against recent dialogue, then synonym normalization. The rewrite never fails the
 * request; on any model error or empty reply the pre-rewrite text is kept. The optimized string is
 * for retrieval only; answers and caches keep using the original question.
 */
@Service
public class QueryOptimizer {

  private static final Logger log = LoggerFactory.getLogger(QueryOptimizer.class);

  static final String REWRITE_PROMPT =
      """
      你是一个医疗问诊检索助手。请将用户的提问改写成一句「仅包含医学相关关键信息的检索用问句」，用于在医疗知识库中检索。

      要求：
      1. 保留症状、部位、药物、疾病、检查等关键信息；
      2. 若有指代（如「这个药」「上面的症状」），结合上下文替换为具体内容；
      3. 去掉礼貌用语、语气词，输出简短一句，不要解释；
      4. 若问题已清晰且无指代，可稍作同义替换（如「头疼」→「头痛」）以利检索；
      5. 只输出改写后的一句话，不要加引号或前缀。

      %s用户当前问题：%s

      改写后的检索用问句：""";

  private static final String QUOTE_CHARS = "\"'“”‘’「」『』";

  private final ChatModel chatModel;
  private final SynonymNormalizer normalizer;
  private final boolean rewriteEnabled;
  private final boolean normalizeEnabled;
  private final int historyTurns;

  public QueryOptimizer(
      ChatModel chatModel,
      SynonymNormalizer normalizer,
      @Value("${medrag.query.rewrite-enabled:true}") boolean rewriteEnabled,
      @Value("${medrag.query.normalize-enabled:true}") boolean normalizeEnabled,
      @Value("${medrag.query.history-turns:6}") int historyTurns) {
    this.chatModel = chatModel;
    this.normalizer = normalizer;
    this.rewriteEnabled = rewriteEnabled;
    this.normalizeEnabled = normalizeEnabled;
    this.historyTurns = historyTurns;
  }

  /** Optimizes with the configured rewrite and normalize toggles. */
  public @Nullable String optimize(@Nullable String question, List<DialogueTurn> history) {
    return optimize(question, history, rewriteEnabled, normalizeEnabled);
  }

  /**
   * Optimizes a question for retrieval.
   *
   * @param question raw user question; null or blank is returned unchanged
   * @param history prior turns, oldest first; only the most recent ones are used
   * @param rewrite whether to ask the chat model for a retrieval-oriented rewrite
   * @param normalize whether to apply the synonym table afterwards
   * @return the retrieval query, never an exception
   */
  public @Nullable String optimize(
      @Nullable String question, List<DialogueTurn> history, boolean rewrite, boolean normalize) {
    if (question == null || question.isBlank()) {
      return question;
    }
    String query = question.strip();
    if (rewrite) {
      query = rewrite(query, history);
    }
    if (normalize) {
      query = normalizer.normalize(query);
    }
    log.debug("Optimized query '{}' -> '{}'", question, query);
    return query;
  }

  String rewrite(String question, List<DialogueTurn> history) {
    String prompt = REWRITE_PROMPT.formatted(renderHistory(history), question);
    try {
      String reply = chatModel.chat(prompt);
      String rewritten = firstLine(reply);
      if (rewritten.isEmpty()) {
        log.warn("Query rewrite returned no text, keeping the original question");
        return question;
      }
      return rewritten;
    } catch (RuntimeException e) {
      log.warn("Query rewrite failed, keeping the original question: {}", e.getMessage());
      return question;
    }
  }

  private String renderHistory(List<DialogueTurn> history) {
    if (history.isEmpty()) {
      return "";
    }
    List<DialogueTurn> recent =
        history.subList(Math.max(0, history.size() - historyTurns), history.size());
    String rendered =
        recent.stream()
            .filter(DialogueTurn::isRenderable)
            .map(turn -> turn.role() + ": " + turn.content())
            .collect(Collectors.joining("\n"));
    return rendered.isEmpty() ? "" : "最近对话：\n" + rendered + "\n\n";
  }

  private static String firstLine(@Nullable String reply) {
    if (reply == null) {
      return "";
    }
    for (String line : reply.split("\\R")) {
      String stripped = stripQuotes(line.strip());
      if (!stripped.isEmpty()) {
        return stripped;
      }
    }
    return "";
  }

  private static String stripQuotes(String line) {
    int start = 0;
    int end = line.length();
    while (start < end && QUOTE_CHARS.indexOf(line.charAt(start)) >= 0) {
      start++;
    }
    while (end > start && QUOTE_CHARS.indexOf(line.charAt(end - 1)) >= 0) {
      end--;
    }
    return line.substring(start, end).strip();
  }
}
