package dev.medrag.mcp;

import dev.medrag.lexical.LexicalIndexStatus;
import dev.medrag.lexical.LexicalRetriever;
import dev.medrag.search.EvidenceRequest;
import dev.medrag.search.EvidenceResult;
import dev.medrag.search.EvidenceService;
import dev.medrag.search.eval.EvaluationResult;
import dev.medrag.search.eval.EvaluationSummary;
import dev.medrag.search.eval.RetrievalEvaluationService;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing medical evidence retrieval as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Tools: {@code search_medical_evidence}, {@code rebuild_lexical_index}, {@code
 * lexical_index_status}, {@code evaluate_retrieval}.
 *
 * @see EvidenceFormatter
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int MAX_RESULTS_LIMIT = 20;

  private final EvidenceService evidenceService;
  private final LexicalRetriever lexicalRetriever;
  private final RetrievalEvaluationService evaluationService;
  private final EvidenceFormatter formatter;

  public McpToolService(
      EvidenceService evidenceService,
      LexicalRetriever lexicalRetriever,
      RetrievalEvaluationService evaluationService,
      EvidenceFormatter formatter) {
    this.evidenceService = evidenceService;
    this.lexicalRetriever = lexicalRetriever;
    this.evaluationService = evaluationService;
    this.formatter = formatter;
  }

  /** Collects ranked, deduplicated evidence for a consultation question. */
  @Tool(
      name = "search_medical_evidence",
      description =
          "Search the medical knowledge base for evidence relevant to a consultation question. "
              + "Combines semantic, keyword and rule-based retrieval, reranks the results and "
              + "falls back to web search when the knowledge base is not confident.")
  public String searchMedicalEvidence(
      @ToolParam(description = "The patient's question, in Chinese or English") @Nullable
          String question,
      @ToolParam(
              description = "Maximum number of evidence items (1-20, default 3)",
              required = false)
          @Nullable Integer maxResults) {
    try {
      if (question == null || question.isBlank()) {
        return "Error: Question must not be empty. Provide the patient's question.";
      }
      EvidenceResult result =
          evidenceService.collect(
              new EvidenceRequest(question, List.of(), clampMaxResults(maxResults)));

      if (result.evidence().isEmpty()) {
        String empty =
            "No evidence found for '%s' (searched as '%s')."
                .formatted(result.question(), result.optimizedQuery());
        return result.emergency() ? EvidenceFormatter.EMERGENCY_NOTICE + empty : empty;
      }
      return formatter.format(result);
    } catch (Exception e) {
      log.warn("search_medical_evidence failed: {}", e.getMessage());
      return "Error searching medical evidence: " + e.getMessage();
    }
  }

  /** Rebuilds the lexical index from the current knowledge base. */
  @Tool(
      name = "rebuild_lexical_index",
      description =
          "Rebuild the keyword (BM25) index from the current knowledge base. "
              + "Use after documents were added or changed.")
  public String rebuildLexicalIndex() {
    try {
      LexicalIndexStatus status = lexicalRetriever.rebuild();
      if (!status.ready()) {
        return "Lexical index is empty: the knowledge base has no documents.";
      }
      return "Lexical index rebuilt: generation %d, %d documents."
          .formatted(status.generation(), status.documentCount());
    } catch (Exception e) {
      return "Error rebuilding lexical index: " + e.getMessage();
    }
  }

  /** Reports the published lexical index. */
  @Tool(
      name = "lexical_index_status",
      description = "Show the generation, document count and build time of the keyword index.")
  public String lexicalIndexStatus() {
    try {
      LexicalIndexStatus status = lexicalRetriever.status();
      if (!status.ready()) {
        return "Lexical index not built.";
      }
      return "Lexical index generation %d: %d documents, built at %s."
          .formatted(status.generation(), status.documentCount(), status.builtAt());
    } catch (Exception e) {
      return "Error reading lexical index status: " + e.getMessage();
    }
  }

  /** Runs the golden-set retrieval evaluation. */
  @Tool(
      name = "evaluate_retrieval",
      description =
          "Evaluate retrieval quality against the bundled golden set and report recall, "
              + "precision, MRR and hit rate.")
  public String evaluateRetrieval() {
    try {
      EvaluationSummary summary = evaluationService.evaluate();
      StringBuilder sb = new StringBuilder();
      sb.append(
          String.format(
              Locale.ROOT,
              "Evaluated %d questions at depth %d: recall=%.3f, precision=%.3f, mrr=%.3f, "
                  + "hitRate=%.3f%n",
              summary.results().size(),
              summary.depth(),
              summary.meanRecall(),
              summary.meanPrecision(),
              summary.meanMrr(),
              summary.hitRate()));
      for (EvaluationResult result : summary.results()) {
        sb.append(
            String.format(
                Locale.ROOT,
                "- %s -> %s | retrieved %s | recall %.2f, mrr %.2f%n",
                result.question(),
                result.optimizedQuery(),
                result.retrievedIds(),
                result.metrics().recallAtK(),
                result.metrics().mrr()));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error evaluating retrieval: " + e.getMessage();
    }
  }

  private static @Nullable Integer clampMaxResults(@Nullable Integer maxResults) {
    if (maxResults == null) {
      return null;
    }
    return Math.max(1, Math.min(maxResults, MAX_RESULTS_LIMIT));
  }
}
