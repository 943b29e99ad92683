package dev.ppee.extraction;

import dev.ppee.llm.LlmClient;
import dev.ppee.llm.ModelInfo;
import dev.ppee.search.ChunkRetriever;
import dev.ppee.search.LlmOptions;
import dev.ppee.search.RetrievalCandidate;
import dev.ppee.search.SearchMethod;
import dev.ppee.task.CancellationCheck;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Asks the LLM to extract an answer from retrieved chunks.
 *
 * <p>Pipeline: size the context budget (configured budget, capped by the model's context window
 * when the server reports one) -> format the ranked candidates -> fill the prompt template -> call
 * the model -> parse the answer. When the answer is "not found" and full scan is enabled, every
 * chunk of the application is put in front of the model in document order, batch by batch, until
 * one batch yields an answer or the chunks run out.
 *
 * <p>{@link dev.ppee.llm.LlmUnavailableException} propagates; it is fatal to the task.
 */
@Service
public class ExtractionService {

  private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

  static final String QUERY_PLACEHOLDER = "{query}";
  static final String CONTEXT_PLACEHOLDER = "{context}";

  private final LlmClient llmClient;
  private final ChunkRetriever chunkRetriever;
  private final ContextFormatter contextFormatter;
  private final LlmResponseParser responseParser;
  private final ExtractionProperties properties;

  public ExtractionService(
      LlmClient llmClient,
      ChunkRetriever chunkRetriever,
      ContextFormatter contextFormatter,
      LlmResponseParser responseParser,
      ExtractionProperties properties) {
    this.llmClient = llmClient;
    this.chunkRetriever = chunkRetriever;
    this.contextFormatter = contextFormatter;
    this.responseParser = responseParser;
    this.properties = properties;
  }

  /**
   * Extracts an answer for the request.
   *
   * @param request the query, ranked candidates and LLM options
   * @param cancellation checked between full-scan batches
   * @return the extracted answer with its provenance
   */
  public ExtractionResult extract(ExtractionRequest request, CancellationCheck cancellation) {
    LlmOptions options = request.options();
    String question = options.effectiveQuery(request.query());
    int tokenBudget = contextTokenBudget(options.model());

    ExtractionResult ranked;
    if (request.candidates().isEmpty()) {
      log.debug("No candidates for '{}', skipping the ranked LLM call", question);
      ranked =
          new ExtractionResult(
              LlmResponseParser.NOT_FOUND_VALUE,
              0.0,
              List.of(),
              request.method(),
              0,
              null,
              ParsedAnswer.FORMAT_EMPTY,
              null);
    } else {
      ranked = ask(request.candidates(), question, options, tokenBudget, request.method());
    }

    if (ranked.found() || !request.useFullScan()) {
      return ranked;
    }
    cancellation.throwIfCancelled();
    log.info(
        "No answer for '{}' in ranked results, scanning application {}",
        question,
        request.applicationId());
    return fullScan(request.applicationId(), question, options, tokenBudget, cancellation);
  }

  private ExtractionResult ask(
      List<RetrievalCandidate> candidates,
      String question,
      LlmOptions options,
      int tokenBudget,
      SearchMethod method) {
    String prompt =
        buildPrompt(
            options.promptTemplate(), question, contextFormatter.format(candidates, tokenBudget));
    log.debug(
        "Calling model {} with ~{} prompt tokens",
        options.model(),
        contextFormatter.estimateTokens(prompt));
    String response =
        llmClient.generate(options.model(), prompt, options.temperature(), options.maxTokens());
    ParsedAnswer answer = responseParser.parse(response, question);
    return new ExtractionResult(
        answer.value(),
        answer.confidence(),
        candidates,
        method,
        candidates.size(),
        response,
        answer.format(),
        prompt);
  }

  private ExtractionResult fullScan(
      String applicationId,
      String question,
      LlmOptions options,
      int tokenBudget,
      CancellationCheck cancellation) {
    List<RetrievalCandidate> chunks = chunkRetriever.fullScan(applicationId);
    int batchSize = properties.getFullScanBatchSize();
    int scanned = 0;
    String lastPrompt = null;
    String lastResponse = null;

    for (int start = 0; start < chunks.size(); start += batchSize) {
      cancellation.throwIfCancelled();
      List<RetrievalCandidate> batch =
          chunks.subList(start, Math.min(start + batchSize, chunks.size()));
      lastPrompt =
          buildPrompt(
              options.promptTemplate(), question, contextFormatter.format(batch, tokenBudget));
      lastResponse =
          llmClient.generate(
              options.model(), lastPrompt, options.temperature(), options.maxTokens());
      scanned += batch.size();

      ParsedAnswer answer = responseParser.parse(lastResponse, question);
      if (!answer.notFound()) {
        log.info(
            "Full scan of application {} found an answer after {} of {} chunks",
            applicationId,
            scanned,
            chunks.size());
        return new ExtractionResult(
            answer.value(),
            answer.confidence(),
            chunks,
            SearchMethod.FULL_SCAN,
            scanned,
            lastResponse,
            answer.format(),
            lastPrompt);
      }
    }

    log.info("Full scan of application {} found nothing in {} chunks", applicationId, scanned);
    return new ExtractionResult(
        LlmResponseParser.NOT_FOUND_VALUE,
        0.0,
        chunks,
        SearchMethod.FULL_SCAN,
        scanned,
        lastResponse,
        ParsedAnswer.FORMAT_NOT_FOUND,
        lastPrompt);
  }

  /** Tokens available for the context block. */
  int contextTokenBudget(String model) {
    int budget = properties.getContextTokenBudget();
    Optional<Integer> contextLength = Optional.empty();
    try {
      contextLength = llmClient.modelInfo(model).map(ModelInfo::contextLength);
    } catch (RuntimeException e) {
      log.warn("Could not read context length of model {}: {}", model, e.getMessage());
    }
    if (contextLength.isPresent() && contextLength.get() > 0) {
      budget = Math.min(budget, contextLength.get());
    }
    return Math.max(budget - properties.getReservedPromptTokens(), 0);
  }

  static String buildPrompt(String template, String question, String context) {
    return template.replace(QUERY_PLACEHOLDER, question).replace(CONTEXT_PLACEHOLDER, context);
  }
}
