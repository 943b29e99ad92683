package dev.ppee.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts a value and a confidence from a free-form LLM answer.
 *
 * <p>Models do not follow the requested answer format reliably, so several conventions are tried
 * in order, first match wins:
 *
 * <ol>
 *   <li>empty answer: not found, confidence 0.0
 *   <li>a not-found phrase anywhere in the answer: not found, confidence 0.1
 *   <li>the whole answer is JSON: {@code value}/{@code result} field (own {@code confidence} or
 *       0.9), a key matching the question (0.85), a single key (0.8), a one-element array (0.8)
 *   <li>a JSON block inside text, fenced or bare
 *   <li>a {@code РЕЗУЛЬТАТ:}/{@code ОТВЕТ:}/{@code ЗНАЧЕНИЕ:} (or English) prefix line (0.9)
 *   <li>{@code key: value} lines: exact question key 0.95, partial 0.85, single colon line 0.75
 *   <li>numbered or bulleted lines mentioning the question (0.85 single, 0.8 joined)
 *   <li>the raw answer with a heuristic confidence
 * </ol>
 *
 * <p>Never throws: anything unparseable ends up as plain text.
 */
@Component
public class LlmResponseParser {

  private static final Logger log = LoggerFactory.getLogger(LlmResponseParser.class);

  public static final String NOT_FOUND_VALUE = "Информация не найдена";

  static final double DEFAULT_JSON_CONFIDENCE = 0.9;

  private static final List<String> NOT_FOUND_PHRASES =
      List.of(
          "информация не найдена",
          "данные не найдены",
          "не удалось найти",
          "отсутствует информация",
          "нет данных",
          "не указан",
          "не определен",
          "информация отсутствует",
          "information not found",
          "no information found",
          "not found in the provided");

  private static final List<String> UNCERTAINTY_PHRASES =
      List.of(
          "возможно",
          "вероятно",
          "может быть",
          "предположительно",
          "не ясно",
          "не уверен",
          "не определено",
          "примерно",
          "около",
          "приблизительно",
          "предполагается",
          "probably",
          "possibly",
          "not sure");

  private static final List<Pattern> JSON_BLOCK_PATTERNS =
      List.of(
          Pattern.compile("```json\\s*(.*?)\\s*```", Pattern.DOTALL),
          Pattern.compile("```\\s*(.*?)\\s*```", Pattern.DOTALL),
          Pattern.compile("(\\{[^{}]*\\})", Pattern.DOTALL),
          Pattern.compile("(\\{.*?\\})", Pattern.DOTALL));

  private static final Pattern RESULT_PREFIX =
      Pattern.compile(
          "(?:РЕЗУЛЬТАТ|ОТВЕТ|ЗНАЧЕНИЕ|RESULT|ANSWER|VALUE)\\s*:\\s*(.+)",
          Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

  private static final List<Pattern> STRUCTURED_PATTERNS =
      List.of(
          Pattern.compile("^\\d+\\.\\s*(.+)$"),
          Pattern.compile("^-\\s*(.+)$"),
          Pattern.compile("^•\\s*(.+)$"),
          Pattern.compile("^\\*\\s*(.+)$"));

  private final ObjectMapper objectMapper;

  public LlmResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses an LLM answer.
   *
   * @param response the raw answer, may be null
   * @param question the question the model was asked, used to match keys
   * @return the extracted answer
   */
  public ParsedAnswer parse(String response, String question) {
    if (response == null || response.isBlank()) {
      return new ParsedAnswer(NOT_FOUND_VALUE, 0.0, ParsedAnswer.FORMAT_EMPTY);
    }
    String trimmed = response.strip();
    String query = question == null ? "" : question.strip();

    if (isNotFound(trimmed)) {
      return new ParsedAnswer(NOT_FOUND_VALUE, 0.1, ParsedAnswer.FORMAT_NOT_FOUND);
    }

    try {
      return parseJson(trimmed, query)
          .or(() -> parseJsonBlock(trimmed, query))
          .or(() -> parseResultPrefix(trimmed))
          .or(() -> parseKeyValue(trimmed, query))
          .or(() -> parseStructured(trimmed, query))
          .orElseGet(() -> new ParsedAnswer(trimmed, heuristicConfidence(trimmed), "plain_text"));
    } catch (RuntimeException e) {
      log.warn("Unexpected failure parsing LLM response, keeping it as plain text", e);
      return new ParsedAnswer(trimmed, heuristicConfidence(trimmed), "plain_text");
    }
  }

  static boolean isNotFound(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    return NOT_FOUND_PHRASES.stream().anyMatch(lower::contains);
  }

  Optional<ParsedAnswer> parseJson(String text, String query) {
    JsonNode root;
    try {
      root = objectMapper.readTree(text);
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
    if (root == null) {
      return Optional.empty();
    }

    if (root.isObject()) {
      for (String field : List.of("value", "result")) {
        JsonNode node = root.get(field);
        if (node != null) {
          return Optional.of(new ParsedAnswer(asText(node), confidenceOf(root), "json"));
        }
      }

      String queryLower = query.toLowerCase(Locale.ROOT);
      Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> entry = fields.next();
        String key = entry.getKey().toLowerCase(Locale.ROOT);
        if (!queryLower.isEmpty() && (queryLower.contains(key) || key.contains(queryLower))) {
          return Optional.of(new ParsedAnswer(asText(entry.getValue()), 0.85, "json"));
        }
      }

      if (root.size() == 1) {
        JsonNode only = root.elements().next();
        return Optional.of(new ParsedAnswer(asText(only), 0.8, "json"));
      }
    } else if (root.isArray() && root.size() == 1) {
      return Optional.of(new ParsedAnswer(asText(root.get(0)), 0.8, "json_array"));
    }
    return Optional.empty();
  }

  private Optional<ParsedAnswer> parseJsonBlock(String text, String query) {
    for (Pattern pattern : JSON_BLOCK_PATTERNS) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        Optional<ParsedAnswer> parsed = parseJson(matcher.group(1), query);
        if (parsed.isPresent()) {
          ParsedAnswer answer = parsed.get();
          return Optional.of(new ParsedAnswer(answer.value(), answer.confidence(), "json_block"));
        }
      }
    }
    return Optional.empty();
  }

  private Optional<ParsedAnswer> parseResultPrefix(String text) {
    Matcher matcher = RESULT_PREFIX.matcher(text);
    if (matcher.find()) {
      return Optional.of(new ParsedAnswer(matcher.group(1).strip(), 0.9, "result_prefix"));
    }
    return Optional.empty();
  }

  private Optional<ParsedAnswer> parseKeyValue(String text, String query) {
    String[] lines = text.split("\n");

    if (!query.isEmpty()) {
      Pattern exact =
          Pattern.compile(
              Pattern.quote(query) + "\\s*:\\s*(.+)",
              Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
      for (String line : lines) {
        Matcher matcher = exact.matcher(line);
        if (matcher.find()) {
          String value = matcher.group(1).strip();
          if (!value.isEmpty() && !isNotFound(value)) {
            return Optional.of(new ParsedAnswer(value, 0.95, "key_value_exact"));
          }
        }
      }
    }

    List<String> queryWords = queryWords(query);
    for (String line : lines) {
      int colon = line.indexOf(':');
      if (colon < 0) {
        continue;
      }
      String key = line.substring(0, colon).strip().toLowerCase(Locale.ROOT);
      String value = line.substring(colon + 1).strip();
      if (!value.isEmpty() && queryWords.stream().anyMatch(key::contains) && !isNotFound(value)) {
        return Optional.of(new ParsedAnswer(value, 0.85, "key_value_partial"));
      }
    }

    List<String> colonLines =
        Arrays.stream(lines).filter(line -> line.contains(":") && !line.isBlank()).toList();
    if (colonLines.size() == 1) {
      String line = colonLines.get(0);
      String value = line.substring(line.indexOf(':') + 1).strip();
      if (!value.isEmpty() && !isNotFound(value)) {
        return Optional.of(new ParsedAnswer(value, 0.75, "key_value_single"));
      }
    }
    return Optional.empty();
  }

  private Optional<ParsedAnswer> parseStructured(String text, String query) {
    List<String> queryWords = queryWords(query);
    List<String> values = new ArrayList<>();

    for (String rawLine : text.split("\n")) {
      String line = rawLine.strip();
      for (Pattern pattern : STRUCTURED_PATTERNS) {
        Matcher matcher = pattern.matcher(line);
        if (matcher.matches()) {
          String value = matcher.group(1).strip();
          String lower = value.toLowerCase(Locale.ROOT);
          if (!value.isEmpty()
              && !isNotFound(value)
              && queryWords.stream().anyMatch(lower::contains)) {
            values.add(value);
            break;
          }
        }
      }
    }

    if (values.isEmpty()) {
      return Optional.empty();
    }
    if (values.size() == 1) {
      return Optional.of(new ParsedAnswer(values.get(0), 0.85, "structured_single"));
    }
    return Optional.of(new ParsedAnswer(String.join("; ", values), 0.8, "structured_multiple"));
  }

  /** Base 0.7, minus 0.1 per hedge, plus 0.1 for a short unhedged answer, clamped to [0.1, 1]. */
  static double heuristicConfidence(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    long hedges = UNCERTAINTY_PHRASES.stream().filter(lower::contains).count();
    double confidence = 0.7 - 0.1 * hedges;
    if (text.length() < 100 && hedges == 0) {
      confidence += 0.1;
    }
    return Math.max(0.1, Math.min(confidence, 1.0));
  }

  private static double confidenceOf(JsonNode root) {
    JsonNode node = root.get("confidence");
    if (node == null || node.isNull()) {
      return DEFAULT_JSON_CONFIDENCE;
    }
    if (node.isNumber()) {
      return node.asDouble();
    }
    return node.asDouble(DEFAULT_JSON_CONFIDENCE);
  }

  private static String asText(JsonNode node) {
    return node.isValueNode() ? node.asText() : node.toString();
  }

  private static List<String> queryWords(String query) {
    if (query.isBlank()) {
      return List.of();
    }
    return Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+"))
        .filter(word -> !word.isEmpty())
        .toList();
  }
}
