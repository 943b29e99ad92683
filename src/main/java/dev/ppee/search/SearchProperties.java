package dev.ppee.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for retrieval and the defaults applied to search requests.
 *
 * <p>Properties are bound from {@code ppee.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code hybrid-threshold} - queries shorter than this many characters use hybrid retrieval
 *       when smart search is on (default 10)
 *   <li>{@code vector-weight} / {@code text-weight} - default hybrid fusion weights (0.5 / 0.5)
 *   <li>{@code text-relevance-floor} - minimum normalised lexical score for a lexical-only
 *       candidate to be labelled {@code text} (default 0.1)
 *   <li>{@code text-search-config} - PostgreSQL text search configuration used for lexical search
 *       (default {@code russian})
 *   <li>{@code default-search-limit} / {@code default-rerank-limit} - request defaults (5 / 20)
 *   <li>{@code llm.*} - defaults for the LLM stage (model, prompt template, temperature, max
 *       tokens)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "ppee.search")
public class SearchProperties {

  static final String DEFAULT_PROMPT_TEMPLATE =
      """
      Ты эксперт по извлечению информации из документов.

      ЗАДАЧА: Найти точное значение для параметра "{query}"

      ИНСТРУКЦИИ:
      1. Внимательно изучи предоставленные фрагменты документов
      2. Найди ТОЧНОЕ значение для запрашиваемого параметра
      3. Если значение встречается несколько раз - выбери наиболее полное и актуальное
      4. В таблицах правильно сопоставляй строки и столбцы
      5. Используй ТОЛЬКО информацию из предоставленных документов

      ФОРМАТ ОТВЕТА:
      - Отвечай СТРОГО в формате: {query}: найденное значение
      - НЕ добавляй пояснения или комментарии
      - Если информация не найдена: {query}: Информация не найдена

      ПАРАМЕТР ДЛЯ ПОИСКА: "{query}"

      ДОКУМЕНТЫ:
      {context}""";

  private int hybridThreshold = 10;
  private double vectorWeight = 0.5;
  private double textWeight = 0.5;
  private double textRelevanceFloor = 0.1;
  private String textSearchConfig = "russian";
  private int defaultSearchLimit = 5;
  private int defaultRerankLimit = 20;
  private Llm llm = new Llm();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (hybridThreshold < 0) {
      throw new IllegalStateException(
          "ppee.search.hybrid-threshold must be >= 0, got: " + hybridThreshold);
    }
    requireUnit("vector-weight", vectorWeight);
    requireUnit("text-weight", textWeight);
    requireUnit("text-relevance-floor", textRelevanceFloor);
    if (textSearchConfig == null || !textSearchConfig.matches("[a-z_]+")) {
      throw new IllegalStateException(
          "ppee.search.text-search-config must be a text search configuration name, got: "
              + textSearchConfig);
    }
    if (defaultSearchLimit < 1 || defaultSearchLimit > SearchConfiguration.MAX_SEARCH_LIMIT) {
      throw new IllegalStateException(
          "ppee.search.default-search-limit must be in [1, 100], got: " + defaultSearchLimit);
    }
    if (defaultRerankLimit < 1) {
      throw new IllegalStateException(
          "ppee.search.default-rerank-limit must be >= 1, got: " + defaultRerankLimit);
    }
    if (llm.getDefaultModel() == null || llm.getDefaultModel().isBlank()) {
      throw new IllegalStateException("ppee.search.llm.default-model must not be blank");
    }
  }

  private static void requireUnit(String name, double value) {
    if (value < 0.0 || value > 1.0) {
      throw new IllegalStateException(
          "ppee.search." + name + " must be in [0.0, 1.0], got: " + value);
    }
  }

  public int getHybridThreshold() {
    return hybridThreshold;
  }

  public void setHybridThreshold(int hybridThreshold) {
    this.hybridThreshold = hybridThreshold;
  }

  public double getVectorWeight() {
    return vectorWeight;
  }

  public void setVectorWeight(double vectorWeight) {
    this.vectorWeight = vectorWeight;
  }

  public double getTextWeight() {
    return textWeight;
  }

  public void setTextWeight(double textWeight) {
    this.textWeight = textWeight;
  }

  public double getTextRelevanceFloor() {
    return textRelevanceFloor;
  }

  public void setTextRelevanceFloor(double textRelevanceFloor) {
    this.textRelevanceFloor = textRelevanceFloor;
  }

  public String getTextSearchConfig() {
    return textSearchConfig;
  }

  public void setTextSearchConfig(String textSearchConfig) {
    this.textSearchConfig = textSearchConfig;
  }

  public int getDefaultSearchLimit() {
    return defaultSearchLimit;
  }

  public void setDefaultSearchLimit(int defaultSearchLimit) {
    this.defaultSearchLimit = defaultSearchLimit;
  }

  public int getDefaultRerankLimit() {
    return defaultRerankLimit;
  }

  public void setDefaultRerankLimit(int defaultRerankLimit) {
    this.defaultRerankLimit = defaultRerankLimit;
  }

  public Llm getLlm() {
    return llm;
  }

  public void setLlm(Llm llm) {
    this.llm = llm;
  }

  /** Defaults for the LLM stage, bound from {@code ppee.search.llm.*}. */
  public static class Llm {

    private String defaultModel = "gemma3:27b";
    private String promptTemplate = DEFAULT_PROMPT_TEMPLATE;
    private double temperature = 0.1;
    private int maxTokens = 1000;

    public String getDefaultModel() {
      return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
      this.defaultModel = defaultModel;
    }

    public String getPromptTemplate() {
      return promptTemplate;
    }

    public void setPromptTemplate(String promptTemplate) {
      this.promptTemplate = promptTemplate;
    }

    public double getTemperature() {
      return temperature;
    }

    public void setTemperature(double temperature) {
      this.temperature = temperature;
    }

    public int getMaxTokens() {
      return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
      this.maxTokens = maxTokens;
    }
  }
}
