package dev.ppee.checklist;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * One question of a {@link Checklist}, together with the retrieval and LLM settings used to answer
 * it.
 *
 * <p>{@code searchQuery} drives retrieval; {@code llmQuery}, when set, is the question put to the
 * model instead. {@code rerankLimit} null means the default limit, 0 or less means "all chunks".
 *
 * <p>Maps to the {@code checklist_parameters} table managed by Flyway migrations.
 */
@Entity
@Table(name = "checklist_parameters")
public class ChecklistParameter {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "checklist_id", nullable = false)
  private Long checklistId;

  @Column(nullable = false)
  private String name;

  @Column(name = "search_query", nullable = false, columnDefinition = "TEXT")
  private String searchQuery;

  @Column(name = "llm_query", columnDefinition = "TEXT")
  private String llmQuery;

  @Column(name = "order_index", nullable = false)
  private int orderIndex;

  @Column(name = "use_reranker", nullable = false)
  private boolean useReranker;

  @Column(name = "search_limit", nullable = false)
  private int searchLimit = 3;

  @Column(name = "rerank_limit")
  private Integer rerankLimit;

  @Column(name = "use_full_scan", nullable = false)
  private boolean useFullScan;

  @Column(name = "llm_model")
  private String llmModel;

  @Column(name = "llm_prompt_template", columnDefinition = "TEXT")
  private String llmPromptTemplate;

  @Column(name = "llm_temperature")
  private Double llmTemperature;

  @Column(name = "llm_max_tokens")
  private Integer llmMaxTokens;

  protected ChecklistParameter() {
    // JPA requires no-arg constructor
  }

  public ChecklistParameter(Long checklistId, String name, String searchQuery, int orderIndex) {
    this.checklistId = checklistId;
    this.name = name;
    this.searchQuery = searchQuery;
    this.orderIndex = orderIndex;
  }

  public Long getId() {
    return id;
  }

  public Long getChecklistId() {
    return checklistId;
  }

  public String getName() {
    return name;
  }

  public String getSearchQuery() {
    return searchQuery;
  }

  public String getLlmQuery() {
    return llmQuery;
  }

  public void setLlmQuery(String llmQuery) {
    this.llmQuery = llmQuery;
  }

  public int getOrderIndex() {
    return orderIndex;
  }

  public boolean isUseReranker() {
    return useReranker;
  }

  public void setUseReranker(boolean useReranker) {
    this.useReranker = useReranker;
  }

  public int getSearchLimit() {
    return searchLimit;
  }

  public void setSearchLimit(int searchLimit) {
    this.searchLimit = searchLimit;
  }

  public Integer getRerankLimit() {
    return rerankLimit;
  }

  public void setRerankLimit(Integer rerankLimit) {
    this.rerankLimit = rerankLimit;
  }

  public boolean isUseFullScan() {
    return useFullScan;
  }

  public void setUseFullScan(boolean useFullScan) {
    this.useFullScan = useFullScan;
  }

  public String getLlmModel() {
    return llmModel;
  }

  public void setLlmModel(String llmModel) {
    this.llmModel = llmModel;
  }

  public String getLlmPromptTemplate() {
    return llmPromptTemplate;
  }

  public void setLlmPromptTemplate(String llmPromptTemplate) {
    this.llmPromptTemplate = llmPromptTemplate;
  }

  public Double getLlmTemperature() {
    return llmTemperature;
  }

  public void setLlmTemperature(Double llmTemperature) {
    this.llmTemperature = llmTemperature;
  }

  public Integer getLlmMaxTokens() {
    return llmMaxTokens;
  }

  public void setLlmMaxTokens(Integer llmMaxTokens) {
    this.llmMaxTokens = llmMaxTokens;
  }
}
