package dev.ppee.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.ppee.document.ChunkRowColumns;
import dev.ppee.document.DocumentChunkRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Retrieves candidate chunks of one application: vector search, lexical search, hybrid fusion of
 * the two, and an unscored scan of every chunk.
 *
 * <p>Vector search embeds the query and asks the pgvector store for nearest neighbours filtered by
 * the {@code application_id} metadata key. Lexical search runs {@code ts_rank_cd} over the same
 * table. Hybrid mode over-fetches {@code 2 * limit} from each source and fuses them with {@link
 * HybridScoreFusion}.
 *
 * <p>Any backend failure surfaces as {@link RetrievalUnavailableException}. An empty result is not
 * an error.
 */
@Service
public class ChunkRetriever {

  private static final Logger log = LoggerFactory.getLogger(ChunkRetriever.class);

  static final String APPLICATION_ID = "application_id";
  static final String DOCUMENT_ID = "document_id";
  static final String PAGE_NUMBER = "page_number";
  static final String SECTION = "section";
  static final String CONTENT_TYPE = "content_type";
  static final String CHUNK_INDEX = "chunk_index";

  /** Stable secondary order: insertion order within a document. */
  private static final Comparator<RetrievalCandidate> BY_SCORE_THEN_CHUNK_INDEX =
      Comparator.comparingDouble(RetrievalCandidate::score)
          .reversed()
          .thenComparing(
              RetrievalCandidate::chunkIndex, Comparator.nullsLast(Comparator.naturalOrder()));

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;
  private final DocumentChunkRepository documentChunkRepository;
  private final SearchProperties searchProperties;

  public ChunkRetriever(
      EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingModel embeddingModel,
      DocumentChunkRepository documentChunkRepository,
      SearchProperties searchProperties) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
    this.documentChunkRepository = documentChunkRepository;
    this.searchProperties = searchProperties;
  }

  /**
   * Retrieves up to {@code limit} candidates with the given strategy.
   *
   * @param applicationId the application whose chunks are searched
   * @param query the search query
   * @param strategy vector or hybrid, with fusion weights
   * @param limit maximum number of candidates
   * @return candidates ordered by score descending
   * @throws RetrievalUnavailableException if a backend cannot be queried
   */
  public List<RetrievalCandidate> retrieve(
      String applicationId, String query, RetrievalStrategy strategy, int limit) {
    if (!strategy.isHybrid()) {
      return vectorSearch(applicationId, query, limit);
    }

    int perSource = limit > Integer.MAX_VALUE / 2 ? Integer.MAX_VALUE : limit * 2;
    List<RetrievalCandidate> vectorResults = vectorSearch(applicationId, query, perSource);
    List<RetrievalCandidate> textResults = textSearch(applicationId, query, perSource);

    List<RetrievalCandidate> fused =
        HybridScoreFusion.fuse(
            vectorResults,
            textResults,
            strategy.vectorWeight(),
            strategy.textWeight(),
            searchProperties.getTextRelevanceFloor(),
            limit);
    log.debug(
        "Hybrid retrieval for application {}: {} vector + {} text -> {} fused",
        applicationId,
        vectorResults.size(),
        textResults.size(),
        fused.size());
    return fused;
  }

  /**
   * Nearest-neighbour search scoped to one application. Ties keep chunk order.
   *
   * @return candidates labelled {@code vector}, similarity descending
   */
  List<RetrievalCandidate> vectorSearch(String applicationId, String query, int limit) {
    List<EmbeddingMatch<TextSegment>> matches;
    try {
      Embedding queryEmbedding = embeddingModel.embed(query).content();
      EmbeddingSearchRequest request =
          EmbeddingSearchRequest.builder()
              .queryEmbedding(queryEmbedding)
              .maxResults(limit)
              .filter(metadataKey(APPLICATION_ID).isEqualTo(applicationId))
              .build();
      matches = embeddingStore.search(request).matches();
    } catch (RuntimeException e) {
      throw new RetrievalUnavailableException(
          "Vector search failed for application " + applicationId, e);
    }

    List<RetrievalCandidate> candidates = new ArrayList<>(matches.size());
    for (EmbeddingMatch<TextSegment> match : matches) {
      candidates.add(fromMatch(match));
    }
    candidates.sort(BY_SCORE_THEN_CHUNK_INDEX);
    return candidates;
  }

  /**
   * Full-text search scoped to one application.
   *
   * @return candidates labelled {@code text}, rank descending
   */
  List<RetrievalCandidate> textSearch(String applicationId, String query, int limit) {
    List<Object[]> rows;
    try {
      rows =
          documentChunkRepository.fullTextSearch(
              applicationId, query, searchProperties.getTextSearchConfig(), limit);
    } catch (RuntimeException e) {
      throw new RetrievalUnavailableException(
          "Full-text search failed for application " + applicationId, e);
    }
    return rows.stream().map(row -> fromRow(row, SearchType.TEXT)).toList();
  }

  /**
   * Returns every chunk of the application in document order, unscored.
   *
   * @throws RetrievalUnavailableException if the chunk table cannot be read
   */
  public List<RetrievalCandidate> fullScan(String applicationId) {
    List<Object[]> rows;
    try {
      rows = documentChunkRepository.findAllByApplicationId(applicationId);
    } catch (RuntimeException e) {
      throw new RetrievalUnavailableException(
          "Chunk scan failed for application " + applicationId, e);
    }
    log.debug("Full scan of application {} loaded {} chunks", applicationId, rows.size());
    return rows.stream().map(row -> fromRow(row, SearchType.VECTOR)).toList();
  }

  /**
   * Counts the chunks of an application.
   *
   * @throws RetrievalUnavailableException if the chunk table cannot be read
   */
  public int countChunks(String applicationId) {
    try {
      long count = documentChunkRepository.countByApplicationId(applicationId);
      return (int) Math.min(count, Integer.MAX_VALUE);
    } catch (RuntimeException e) {
      throw new RetrievalUnavailableException(
          "Chunk count failed for application " + applicationId, e);
    }
  }

  static RetrievalCandidate fromMatch(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    Metadata metadata = segment.metadata();
    double score = match.score();
    return new RetrievalCandidate(
        match.embeddingId(),
        stringValue(metadata.toMap().get(DOCUMENT_ID)),
        integerValue(metadata.toMap().get(PAGE_NUMBER)),
        stringValue(metadata.toMap().get(SECTION)),
        segment.text(),
        stringValue(metadata.toMap().get(CONTENT_TYPE)),
        integerValue(metadata.toMap().get(CHUNK_INDEX)),
        score,
        score,
        null,
        null,
        SearchType.VECTOR);
  }

  static RetrievalCandidate fromRow(Object[] row, SearchType searchType) {
    double rank =
        row[ChunkRowColumns.RANK] instanceof Number number ? number.doubleValue() : 0.0;
    return new RetrievalCandidate(
        stringValue(row[ChunkRowColumns.EMBEDDING_ID]),
        stringValue(row[ChunkRowColumns.DOCUMENT_ID]),
        integerValue(row[ChunkRowColumns.PAGE_NUMBER]),
        stringValue(row[ChunkRowColumns.SECTION]),
        stringValue(row[ChunkRowColumns.TEXT]),
        stringValue(row[ChunkRowColumns.CONTENT_TYPE]),
        integerValue(row[ChunkRowColumns.CHUNK_INDEX]),
        rank,
        null,
        searchType == SearchType.TEXT ? rank : null,
        null,
        searchType);
  }

  private static String stringValue(@Nullable Object value) {
    return value == null ? "" : value.toString();
  }

  /** Metadata numbers arrive as JSON numbers or as strings depending on the indexer version. */
  static @Nullable Integer integerValue(@Nullable Object value) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      try {
        return (int) Double.parseDouble(text.trim());
      } catch (NumberFormatException e) {
        log.debug("Ignoring non-numeric metadata value '{}'", text);
      }
    }
    return null;
  }
}
