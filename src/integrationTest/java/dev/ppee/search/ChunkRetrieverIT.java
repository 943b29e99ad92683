package dev.ppee.search;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.ppee.BaseIntegrationTest;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class ChunkRetrieverIT extends BaseIntegrationTest {

  @Autowired ChunkRetriever chunkRetriever;

  static final String FORM_TEXT =
      "Организационно-правовая форма заказчика: акционерное общество. "
          + "Полное наименование: АО «Северная энергетическая компания».";
  static final String INN_TEXT = "Реквизиты заказчика. ИНН 7701234567, КПП 770101001.";
  static final String CAPACITY_TEXT =
      "Проектная мощность котельной составляет 12 МВт, режим работы круглогодичный.";
  static final String OTHER_APP_TEXT =
      "Организационно-правовая форма подрядчика: общество с ограниченной ответственностью.";

  @BeforeEach
  void seedTestData() {
    seedChunk("app-1", "doc-1", 0, FORM_TEXT);
    seedChunk("app-1", "doc-1", 1, INN_TEXT);
    seedChunk("app-1", "doc-2", 0, CAPACITY_TEXT);
    seedChunk("app-2", "doc-9", 0, OTHER_APP_TEXT);
  }

  @Test
  void vectorSearchStaysInsideApplication() {
    List<RetrievalCandidate> results =
        chunkRetriever.retrieve(
            "app-1", "организационно-правовая форма", RetrievalStrategy.vector(), 10);

    assertThat(results).hasSize(3);
    assertThat(results).extracting(RetrievalCandidate::text).doesNotContain(OTHER_APP_TEXT);
    assertThat(results.get(0).text()).isEqualTo(FORM_TEXT);
    assertThat(results).allMatch(candidate -> candidate.searchType() == SearchType.VECTOR);
  }

  @Test
  void vectorSearchMapsChunkMetadata() {
    RetrievalCandidate top =
        chunkRetriever
            .retrieve("app-1", "ИНН КПП реквизиты", RetrievalStrategy.vector(), 1)
            .get(0);

    assertThat(top.text()).isEqualTo(INN_TEXT);
    assertThat(top.documentId()).isEqualTo("doc-1");
    assertThat(top.pageNumber()).isEqualTo(2);
    assertThat(top.section()).isEqualTo("Раздел 2");
    assertThat(top.contentType()).isEqualTo("text");
    assertThat(top.chunkIndex()).isEqualTo(1);
  }

  @Test
  void hybridSearchUsesRussianFullText() {
    List<RetrievalCandidate> results =
        chunkRetriever.retrieve("app-1", "мощность", RetrievalStrategy.hybrid(0.5, 0.5), 3);

    assertThat(results).isNotEmpty();
    assertThat(results.get(0).text()).isEqualTo(CAPACITY_TEXT);
    assertThat(results.get(0).textScore()).isNotNull();
  }

  @Test
  void fullScanReturnsChunksInDocumentOrder() {
    List<RetrievalCandidate> chunks = chunkRetriever.fullScan("app-1");

    assertThat(chunks)
        .extracting(RetrievalCandidate::text)
        .containsExactly(FORM_TEXT, INN_TEXT, CAPACITY_TEXT);
  }

  @Test
  void fullScanToleratesChunkIndexStoredAsText() {
    seedChunkWithRawIndex("app-3", "", "Приложение без номера.");
    seedChunkWithRawIndex("app-3", "3.0", "Третий фрагмент договора.");
    seedChunkWithRawIndex("app-3", "1", "Первый фрагмент договора.");

    List<RetrievalCandidate> chunks = chunkRetriever.fullScan("app-3");

    assertThat(chunks)
        .extracting(RetrievalCandidate::text)
        .containsExactly(
            "Первый фрагмент договора.", "Третий фрагмент договора.", "Приложение без номера.");
    assertThat(chunks).extracting(RetrievalCandidate::chunkIndex).containsExactly(1, 3, null);
  }

  @Test
  void countChunksCountsOneApplication() {
    assertThat(chunkRetriever.countChunks("app-1")).isEqualTo(3);
    assertThat(chunkRetriever.countChunks("app-2")).isEqualTo(1);
    assertThat(chunkRetriever.countChunks("unknown")).isZero();
  }

  private void seedChunkWithRawIndex(String applicationId, String chunkIndex, String text) {
    Metadata metadata =
        Metadata.from("application_id", applicationId)
            .put("document_id", "doc-raw")
            .put("content_type", "text")
            .put("chunk_index", chunkIndex);
    embeddingStore.add(embed(text), TextSegment.from(text, metadata));
  }
}
