package dev.ppee.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import dev.ppee.fixture.CandidateBuilder;
import dev.ppee.search.RetrievalCandidate;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContextFormatterTest {

  private final ContextFormatter formatter = new ContextFormatter();

  @Test
  void emptyCandidatesGiveEmptyContext() {
    assertThat(formatter.format(List.of(), 1000)).isEmpty();
  }

  @Test
  void blocksCarryPositionAndProvenance() {
    RetrievalCandidate first =
        new CandidateBuilder().documentId("doc-7").pageNumber(12).section("Устав").build();
    RetrievalCandidate second =
        new CandidateBuilder().chunkId("c2").documentId("").pageNumber(null).section("").build();

    String context = formatter.format(List.of(first, second), 10_000);

    assertThat(context)
        .contains("Документ 1 (id: doc-7, страница: 12, раздел: Устав, тип: text):")
        .contains("Документ 2 (id: н/д, страница: н/д, раздел: н/д, тип: text):")
        .doesNotContain(ContextFormatter.SHORTENED_NOTE);
    assertThat(context.indexOf("Документ 1")).isLessThan(context.indexOf("Документ 2"));
  }

  @Test
  void firstBlockIsTruncatedWhenItDoesNotFit() {
    RetrievalCandidate huge = new CandidateBuilder().text("а".repeat(10_000)).build();

    String context = formatter.format(List.of(huge), 200);

    assertThat(context).contains(ContextFormatter.TRUNCATED_MARKER);
    assertThat(context).endsWith(ContextFormatter.SHORTENED_NOTE);
    assertThat(context.length()).isLessThanOrEqualTo(800 + ContextFormatter.SHORTENED_NOTE.length());
  }

  @Test
  void laterBlockIsDroppedWhenLittleRoomIsLeft() {
    RetrievalCandidate small = new CandidateBuilder().text("короткий текст").build();
    RetrievalCandidate big =
        new CandidateBuilder().chunkId("c2").text("б".repeat(5_000)).build();
    int budgetTokens = (int) Math.ceil((formatter.format(List.of(small), 10_000).length() + 20) / 4.0);

    String context = formatter.format(List.of(small, big), budgetTokens);

    assertThat(context).contains("короткий текст");
    assertThat(context).doesNotContain("Документ 2");
    assertThat(context).endsWith(ContextFormatter.SHORTENED_NOTE);
  }

  @Test
  void tokenEstimateIsCharactersOverFour() {
    assertThat(formatter.estimateTokens("abcdefgh")).isEqualTo(2);
    assertThat(formatter.estimateTokens("abcdefghi")).isEqualTo(3);
  }
}
