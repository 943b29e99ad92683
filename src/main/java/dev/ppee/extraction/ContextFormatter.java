package dev.ppee.extraction;

import dev.ppee.search.RetrievalCandidate;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Formats ranked candidates into the {@code {context}} block of a prompt within a token budget.
 *
 * <p>Uses character-based token estimation (chars / 4). Each candidate is tagged with its position
 * and provenance (document, page, section, content type). Candidates are appended in ranked order
 * until the budget is reached; a candidate that does not fit is cut when enough room remains,
 * and a note tells the model that the context was shortened.
 *
 * <p>The first candidate is always included, truncated at the character level if necessary.
 */
@Component
public class ContextFormatter {

  static final double CHARS_PER_TOKEN = 4.0;

  static final String TRUNCATED_MARKER = "... [сокращено]";

  static final String SHORTENED_NOTE =
      "\nПримечание: документы были сокращены из-за ограничения размера контекста.";

  private static final String SEPARATOR = "-".repeat(40);
  private static final String MISSING = "н/д";
  private static final int MIN_TRUNCATED_CHARS = 100;

  /**
   * Formats candidates to fit within {@code tokenBudget} estimated tokens.
   *
   * @param candidates candidates in ranked order
   * @param tokenBudget maximum number of estimated tokens for the whole block
   * @return the formatted context, empty for no candidates
   */
  public String format(List<RetrievalCandidate> candidates, int tokenBudget) {
    if (candidates == null || candidates.isEmpty()) {
      return "";
    }

    int charBudget = (int) (Math.max(tokenBudget, 0) * CHARS_PER_TOKEN);
    StringBuilder output = new StringBuilder();

    for (int i = 0; i < candidates.size(); i++) {
      RetrievalCandidate candidate = candidates.get(i);
      String header = header(i + 1, candidate);
      String block = header + candidate.text() + "\n" + SEPARATOR + "\n";
      int remaining = charBudget - output.length();

      if (block.length() <= remaining) {
        output.append(block);
        continue;
      }

      int textRoom =
          remaining - header.length() - SEPARATOR.length() - TRUNCATED_MARKER.length() - 2;
      if (i == 0 || textRoom > MIN_TRUNCATED_CHARS) {
        int keep = Math.max(0, Math.min(textRoom, candidate.text().length()));
        output
            .append(header)
            .append(candidate.text(), 0, keep)
            .append(TRUNCATED_MARKER)
            .append('\n')
            .append(SEPARATOR)
            .append('\n');
      }
      output.append(SHORTENED_NOTE);
      break;
    }

    return output.toString();
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String header(int position, RetrievalCandidate candidate) {
    return "Документ %d (id: %s, страница: %s, раздел: %s, тип: %s):\n"
        .formatted(
            position,
            orMissing(candidate.documentId()),
            candidate.pageNumber() != null ? candidate.pageNumber().toString() : MISSING,
            orMissing(candidate.section()),
            orMissing(candidate.contentType()));
  }

  private static String orMissing(String value) {
    return value == null || value.isBlank() ? MISSING : value;
  }
}
