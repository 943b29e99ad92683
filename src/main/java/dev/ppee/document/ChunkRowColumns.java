package dev.ppee.document;

/** Column positions of the rows returned by {@link DocumentChunkRepository} native queries. */
public final class ChunkRowColumns {

  public static final int EMBEDDING_ID = 0;
  public static final int TEXT = 1;
  public static final int DOCUMENT_ID = 2;
  public static final int PAGE_NUMBER = 3;
  public static final int SECTION = 4;
  public static final int CONTENT_TYPE = 5;
  public static final int CHUNK_INDEX = 6;
  public static final int RANK = 7;

  private ChunkRowColumns() {}
}
