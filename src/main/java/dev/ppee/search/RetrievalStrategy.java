package dev.ppee.search;

/**
 * The retrieval mode chosen for a query and, for hybrid mode, the fusion weights.
 *
 * @param method vector or hybrid
 * @param vectorWeight weight of the vector component in hybrid fusion
 * @param textWeight weight of the lexical component in hybrid fusion
 */
public record RetrievalStrategy(SearchMethod method, double vectorWeight, double textWeight) {

  public RetrievalStrategy {
    if (method == SearchMethod.FULL_SCAN) {
      throw new IllegalArgumentException("Full scan is not a retrieval strategy");
    }
  }

  public static RetrievalStrategy vector() {
    return new RetrievalStrategy(SearchMethod.VECTOR, 1.0, 0.0);
  }

  public static RetrievalStrategy hybrid(double vectorWeight, double textWeight) {
    return new RetrievalStrategy(SearchMethod.HYBRID, vectorWeight, textWeight);
  }

  public boolean isHybrid() {
    return method == SearchMethod.HYBRID;
  }
}
