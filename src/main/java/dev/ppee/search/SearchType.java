package dev.ppee.search;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which retrieval source produced a single candidate. */
public enum SearchType {
  VECTOR("vector"),
  TEXT("text"),
  HYBRID("hybrid");

  private final String value;

  SearchType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
