package dev.ppee.search;

import com.fasterxml.jackson.annotation.JsonValue;

/** How the candidates of a result set were obtained. */
public enum SearchMethod {
  VECTOR("vector"),
  HYBRID("hybrid"),
  FULL_SCAN("full_scan");

  private final String value;

  SearchMethod(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
