package dev.ppee.search;

/**
 * Thrown when a query or search configuration is invalid. Raised synchronously, before any task is
 * created.
 */
public class SearchValidationException extends IllegalArgumentException {

  public SearchValidationException(String message) {
    super(message);
  }
}
