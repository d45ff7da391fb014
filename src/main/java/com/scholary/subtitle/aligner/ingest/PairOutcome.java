package com.scholary.subtitle.aligner.ingest;

/**
 * Result of one unit of a batch: either a value or the reason it failed.
 *
 * @param baseName the pair this outcome belongs to
 * @param result the unit's value, null on failure
 * @param error failure description, null on success
 */
public record PairOutcome<T>(String baseName, T result, String error) {

  public static <T> PairOutcome<T> success(String baseName, T result) {
    return new PairOutcome<>(baseName, result, null);
  }

  public static <T> PairOutcome<T> failure(String baseName, String error) {
    return new PairOutcome<>(baseName, null, error);
  }

  public boolean succeeded() {
    return error == null;
  }
}
