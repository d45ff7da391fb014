package com.scholary.subtitle.aligner.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Emits alignment events with their fields in the MDC.
 *
 * <p>Each event sets {@code event_type} plus its own fields for the duration of one log call, so
 * a log aggregator can filter on them. The {@code pairName} context spans a whole unit of batch
 * work and is managed separately.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a parsed subtitle file. */
  public void logTrackParsed(
      String file,
      String charset,
      int blocks,
      int captions,
      int structuralSkips,
      int filtered) {
    try {
      MDC.put("event_type", "track_parsed");
      MDC.put("file", file);
      MDC.put("charset", String.valueOf(charset));
      MDC.put("blocks", String.valueOf(blocks));
      MDC.put("captions", String.valueOf(captions));
      MDC.put("structuralSkips", String.valueOf(structuralSkips));
      MDC.put("filtered", String.valueOf(filtered));

      logger.debug(
          "Track parsed: file={}, charset={}, blocks={}, captions={}, skipped={}, filtered={}",
          file,
          charset,
          blocks,
          captions,
          structuralSkips,
          filtered);
    } finally {
      clearEventFields();
    }
  }

  /** Log a file that no supported encoding could read. */
  public void logDecodeFailed(String file, int sizeBytes) {
    try {
      MDC.put("event_type", "decode_failed");
      MDC.put("file", file);
      MDC.put("sizeBytes", String.valueOf(sizeBytes));

      logger.warn("Decode failed: file={}, size={} bytes", file, sizeBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log a matched pair of tracks. */
  public void logPairAligned(
      String pairName, int primaryCaptions, int secondaryCaptions, int matched, long toleranceMs) {
    try {
      MDC.put("event_type", "pair_aligned");
      MDC.put("primaryCaptions", String.valueOf(primaryCaptions));
      MDC.put("secondaryCaptions", String.valueOf(secondaryCaptions));
      MDC.put("matched", String.valueOf(matched));
      MDC.put("toleranceMs", String.valueOf(toleranceMs));

      logger.info(
          "Pair aligned: pair={}, primary={}, secondary={}, matched={}, tolerance={}ms",
          pairName,
          primaryCaptions,
          secondaryCaptions,
          matched,
          toleranceMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a synchronized pair of tracks. */
  public void logPairSynchronized(
      String pairName, int captionsA, int captionsB, int rounds, int remainingViolations) {
    try {
      MDC.put("event_type", "pair_synchronized");
      MDC.put("captionsA", String.valueOf(captionsA));
      MDC.put("captionsB", String.valueOf(captionsB));
      MDC.put("rounds", String.valueOf(rounds));
      MDC.put("remainingViolations", String.valueOf(remainingViolations));

      logger.info(
          "Pair synchronized: pair={}, a={}, b={}, rounds={}, violations={}",
          pairName,
          captionsA,
          captionsB,
          rounds,
          remainingViolations);
    } finally {
      clearEventFields();
    }
  }

  /** Log a pair whose processing failed inside a batch. */
  public void logPairFailed(String pairName, String errorType, String message) {
    try {
      MDC.put("event_type", "pair_failed");
      MDC.put("errorType", errorType);

      logger.error("Pair failed: pair={}, error={}, message={}", pairName, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log batch completion. */
  public void logBatchCompleted(int pairs, int failures, int rows, long elapsedMs) {
    try {
      MDC.put("event_type", "batch_completed");
      MDC.put("pairs", String.valueOf(pairs));
      MDC.put("failures", String.valueOf(failures));
      MDC.put("rows", String.valueOf(rows));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Batch completed: pairs={}, failures={}, rows={}, elapsed={}ms",
          pairs,
          failures,
          rows,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Tag every following log line of this thread with the pair being processed. */
  public static void setPairContext(String pairName) {
    MDC.put("pairName", pairName);
  }

  /** Remove the pair tag. */
  public static void clearPairContext() {
    MDC.remove("pairName");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("file");
    MDC.remove("charset");
    MDC.remove("blocks");
    MDC.remove("captions");
    MDC.remove("structuralSkips");
    MDC.remove("filtered");
    MDC.remove("sizeBytes");
    MDC.remove("primaryCaptions");
    MDC.remove("secondaryCaptions");
    MDC.remove("matched");
    MDC.remove("toleranceMs");
    MDC.remove("captionsA");
    MDC.remove("captionsB");
    MDC.remove("rounds");
    MDC.remove("remainingViolations");
    MDC.remove("errorType");
    MDC.remove("pairs");
    MDC.remove("failures");
    MDC.remove("rows");
    MDC.remove("elapsedMs");
  }
}
