package com.scholary.subtitle.aligner.ingest;

/**
 * Thrown when a subtitle pair lacks what the pipeline needs, such as the content of one file.
 *
 * <p>Malformed subtitle content never raises this; bad blocks are skipped by the parser. Inside a
 * batch the exception becomes a failed outcome for its pair only.
 */
public class AlignmentException extends RuntimeException {

  public AlignmentException(String message) {
    super(message);
  }
}
