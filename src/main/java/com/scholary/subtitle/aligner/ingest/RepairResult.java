package com.scholary.subtitle.aligner.ingest;

import com.scholary.subtitle.aligner.parser.DecodeStatus;

/**
 * A single subtitle file after cleanup.
 *
 * @param fileName name of the repaired file
 * @param status how the original bytes were decoded
 * @param originalCount captions that survived parsing and filtering
 * @param finalCount captions written after duplicates were merged
 * @param srt repaired file content
 */
public record RepairResult(
    String fileName, DecodeStatus status, int originalCount, int finalCount, String srt) {

  public boolean repaired() {
    return status == DecodeStatus.DECODED && originalCount > 0;
  }
}
