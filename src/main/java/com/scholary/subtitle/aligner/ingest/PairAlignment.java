package com.scholary.subtitle.aligner.ingest;

import com.scholary.subtitle.aligner.matching.AlignedRow;
import com.scholary.subtitle.aligner.parser.ParseResult;
import java.util.List;

/**
 * Matched rows for one subtitle pair.
 *
 * @param baseName shared file name stem
 * @param rows one row per primary caption
 * @param primary parse result of the primary file
 * @param secondary parse result of the secondary file
 * @param matched rows that found a secondary caption
 */
public record PairAlignment(
    String baseName,
    List<AlignedRow> rows,
    ParseResult primary,
    ParseResult secondary,
    int matched) {

  public PairAlignment {
    rows = List.copyOf(rows);
  }

  public boolean hasDecodeFailure() {
    return primary.isUndecodable() || secondary.isUndecodable();
  }
}
