package com.scholary.subtitle.aligner.ingest;

import com.scholary.subtitle.aligner.matching.AlignedRow;
import java.util.List;

/**
 * Outcome of aligning a batch of pairs.
 *
 * @param outcomes one outcome per input pair, in input order
 * @param rows rows of all successful pairs with batch-wide sequence numbers
 */
public record AlignmentBatch(List<PairOutcome<PairAlignment>> outcomes, List<AlignedRow> rows) {

  public AlignmentBatch {
    outcomes = List.copyOf(outcomes);
    rows = List.copyOf(rows);
  }

  public long failures() {
    return outcomes.stream().filter(outcome -> !outcome.succeeded()).count();
  }
}
