package com.scholary.subtitle.aligner.ingest;

import java.util.List;

/**
 * File names grouped into primary/secondary pairs.
 *
 * @param pairs complete pairs ordered by base name
 * @param unpaired file names that were skipped: singles, duplicates and non-subtitle files
 */
public record PairingPlan(List<NamedPair> pairs, List<String> unpaired) {

  public PairingPlan {
    pairs = List.copyOf(pairs);
    unpaired = List.copyOf(unpaired);
  }

  public record NamedPair(String baseName, String primaryName, String secondaryName) {}
}
