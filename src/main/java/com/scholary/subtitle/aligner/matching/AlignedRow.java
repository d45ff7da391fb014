package com.scholary.subtitle.aligner.matching;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A matched caption pair flattened into the row shape the ingestion store expects.
 *
 * <p>Field names follow the store's schema, where the primary language is stored as "en" and the
 * secondary as "ru".
 *
 * @param primaryText normalized primary caption text
 * @param secondaryText normalized secondary caption text, empty when unmatched
 * @param primaryFile file name of the primary track
 * @param secondaryFile file name of the secondary track
 * @param primaryTime primary span as an SRT time line
 * @param secondaryTime secondary span as an SRT time line, null when unmatched
 * @param sequenceNumber position of the row in the ingested batch, starting at 1
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record AlignedRow(
    @JsonProperty("en") String primaryText,
    @JsonProperty("ru") String secondaryText,
    @JsonProperty("file_en") String primaryFile,
    @JsonProperty("file_ru") String secondaryFile,
    @JsonProperty("time_en") String primaryTime,
    @JsonProperty("time_ru") String secondaryTime,
    @JsonProperty("seq_id") long sequenceNumber) {

  public static AlignedRow from(
      MatchedPair pair, String primaryFile, String secondaryFile, long sequenceNumber) {
    return new AlignedRow(
        pair.primary().text(),
        pair.hasMatch() ? pair.secondary().text() : "",
        primaryFile,
        secondaryFile,
        pair.primary().timeString(),
        pair.hasMatch() ? pair.secondary().timeString() : null,
        sequenceNumber);
  }

  public AlignedRow withSequenceNumber(long newSequenceNumber) {
    return new AlignedRow(
        primaryText,
        secondaryText,
        primaryFile,
        secondaryFile,
        primaryTime,
        secondaryTime,
        newSequenceNumber);
  }
}
