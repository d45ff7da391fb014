package com.scholary.subtitle.aligner.parser;

import com.scholary.subtitle.aligner.caption.CaptionTrack;

/**
 * Outcome of parsing one subtitle file.
 *
 * <p>An undecodable file and a genuinely empty one both yield an empty track; the status tells
 * them apart.
 *
 * @param track surviving captions in file order, with provisional ordinals
 * @param status how the bytes were decoded
 * @param charset name of the charset that produced the text, or null when undecodable
 * @param diagnostics per-block counters
 */
public record ParseResult(
    CaptionTrack track, DecodeStatus status, String charset, ParseDiagnostics diagnostics) {

  public static ParseResult undecodable() {
    return new ParseResult(
        CaptionTrack.empty(), DecodeStatus.UNDECODABLE, null, ParseDiagnostics.NONE);
  }

  public boolean isUndecodable() {
    return status == DecodeStatus.UNDECODABLE;
  }
}
