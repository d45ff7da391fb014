package com.scholary.subtitle.aligner.caption;

/**
 * One timed text unit from a subtitle track.
 *
 * <p>The ordinal is for display only. It is recomputed every time a track is emitted, so it never
 * identifies a caption across edits.
 */
public record Caption(int ordinal, TimeSpan span, String text) {

  public Caption {
    if (span == null) {
      throw new IllegalArgumentException("Caption span is required");
    }
    text = text == null ? "" : text;
  }

  public Caption(int ordinal, long startMs, long endMs, String text) {
    this(ordinal, new TimeSpan(startMs, endMs), text);
  }

  public Caption withOrdinal(int newOrdinal) {
    return new Caption(newOrdinal, span, text);
  }

  public long startMs() {
    return span.startMs();
  }

  public long endMs() {
    return span.endMs();
  }

  /** The SRT time line for this caption. */
  public String timeString() {
    return SrtTimestamp.formatRange(span);
  }
}
