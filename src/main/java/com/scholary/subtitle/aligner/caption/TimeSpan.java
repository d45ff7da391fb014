package com.scholary.subtitle.aligner.caption;

/**
 * Represents a caption's time interval in whole milliseconds.
 *
 * <p>Used for caption spans in both tracks. Integer milliseconds keep span arithmetic exact, so
 * merged and synchronized spans never drift.
 */
public record TimeSpan(long startMs, long endMs) {

  public TimeSpan {
    if (startMs < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (endMs < startMs) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  /**
   * Check if this span fully contains another span.
   *
   * @param other the other span
   * @return true if other lies within [start, end] of this span, bounds included
   */
  public boolean contains(TimeSpan other) {
    return startMs <= other.startMs && other.endMs <= endMs;
  }

  @Override
  public String toString() {
    return SrtTimestamp.formatRange(this);
  }
}
