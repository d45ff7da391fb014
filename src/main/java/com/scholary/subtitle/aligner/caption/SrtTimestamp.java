package com.scholary.subtitle.aligner.caption;

import java.util.Locale;

/**
 * Conversions between millisecond offsets and SubRip timecodes.
 *
 * <p>Format: HH:MM:SS,mmm (hours:minutes:seconds,milliseconds). Hours are zero-padded to two
 * digits and grow wider past 99.
 */
public final class SrtTimestamp {

  private static final long MS_PER_HOUR = 3_600_000L;
  private static final long MS_PER_MINUTE = 60_000L;
  private static final long MS_PER_SECOND = 1_000L;

  private SrtTimestamp() {}

  /**
   * Format a millisecond offset as an SRT timecode.
   *
   * <p>Negative offsets are clamped to zero. Digits are always ASCII, whatever the default
   * locale.
   */
  public static String format(long millis) {
    long remaining = Math.max(0, millis);
    long hours = remaining / MS_PER_HOUR;
    remaining %= MS_PER_HOUR;
    long minutes = remaining / MS_PER_MINUTE;
    remaining %= MS_PER_MINUTE;
    long seconds = remaining / MS_PER_SECOND;
    long ms = remaining % MS_PER_SECOND;

    return String.format(Locale.ROOT, "%02d:%02d:%02d,%03d", hours, minutes, seconds, ms);
  }

  /** Format a span as an SRT time line, e.g. {@code 00:00:01,000 --> 00:00:04,000}. */
  public static String formatRange(TimeSpan span) {
    return format(span.startMs()) + " --> " + format(span.endMs());
  }

  /**
   * Combine already-parsed timecode fields into milliseconds.
   *
   * @throws IllegalArgumentException if minutes or seconds are outside 0-59, or any field is
   *     negative
   */
  public static long toMillis(int hours, int minutes, int seconds, int millis) {
    if (hours < 0 || minutes < 0 || seconds < 0 || millis < 0) {
      throw new IllegalArgumentException("Timecode fields cannot be negative");
    }
    if (minutes > 59 || seconds > 59 || millis > 999) {
      throw new IllegalArgumentException(
          "Timecode field out of range: " + minutes + "m " + seconds + "s " + millis + "ms");
    }
    return hours * MS_PER_HOUR + minutes * MS_PER_MINUTE + seconds * MS_PER_SECOND + millis;
  }

  /**
   * Parse a fixed-width {@code HH:MM:SS,mmm} timecode.
   *
   * @throws IllegalArgumentException if the text is not a well-formed timecode
   */
  public static long parse(String timecode) {
    String value = timecode.trim();
    if (value.length() != 12
        || value.charAt(2) != ':'
        || value.charAt(5) != ':'
        || value.charAt(8) != ',') {
      throw new IllegalArgumentException("Malformed SRT timecode: " + timecode);
    }
    return toMillis(
        digits(value, 0, 2), digits(value, 3, 5), digits(value, 6, 8), digits(value, 9, 12));
  }

  // Digits only, no sign.
  private static int digits(String text, int from, int to) {
    int value = 0;
    for (int i = from; i < to; i++) {
      char c = text.charAt(i);
      if (c < '0' || c > '9') {
        throw new IllegalArgumentException("Expected digit at position " + i + " in: " + text);
      }
      value = value * 10 + (c - '0');
    }
    return value;
  }
}
