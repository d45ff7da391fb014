package com.scholary.subtitle.aligner.caption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Locale;
import org.junit.jupiter.api.Test;

class SrtTimestampTest {

  @Test
  void format_shouldPadAllFields() {
    assertThat(SrtTimestamp.format(0)).isEqualTo("00:00:00,000");
    assertThat(SrtTimestamp.format(5_200)).isEqualTo("00:00:05,200");
  }

  @Test
  void format_shouldSplitHoursMinutesSeconds() {
    // 1 hour, 1 minute, 1.5 seconds
    assertThat(SrtTimestamp.format(3_661_500)).isEqualTo("01:01:01,500");
  }

  @Test
  void format_shouldClampNegativeOffsets() {
    assertThat(SrtTimestamp.format(-250)).isEqualTo("00:00:00,000");
  }

  @Test
  void format_shouldUseAsciiDigitsUnderArabicLocale() {
    Locale original = Locale.getDefault();
    try {
      Locale.setDefault(Locale.forLanguageTag("ar-EG"));

      assertThat(SrtTimestamp.format(3_723_456L)).isEqualTo("01:02:03,456");
      assertThat(SrtTimestamp.formatRange(new TimeSpan(1_000, 4_000)))
          .isEqualTo("00:00:01,000 --> 00:00:04,000");
      assertThat(SrtTimestamp.parse(SrtTimestamp.format(3_723_456L))).isEqualTo(3_723_456L);
    } finally {
      Locale.setDefault(original);
    }
  }

  @Test
  void parse_shouldReadWellFormedTimecode() {
    assertThat(SrtTimestamp.parse("01:02:03,456")).isEqualTo(3_723_456L);
    assertThat(SrtTimestamp.parse(" 00:00:01,000 ")).isEqualTo(1_000L);
  }

  @Test
  void parse_shouldRejectMalformedTimecode() {
    assertThatThrownBy(() -> SrtTimestamp.parse("1:02:03,456"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SrtTimestamp.parse("00:00:01.000"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SrtTimestamp.parse("00:0a:01,000"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_shouldRejectOutOfRangeMinutes() {
    assertThatThrownBy(() -> SrtTimestamp.parse("00:61:00,000"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("out of range");
  }

  @Test
  void toMillis_shouldRejectNegativeFields() {
    assertThatThrownBy(() -> SrtTimestamp.toMillis(0, -1, 0, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void formatRange_shouldJoinWithArrow() {
    assertThat(SrtTimestamp.formatRange(new TimeSpan(1_000, 4_000)))
        .isEqualTo("00:00:01,000 --> 00:00:04,000");
  }
}
