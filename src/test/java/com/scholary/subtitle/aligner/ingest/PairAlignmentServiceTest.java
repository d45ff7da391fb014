package com.scholary.subtitle.aligner.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subtitle.aligner.caption.Caption;
import com.scholary.subtitle.aligner.config.AlignmentProperties;
import com.scholary.subtitle.aligner.matching.AlignedRow;
import com.scholary.subtitle.aligner.matching.CaptionMatcher;
import com.scholary.subtitle.aligner.parser.DecodeStatus;
import com.scholary.subtitle.aligner.parser.SrtParser;
import com.scholary.subtitle.aligner.sync.TrackSynchronizer;
import com.scholary.subtitle.aligner.text.TextNormalizer;
import com.scholary.subtitle.aligner.writer.TrackWriter;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PairAlignmentServiceTest {

  private static final String ENGLISH =
      """
      1
      00:00:01,000 --> 00:00:05,000
      One long line

      2
      00:00:06,000 --> 00:00:08,000
      Where are you going?

      3
      00:00:08,000 --> 00:00:09,000
      <i>Where are you going?</i>

      4
      00:00:20,000 --> 00:00:21,000
      Nobody answers
      """;

  private static final String RUSSIAN =
      """
      1
      00:00:01,000 --> 00:00:03,000
      Одна

      2
      00:00:03,000 --> 00:00:05,000
      длинная строка

      3
      00:00:06,100 --> 00:00:08,900
      Куда ты идёшь?
      """;

  private PairAlignmentService service;

  @BeforeEach
  void setUp() {
    TextNormalizer normalizer = new TextNormalizer();
    AlignmentProperties properties = AlignmentProperties.defaults();
    service =
        new PairAlignmentService(
            new SrtParser(normalizer, properties),
            normalizer,
            new CaptionMatcher(),
            new TrackSynchronizer(properties),
            new TrackWriter(new ObjectMapper()),
            properties);
  }

  @Test
  void align_shouldProduceOneRowPerMergedPrimaryCaption() {
    PairAlignment alignment = service.align(pair(ENGLISH, RUSSIAN), 100);

    assertThat(alignment.baseName()).isEqualTo("Movie");
    assertThat(alignment.rows())
        .extracting(AlignedRow::primaryText)
        .containsExactly("One long line", "Where are you going?", "Nobody answers");
    assertThat(alignment.rows())
        .extracting(AlignedRow::sequenceNumber)
        .containsExactly(100L, 101L, 102L);
    assertThat(alignment.matched()).isEqualTo(2);
    assertThat(alignment.hasDecodeFailure()).isFalse();
  }

  @Test
  void align_shouldCarryTimesAndFileNames() {
    AlignedRow row = service.align(pair(ENGLISH, RUSSIAN), 1).rows().get(1);

    assertThat(row.secondaryText()).isEqualTo("Куда ты идёшь?");
    assertThat(row.primaryTime()).isEqualTo("00:00:06,000 --> 00:00:09,000");
    assertThat(row.secondaryTime()).isEqualTo("00:00:06,100 --> 00:00:08,900");
    assertThat(row.primaryFile()).isEqualTo("Movie_en.srt");
    assertThat(row.secondaryFile()).isEqualTo("Movie_ru.srt");
  }

  @Test
  void align_shouldKeepUnmatchedPrimaryCaptions() {
    AlignedRow last = service.align(pair(ENGLISH, RUSSIAN), 1).rows().get(2);

    assertThat(last.secondaryText()).isEmpty();
    assertThat(last.secondaryTime()).isNull();
  }

  @Test
  void align_shouldExposeUndecodableSecondary() {
    SubtitleFilePair pair =
        new SubtitleFilePair(
            "Movie",
            "Movie_en.srt",
            ENGLISH.getBytes(StandardCharsets.UTF_8),
            "Movie_ru.srt",
            RUSSIAN.getBytes(StandardCharsets.UTF_16LE));

    PairAlignment alignment = service.align(pair, 1);

    assertThat(alignment.hasDecodeFailure()).isTrue();
    assertThat(alignment.secondary().status()).isEqualTo(DecodeStatus.UNDECODABLE);
    assertThat(alignment.rows()).hasSize(3);
    assertThat(alignment.matched()).isZero();
  }

  @Test
  void align_shouldRejectPairWithoutContent() {
    SubtitleFilePair pair =
        new SubtitleFilePair("Movie", "Movie_en.srt", null, "Movie_ru.srt", new byte[0]);

    assertThatThrownBy(() -> service.align(pair, 1))
        .isInstanceOf(AlignmentException.class)
        .hasMessageContaining("Movie");
  }

  @Test
  void synchronize_shouldRewriteBothTracks() {
    SynchronizedPair synced = service.synchronize(pair(ENGLISH, RUSSIAN));

    assertThat(synced.result().b().captions())
        .extracting(Caption::text)
        .containsExactly("Одна длинная строка", "Куда ты идёшь?");
    assertThat(synced.result().remainingViolations()).isZero();
    assertThat(synced.secondarySrt())
        .isEqualTo(
            "1\n00:00:01,000 --> 00:00:05,000\nОдна длинная строка\n"
                + "\n"
                + "2\n00:00:06,000 --> 00:00:09,000\nКуда ты идёшь?\n");
    assertThat(synced.primarySrt())
        .startsWith("1\n00:00:01,000 --> 00:00:05,000\nOne long line\n");
  }

  private static SubtitleFilePair pair(String primary, String secondary) {
    return new SubtitleFilePair(
        "Movie",
        "Movie_en.srt",
        primary.getBytes(StandardCharsets.UTF_8),
        "Movie_ru.srt",
        secondary.getBytes(StandardCharsets.UTF_8));
  }
}
