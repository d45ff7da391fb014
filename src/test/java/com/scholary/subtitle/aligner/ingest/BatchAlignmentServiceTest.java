package com.scholary.subtitle.aligner.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.when;

import com.scholary.subtitle.aligner.caption.Caption;
import com.scholary.subtitle.aligner.caption.CaptionTrack;
import com.scholary.subtitle.aligner.matching.AlignedRow;
import com.scholary.subtitle.aligner.matching.MatchedPair;
import com.scholary.subtitle.aligner.parser.DecodeStatus;
import com.scholary.subtitle.aligner.parser.ParseDiagnostics;
import com.scholary.subtitle.aligner.parser.ParseResult;
import com.scholary.subtitle.aligner.sync.SynchronizationResult;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for batch fan-out/fan-in with failure isolation. */
@ExtendWith(MockitoExtension.class)
class BatchAlignmentServiceTest {

  private static final ParseResult PARSED =
      new ParseResult(CaptionTrack.empty(), DecodeStatus.DECODED, "UTF-8", ParseDiagnostics.NONE);

  @Mock private PairAlignmentService alignmentService;

  private BatchAlignmentService service;

  private final SubtitleFilePair alpha = pair("Alpha");
  private final SubtitleFilePair broken = pair("Broken");
  private final SubtitleFilePair gamma = pair("Gamma");

  @BeforeEach
  void setUp() {
    // Runs each unit on the calling thread
    service = new BatchAlignmentService(alignmentService, Runnable::run);
  }

  @Test
  void alignAll_shouldIsolateFailingPairs() {
    when(alignmentService.align(same(alpha), anyLong())).thenReturn(alignment("Alpha", 2));
    when(alignmentService.align(same(broken), anyLong()))
        .thenThrow(new AlignmentException("Missing file content for pair: Broken"));
    when(alignmentService.align(same(gamma), anyLong())).thenReturn(alignment("Gamma", 1));

    AlignmentBatch batch = service.alignAll(List.of(alpha, broken, gamma));

    assertThat(batch.outcomes())
        .extracting(PairOutcome::baseName)
        .containsExactly("Alpha", "Broken", "Gamma");
    assertThat(batch.outcomes())
        .extracting(PairOutcome::succeeded)
        .containsExactly(true, false, true);
    assertThat(batch.outcomes().get(1).error())
        .isEqualTo("AlignmentException: Missing file content for pair: Broken");
    assertThat(batch.failures()).isEqualTo(1);
  }

  @Test
  void alignAll_shouldNumberRowsAcrossPairsInInputOrder() {
    when(alignmentService.align(same(alpha), anyLong())).thenReturn(alignment("Alpha", 2));
    when(alignmentService.align(same(gamma), anyLong())).thenReturn(alignment("Gamma", 3));

    AlignmentBatch batch = service.alignAll(List.of(alpha, gamma), 41);

    assertThat(batch.rows())
        .extracting(AlignedRow::sequenceNumber)
        .containsExactly(41L, 42L, 43L, 44L, 45L);
    assertThat(batch.rows())
        .extracting(AlignedRow::primaryFile)
        .containsExactly(
            "Alpha_en.srt", "Alpha_en.srt", "Gamma_en.srt", "Gamma_en.srt", "Gamma_en.srt");
  }

  @Test
  void alignAll_shouldHandleEmptyBatch() {
    AlignmentBatch batch = service.alignAll(List.of());

    assertThat(batch.outcomes()).isEmpty();
    assertThat(batch.rows()).isEmpty();
  }

  @Test
  void synchronizeAll_shouldReportEachPair() {
    SynchronizedPair synced =
        new SynchronizedPair(
            "Alpha",
            new SynchronizationResult(CaptionTrack.empty(), CaptionTrack.empty(), 1, true, 0),
            "",
            "",
            PARSED,
            PARSED);
    when(alignmentService.synchronize(same(alpha))).thenReturn(synced);
    when(alignmentService.synchronize(same(broken))).thenThrow(new IllegalStateException("boom"));

    List<PairOutcome<SynchronizedPair>> outcomes = service.synchronizeAll(List.of(alpha, broken));

    assertThat(outcomes.get(0).result()).isSameAs(synced);
    assertThat(outcomes.get(1).succeeded()).isFalse();
    assertThat(outcomes.get(1).error()).contains("boom");
  }

  private static SubtitleFilePair pair(String baseName) {
    return new SubtitleFilePair(
        baseName, baseName + "_en.srt", new byte[0], baseName + "_ru.srt", new byte[0]);
  }

  private static PairAlignment alignment(String baseName, int rowCount) {
    List<AlignedRow> rows =
        IntStream.range(0, rowCount)
            .mapToObj(
                i ->
                    AlignedRow.from(
                        MatchedPair.unmatched(new Caption(i + 1, i * 1000L, i * 1000L + 500, "x")),
                        baseName + "_en.srt",
                        baseName + "_ru.srt",
                        i + 1))
            .toList();
    return new PairAlignment(baseName, rows, PARSED, PARSED, 0);
  }
}
