package com.scholary.subtitle.aligner.ingest;

import com.scholary.subtitle.aligner.caption.Caption;
import com.scholary.subtitle.aligner.caption.CaptionTrack;
import com.scholary.subtitle.aligner.parser.ParseResult;
import com.scholary.subtitle.aligner.parser.SrtParser;
import com.scholary.subtitle.aligner.text.TextNormalizer;
import com.scholary.subtitle.aligner.writer.TrackWriter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cleans up a single subtitle file.
 *
 * <p>Repair steps:
 *
 * <ul>
 *   <li>Drop music cues and single-character blocks
 *   <li>Strip markup, bracketed asides and stray dashes
 *   <li>Drop captions left without text
 *   <li>Merge consecutive captions with identical text and renumber from 1
 * </ul>
 */
@Service
public class SubtitleRepairService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleRepairService.class);

  private final SrtParser parser;
  private final TextNormalizer normalizer;
  private final TrackWriter writer;

  public SubtitleRepairService(SrtParser parser, TextNormalizer normalizer, TrackWriter writer) {
    this.parser = parser;
    this.normalizer = normalizer;
    this.writer = writer;
  }

  /**
   * Repair one SRT file.
   *
   * @param fileName name used for reporting
   * @param bytes raw file content
   * @return counts before and after merging, and the rewritten file
   */
  public RepairResult repair(String fileName, byte[] bytes) {
    ParseResult parsed = parser.parse(bytes);
    if (parsed.track().isEmpty()) {
      LOGGER.warn("No valid entries in {} (status={})", fileName, parsed.status());
      return new RepairResult(fileName, parsed.status(), 0, 0, "");
    }

    List<Caption> withText =
        parsed.track().captions().stream().filter(caption -> !caption.text().isBlank()).toList();
    CaptionTrack repaired = new CaptionTrack(normalizer.mergeConsecutiveDuplicates(withText));

    LOGGER.info("Repaired {}: {} -> {} entries", fileName, parsed.track().size(), repaired.size());
    return new RepairResult(
        fileName, parsed.status(), parsed.track().size(), repaired.size(), writer.writeSrt(repaired));
  }
}
