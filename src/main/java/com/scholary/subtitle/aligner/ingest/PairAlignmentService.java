package com.scholary.subtitle.aligner.ingest;

import com.scholary.subtitle.aligner.caption.CaptionTrack;
import com.scholary.subtitle.aligner.config.AlignmentProperties;
import com.scholary.subtitle.aligner.logging.StructuredLogger;
import com.scholary.subtitle.aligner.matching.AlignedRow;
import com.scholary.subtitle.aligner.matching.CaptionMatcher;
import com.scholary.subtitle.aligner.matching.MatchedPair;
import com.scholary.subtitle.aligner.parser.ParseDiagnostics;
import com.scholary.subtitle.aligner.parser.ParseResult;
import com.scholary.subtitle.aligner.parser.SrtParser;
import com.scholary.subtitle.aligner.sync.SynchronizationResult;
import com.scholary.subtitle.aligner.sync.TrackSynchronizer;
import com.scholary.subtitle.aligner.text.TextNormalizer;
import com.scholary.subtitle.aligner.writer.TrackWriter;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the alignment pipeline for a single subtitle pair.
 *
 * <p>Two outputs are supported:
 *
 * <ul>
 *   <li>{@link #align}: best-effort rows for the ingestion store, one per primary caption
 *   <li>{@link #synchronize}: both tracks rewritten to a shared segmentation, as SRT
 * </ul>
 *
 * <p>Everything here is pure per pair; batches parallelize across pairs, not within one.
 */
@Service
public class PairAlignmentService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PairAlignmentService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final SrtParser parser;
  private final TextNormalizer normalizer;
  private final CaptionMatcher matcher;
  private final TrackSynchronizer synchronizer;
  private final TrackWriter writer;
  private final long toleranceMs;
  private final boolean mergeDuplicates;

  public PairAlignmentService(
      SrtParser parser,
      TextNormalizer normalizer,
      CaptionMatcher matcher,
      TrackSynchronizer synchronizer,
      TrackWriter writer,
      AlignmentProperties properties) {
    this.parser = parser;
    this.normalizer = normalizer;
    this.matcher = matcher;
    this.synchronizer = synchronizer;
    this.writer = writer;
    this.toleranceMs = properties.toleranceMs();
    this.mergeDuplicates = properties.mergeDuplicates();
  }

  /**
   * Match the captions of a pair and map them to storable rows.
   *
   * @param pair the two subtitle files
   * @param firstSequenceNumber sequence number of the first row
   * @return rows plus both parse results, so decode failures stay visible
   */
  public PairAlignment align(SubtitleFilePair pair, long firstSequenceNumber) {
    requireContent(pair);
    ParseResult primary = parse(pair.primaryName(), pair.primaryBytes());
    ParseResult secondary = parse(pair.secondaryName(), pair.secondaryBytes());

    CaptionTrack primaryTrack = prepare(primary.track());
    CaptionTrack secondaryTrack = prepare(secondary.track());

    List<MatchedPair> matches = matcher.match(primaryTrack, secondaryTrack, toleranceMs);

    List<AlignedRow> rows = new ArrayList<>(matches.size());
    int matched = 0;
    for (MatchedPair match : matches) {
      rows.add(
          AlignedRow.from(
              match, pair.primaryName(), pair.secondaryName(), firstSequenceNumber + rows.size()));
      if (match.hasMatch()) {
        matched++;
      }
    }

    structuredLogger.logPairAligned(
        pair.baseName(), primaryTrack.size(), secondaryTrack.size(), matched, toleranceMs);
    return new PairAlignment(pair.baseName(), rows, primary, secondary, matched);
  }

  /**
   * Rewrite both tracks of a pair so neither splits a caption the other keeps whole.
   *
   * @param pair the two subtitle files
   * @return synchronized tracks and their SRT serialization
   */
  public SynchronizedPair synchronize(SubtitleFilePair pair) {
    requireContent(pair);
    ParseResult primary = parse(pair.primaryName(), pair.primaryBytes());
    ParseResult secondary = parse(pair.secondaryName(), pair.secondaryBytes());

    SynchronizationResult result =
        synchronizer.synchronize(prepare(primary.track()), prepare(secondary.track()));

    structuredLogger.logPairSynchronized(
        pair.baseName(),
        result.a().size(),
        result.b().size(),
        result.rounds(),
        result.remainingViolations());

    return new SynchronizedPair(
        pair.baseName(),
        result,
        writer.writeSrt(result.a()),
        writer.writeSrt(result.b()),
        primary,
        secondary);
  }

  private void requireContent(SubtitleFilePair pair) {
    if (pair.primaryBytes() == null || pair.secondaryBytes() == null) {
      throw new AlignmentException("Missing file content for pair: " + pair.baseName());
    }
  }

  private ParseResult parse(String fileName, byte[] bytes) {
    ParseResult result = parser.parse(bytes);
    if (result.isUndecodable()) {
      structuredLogger.logDecodeFailed(fileName, bytes.length);
      return result;
    }
    ParseDiagnostics diagnostics = result.diagnostics();
    structuredLogger.logTrackParsed(
        fileName,
        result.charset(),
        diagnostics.blocksSeen(),
        result.track().size(),
        diagnostics.structuralSkips(),
        diagnostics.filtered());
    return result;
  }

  private CaptionTrack prepare(CaptionTrack track) {
    if (!mergeDuplicates) {
      return track.renumbered();
    }
    return new CaptionTrack(normalizer.mergeConsecutiveDuplicates(track.captions()));
  }
}
