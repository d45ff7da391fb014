package com.scholary.subtitle.aligner.matching;

import com.scholary.subtitle.aligner.caption.Caption;
import com.scholary.subtitle.aligner.caption.CaptionTrack;
import com.scholary.subtitle.aligner.caption.TimeSpan;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Matches captions of a primary track to captions of a secondary track by timing.
 *
 * <p>This is a best-effort, primary-driven join: every primary caption gets exactly one entry,
 * with the secondary caption whose tolerance-expanded span overlaps it best, or none. Secondary
 * captions that no primary picks are dropped.
 *
 * <p>Both tracks are walked once. The secondary cursor only moves forward, so matching is linear
 * in the size of the tracks for well-ordered input.
 */
@Component
public class CaptionMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionMatcher.class);

  /**
   * Match every primary caption to its best secondary counterpart.
   *
   * <p>Both spans are widened by {@code toleranceMs} on each side before comparing. A candidate
   * must be close (expanded spans not disjoint) and wins only with a strictly higher
   * overlap-over-union score, so on exact ties the earliest candidate is kept.
   *
   * @param primary the track that drives the join
   * @param secondary the track searched for counterparts
   * @param toleranceMs widening applied to both ends of both spans; 0 means exact overlap
   * @return one pair per primary caption, in primary order
   */
  public List<MatchedPair> match(CaptionTrack primary, CaptionTrack secondary, long toleranceMs) {
    if (toleranceMs < 0) {
      throw new IllegalArgumentException("Tolerance cannot be negative: " + toleranceMs);
    }

    List<MatchedPair> matches = new ArrayList<>(primary.size());
    int cursor = 0;
    int matched = 0;

    for (Caption caption : primary.captions()) {
      cursor = advanceCursor(secondary, cursor, caption.span(), toleranceMs);
      MatchedPair pair = bestMatch(caption, secondary, cursor, toleranceMs);
      if (pair.hasMatch()) {
        matched++;
      }
      matches.add(pair);
    }

    LOGGER.debug(
        "Matched {}/{} primary captions against {} secondary captions (tolerance={}ms)",
        matched,
        primary.size(),
        secondary.size(),
        toleranceMs);
    return matches;
  }

  /**
   * Skip secondary captions that end before the primary span can reach them.
   *
   * @return the new cursor position, never less than {@code cursor}
   */
  static int advanceCursor(CaptionTrack secondary, int cursor, TimeSpan primary, long tolerance) {
    int position = cursor;
    while (position < secondary.size()
        && secondary.get(position).endMs() + tolerance < primary.startMs() - tolerance) {
      position++;
    }
    return position;
  }

  private MatchedPair bestMatch(
      Caption primary, CaptionTrack secondary, int cursor, long tolerance) {
    Caption best = null;
    double bestScore = -1.0;

    for (int j = cursor;
        j < secondary.size()
            && secondary.get(j).startMs() - tolerance <= primary.endMs() + tolerance;
        j++) {
      Caption candidate = secondary.get(j);
      if (!isClose(primary.span(), candidate.span(), tolerance)) {
        continue;
      }
      double score = score(primary.span(), candidate.span(), tolerance);
      if (score > bestScore) {
        bestScore = score;
        best = candidate;
      }
    }

    return best == null ? MatchedPair.unmatched(primary) : new MatchedPair(primary, best, bestScore);
  }

  /** Expanded spans are close unless one ends before the other starts. */
  static boolean isClose(TimeSpan a, TimeSpan b, long tolerance) {
    return !(a.endMs() + tolerance < b.startMs() - tolerance
        || b.endMs() + tolerance < a.startMs() - tolerance);
  }

  /**
   * Overlap-over-union of the two tolerance-expanded spans.
   *
   * @return a value in [0, 1]; 0 when the union is empty
   */
  static double score(TimeSpan a, TimeSpan b, long tolerance) {
    long aStart = a.startMs() - tolerance;
    long aEnd = a.endMs() + tolerance;
    long bStart = b.startMs() - tolerance;
    long bEnd = b.endMs() + tolerance;

    long overlap = Math.max(0, Math.min(aEnd, bEnd) - Math.max(aStart, bStart));
    long union = Math.max(aEnd, bEnd) - Math.min(aStart, bStart);
    return union > 0 ? (double) overlap / union : 0.0;
  }
}
