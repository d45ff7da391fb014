package com.scholary.subtitle.aligner.sync;

import com.scholary.subtitle.aligner.caption.Caption;
import com.scholary.subtitle.aligner.caption.CaptionTrack;
import com.scholary.subtitle.aligner.config.AlignmentProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Rewrites two caption tracks until neither splits a line the other keeps whole.
 *
 * <p>Transcribers segment the same sentence differently: one track may carry "One long line" as
 * a single caption while the other splits it into "One" and "long line". When a caption of one
 * track sits inside a caption of the other, it is absorbed together with every following caption
 * that sits inside the same container. The run becomes one caption with the container's span and
 * the run's texts joined by a space.
 *
 * <p>Each round absorbs B into A, then A into the updated B. Rounds repeat until nothing changes
 * or the round cap is hit.
 */
@Component
public class TrackSynchronizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrackSynchronizer.class);

  private final int maxRounds;

  @Autowired
  public TrackSynchronizer(AlignmentProperties properties) {
    this(properties.sync().maxRounds());
  }

  public TrackSynchronizer(int maxRounds) {
    if (maxRounds < 1) {
      throw new IllegalArgumentException("maxRounds must be positive: " + maxRounds);
    }
    this.maxRounds = maxRounds;
  }

  /**
   * Synchronize the segmentation of two tracks.
   *
   * @param a first track
   * @param b second track
   * @return both rewritten tracks, renumbered, with convergence details
   */
  public SynchronizationResult synchronize(CaptionTrack a, CaptionTrack b) {
    CaptionTrack currentA = a;
    CaptionTrack currentB = b;
    int rounds = 0;
    boolean changed = true;

    while (changed && rounds < maxRounds) {
      rounds++;
      CaptionTrack nextB = absorb(currentB, currentA);
      CaptionTrack nextA = absorb(currentA, nextB);
      changed = !nextA.equals(currentA) || !nextB.equals(currentB);

      LOGGER.debug(
          "Sync round {}: a {} -> {}, b {} -> {}",
          rounds,
          currentA.size(),
          nextA.size(),
          currentB.size(),
          nextB.size());
      currentA = nextA;
      currentB = nextB;
    }

    CaptionTrack resultA = currentA.renumbered();
    CaptionTrack resultB = currentB.renumbered();
    int violations = countViolations(resultA, resultB);

    if (changed) {
      LOGGER.warn(
          "Synchronization did not converge after {} rounds, {} violations remain",
          rounds,
          violations);
    } else if (violations > 0) {
      LOGGER.warn("Synchronization converged with {} violations remaining", violations);
    }

    return new SynchronizationResult(resultA, resultB, rounds, !changed, violations);
  }

  /**
   * Count adjacent caption pairs in either track that both sit inside a single caption of the
   * other track.
   *
   * @return 0 when no merge opportunity is left
   */
  public int countViolations(CaptionTrack a, CaptionTrack b) {
    return countViolationsWithin(a, b) + countViolationsWithin(b, a);
  }

  /**
   * Absorb runs of target captions that share a containing caption in the reference track.
   *
   * <p>The reference is scanned linearly for each target caption; tracks are small enough per
   * file that this stays cheap.
   */
  CaptionTrack absorb(CaptionTrack target, CaptionTrack reference) {
    List<Caption> result = new ArrayList<>(target.size());
    int i = 0;

    while (i < target.size()) {
      Caption caption = target.get(i);
      Optional<Caption> container = findContainer(caption, reference);
      if (container.isEmpty()) {
        result.add(caption);
        i++;
        continue;
      }

      int runEnd = i + 1;
      while (runEnd < target.size()
          && container.get().span().contains(target.get(runEnd).span())) {
        runEnd++;
      }

      result.add(
          new Caption(
              caption.ordinal(),
              container.get().span(),
              joinTexts(target.captions().subList(i, runEnd))));
      i = runEnd;
    }
    return new CaptionTrack(result);
  }

  private Optional<Caption> findContainer(Caption caption, CaptionTrack reference) {
    for (Caption candidate : reference.captions()) {
      if (candidate.span().contains(caption.span())) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  private int countViolationsWithin(CaptionTrack target, CaptionTrack reference) {
    int violations = 0;
    for (int i = 0; i + 1 < target.size(); i++) {
      Caption first = target.get(i);
      Caption second = target.get(i + 1);
      for (Caption candidate : reference.captions()) {
        if (candidate.span().contains(first.span()) && candidate.span().contains(second.span())) {
          violations++;
          break;
        }
      }
    }
    return violations;
  }

  private static String joinTexts(List<Caption> run) {
    StringJoiner joined = new StringJoiner(" ");
    for (Caption caption : run) {
      if (!caption.text().isBlank()) {
        joined.add(caption.text());
      }
    }
    return joined.toString();
  }
}
