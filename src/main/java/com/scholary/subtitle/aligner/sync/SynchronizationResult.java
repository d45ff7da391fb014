package com.scholary.subtitle.aligner.sync;

import com.scholary.subtitle.aligner.caption.CaptionTrack;

/**
 * Two tracks rewritten so that their segmentation agrees.
 *
 * <p>The round cap means convergence is not guaranteed. Callers that need the strict
 * post-condition should check {@link #isClean()} rather than assume it.
 *
 * @param a first track, renumbered from 1
 * @param b second track, renumbered from 1
 * @param rounds synchronization rounds executed
 * @param converged true if the last round changed nothing
 * @param remainingViolations adjacent caption pairs of one track still sharing a container in the
 *     other, counted in both directions
 */
public record SynchronizationResult(
    CaptionTrack a, CaptionTrack b, int rounds, boolean converged, int remainingViolations) {

  public boolean isClean() {
    return remainingViolations == 0;
  }
}
