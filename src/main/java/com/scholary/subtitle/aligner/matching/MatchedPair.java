package com.scholary.subtitle.aligner.matching;

import com.scholary.subtitle.aligner.caption.Caption;
import java.util.Optional;

/**
 * A primary caption and its best counterpart in the secondary track.
 *
 * @param primary the primary-track caption
 * @param secondary best secondary caption, or null when nothing was close enough
 * @param score overlap-over-union of the tolerance-expanded spans, 0 when unmatched
 */
public record MatchedPair(Caption primary, Caption secondary, double score) {

  public static MatchedPair unmatched(Caption primary) {
    return new MatchedPair(primary, null, 0.0);
  }

  public boolean hasMatch() {
    return secondary != null;
  }

  public Optional<Caption> secondaryCaption() {
    return Optional.ofNullable(secondary);
  }
}
