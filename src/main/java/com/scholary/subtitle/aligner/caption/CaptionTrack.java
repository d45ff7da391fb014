package com.scholary.subtitle.aligner.caption;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered sequence of captions as they appeared in the source file.
 *
 * <p>Tracks are never re-sorted. Well-formed files are already ordered by start time; malformed
 * ones are treated as ordered-as-given.
 */
public record CaptionTrack(List<Caption> captions) {

  private static final CaptionTrack EMPTY = new CaptionTrack(List.of());

  public CaptionTrack {
    captions = List.copyOf(captions);
  }

  public static CaptionTrack empty() {
    return EMPTY;
  }

  public static CaptionTrack of(Caption... captions) {
    return new CaptionTrack(List.of(captions));
  }

  public int size() {
    return captions.size();
  }

  public boolean isEmpty() {
    return captions.isEmpty();
  }

  public Caption get(int index) {
    return captions.get(index);
  }

  /** Copy of this track with ordinals reassigned 1..N in track order. */
  public CaptionTrack renumbered() {
    List<Caption> renumbered = new ArrayList<>(captions.size());
    for (int i = 0; i < captions.size(); i++) {
      renumbered.add(captions.get(i).withOrdinal(i + 1));
    }
    return new CaptionTrack(renumbered);
  }
}
