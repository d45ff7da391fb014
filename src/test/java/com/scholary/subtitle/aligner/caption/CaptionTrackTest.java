package com.scholary.subtitle.aligner.caption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CaptionTrackTest {

  @Test
  void renumbered_shouldAssignOrdinalsInTrackOrder() {
    CaptionTrack track =
        CaptionTrack.of(new Caption(7, 0, 1000, "a"), new Caption(3, 1000, 2000, "b"));

    CaptionTrack renumbered = track.renumbered();

    assertThat(renumbered.captions()).extracting(Caption::ordinal).containsExactly(1, 2);
    assertThat(renumbered.captions()).extracting(Caption::text).containsExactly("a", "b");
  }

  @Test
  void constructor_shouldCopyInput() {
    List<Caption> captions = new ArrayList<>();
    captions.add(new Caption(1, 0, 1000, "a"));
    CaptionTrack track = new CaptionTrack(captions);

    captions.add(new Caption(2, 1000, 2000, "b"));

    assertThat(track.size()).isEqualTo(1);
  }

  @Test
  void caption_shouldTreatNullTextAsEmpty() {
    assertThat(new Caption(1, 0, 1000, null).text()).isEmpty();
  }

  @Test
  void caption_shouldRequireSpan() {
    assertThatThrownBy(() -> new Caption(1, null, "text"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
