package com.scholary.subtitle.aligner.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for subtitle alignment.
 *
 * <p>Controls matching tolerance, synchronization limits, decoding fallbacks, file pairing and
 * the worker pool used for batches.
 */
@ConfigurationProperties(prefix = "alignment")
@Validated
public record AlignmentProperties(
    @PositiveOrZero long toleranceMs,
    boolean mergeDuplicates,
    @Positive int executorThreads,
    @Positive int executorQueueSize,
    @Valid @NotNull SyncProperties sync,
    @Valid @NotNull ParserProperties parser,
    @Valid @NotNull PairingProperties pairing) {

  public record SyncProperties(@Positive int maxRounds) {}

  public record ParserProperties(@NotEmpty List<String> fallbackCharsets) {}

  /** File name suffixes used to pair tracks, e.g. {@code Movie_en.srt} with {@code Movie_ru.srt}. */
  public record PairingProperties(
      @NotBlank String primaryLanguage, @NotBlank String secondaryLanguage) {}

  /** The values shipped in application.yml. */
  public static AlignmentProperties defaults() {
    return new AlignmentProperties(
        1000,
        true,
        4,
        100,
        new SyncProperties(10),
        new ParserProperties(List.of("ISO-8859-1", "windows-1252")),
        new PairingProperties("en", "ru"));
  }
}
