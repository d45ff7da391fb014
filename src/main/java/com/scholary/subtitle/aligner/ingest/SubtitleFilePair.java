package com.scholary.subtitle.aligner.ingest;

/**
 * Raw bytes of the two subtitle files for one video.
 *
 * @param baseName shared file name stem, e.g. {@code Movie} for {@code Movie_en.srt}
 * @param primaryName primary file name
 * @param primaryBytes primary file content
 * @param secondaryName secondary file name
 * @param secondaryBytes secondary file content
 */
public record SubtitleFilePair(
    String baseName,
    String primaryName,
    byte[] primaryBytes,
    String secondaryName,
    byte[] secondaryBytes) {}
