package com.scholary.subtitle.aligner.ingest;

import com.scholary.subtitle.aligner.parser.ParseResult;
import com.scholary.subtitle.aligner.sync.SynchronizationResult;

/**
 * Rewritten tracks for one subtitle pair, serialized back to SRT.
 *
 * @param baseName shared file name stem
 * @param result synchronized tracks and convergence details
 * @param primarySrt primary track as SRT text
 * @param secondarySrt secondary track as SRT text
 * @param primary parse result of the primary file
 * @param secondary parse result of the secondary file
 */
public record SynchronizedPair(
    String baseName,
    SynchronizationResult result,
    String primarySrt,
    String secondarySrt,
    ParseResult primary,
    ParseResult secondary) {}
