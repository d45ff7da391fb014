package com.scholary.subtitle.aligner.ingest;

import com.scholary.subtitle.aligner.config.AsyncConfig;
import com.scholary.subtitle.aligner.logging.StructuredLogger;
import com.scholary.subtitle.aligner.matching.AlignedRow;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Processes many subtitle pairs in parallel.
 *
 * <p>Each pair is an independent unit of work on the alignment executor. Results are collected
 * once every unit has finished. A failing unit is reported in its own outcome and never cancels
 * its siblings.
 */
@Service
public class BatchAlignmentService {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchAlignmentService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final PairAlignmentService alignmentService;
  private final Executor executor;

  public BatchAlignmentService(
      PairAlignmentService alignmentService,
      @Qualifier(AsyncConfig.ALIGNMENT_EXECUTOR) Executor executor) {
    this.alignmentService = alignmentService;
    this.executor = executor;
  }

  /** Align every pair, numbering rows from 1. */
  public AlignmentBatch alignAll(List<SubtitleFilePair> pairs) {
    return alignAll(pairs, 1);
  }

  /**
   * Align every pair and number the rows across the whole batch.
   *
   * <p>Rows are numbered after all units complete, in the order of the input pairs, so numbering
   * does not depend on which unit finishes first.
   *
   * @param pairs pairs to align
   * @param firstSequenceNumber sequence number of the first row, e.g. the store's row count + 1
   * @return per-pair outcomes and the rows of all successful pairs
   */
  public AlignmentBatch alignAll(List<SubtitleFilePair> pairs, long firstSequenceNumber) {
    long startedAt = System.currentTimeMillis();
    List<PairOutcome<PairAlignment>> outcomes =
        runAll(pairs, pair -> alignmentService.align(pair, 1));

    List<AlignedRow> rows = new ArrayList<>();
    for (PairOutcome<PairAlignment> outcome : outcomes) {
      if (!outcome.succeeded()) {
        continue;
      }
      for (AlignedRow row : outcome.result().rows()) {
        rows.add(row.withSequenceNumber(firstSequenceNumber + rows.size()));
      }
    }

    AlignmentBatch batch = new AlignmentBatch(outcomes, rows);
    structuredLogger.logBatchCompleted(
        pairs.size(),
        (int) batch.failures(),
        rows.size(),
        System.currentTimeMillis() - startedAt);
    return batch;
  }

  /**
   * Synchronize every pair.
   *
   * @param pairs pairs to synchronize
   * @return one outcome per pair, in input order
   */
  public List<PairOutcome<SynchronizedPair>> synchronizeAll(List<SubtitleFilePair> pairs) {
    long startedAt = System.currentTimeMillis();
    List<PairOutcome<SynchronizedPair>> outcomes =
        runAll(pairs, alignmentService::synchronize);

    int failures = (int) outcomes.stream().filter(outcome -> !outcome.succeeded()).count();
    structuredLogger.logBatchCompleted(
        pairs.size(), failures, 0, System.currentTimeMillis() - startedAt);
    return outcomes;
  }

  private <T> List<PairOutcome<T>> runAll(
      List<SubtitleFilePair> pairs, Function<SubtitleFilePair, T> unit) {
    LOGGER.info("Processing {} subtitle pairs", pairs.size());

    List<CompletableFuture<PairOutcome<T>>> futures = new ArrayList<>(pairs.size());
    for (SubtitleFilePair pair : pairs) {
      futures.add(CompletableFuture.supplyAsync(() -> runUnit(pair, unit), executor));
    }

    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private <T> PairOutcome<T> runUnit(SubtitleFilePair pair, Function<SubtitleFilePair, T> unit) {
    StructuredLogger.setPairContext(pair.baseName());
    try {
      return PairOutcome.success(pair.baseName(), unit.apply(pair));
    } catch (RuntimeException e) {
      structuredLogger.logPairFailed(pair.baseName(), e.getClass().getSimpleName(), e.getMessage());
      return PairOutcome.failure(
          pair.baseName(), e.getClass().getSimpleName() + ": " + e.getMessage());
    } finally {
      StructuredLogger.clearPairContext();
    }
  }
}
