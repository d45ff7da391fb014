package com.scholary.subtitle.aligner.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class StructuredLoggerTest {

  private Logger logger;
  private CapturingAppender appender;
  private StructuredLogger structuredLogger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(StructuredLoggerTest.class);
    logger.setLevel(Level.DEBUG);
    appender = new CapturingAppender();
    appender.start();
    logger.addAppender(appender);
    structuredLogger = new StructuredLogger(logger);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    MDC.clear();
  }

  @Test
  void logTrackParsed_shouldAttachFieldsWhileLogging() {
    structuredLogger.logTrackParsed("Movie_en.srt", "UTF-8", 5, 4, 0, 1);

    assertThat(appender.mdc).hasSize(1);
    Map<String, String> fields = appender.mdc.get(0);
    assertThat(fields)
        .containsEntry("event_type", "track_parsed")
        .containsEntry("file", "Movie_en.srt")
        .containsEntry("charset", "UTF-8")
        .containsEntry("captions", "4")
        .containsEntry("filtered", "1");
  }

  @Test
  void events_shouldLeaveNoFieldsBehind() {
    structuredLogger.logDecodeFailed("binary_ru.srt", 128);
    structuredLogger.logPairAligned("Movie", 3, 4, 2, 1000);
    structuredLogger.logPairSynchronized("Movie", 3, 3, 2, 0);
    structuredLogger.logBatchCompleted(2, 0, 3, 15);

    assertThat(appender.mdc)
        .extracting(fields -> fields.get("event_type"))
        .containsExactly("decode_failed", "pair_aligned", "pair_synchronized", "batch_completed");
    assertThat(MDC.getCopyOfContextMap()).isNullOrEmpty();
  }

  @Test
  void pairContext_shouldSurviveEventsUntilCleared() {
    StructuredLogger.setPairContext("Movie");
    structuredLogger.logPairFailed("Movie", "AlignmentException", "Missing file content");

    assertThat(appender.mdc.get(0))
        .containsEntry("pairName", "Movie")
        .containsEntry("event_type", "pair_failed");
    assertThat(MDC.get("pairName")).isEqualTo("Movie");
    assertThat(MDC.get("event_type")).isNull();

    StructuredLogger.clearPairContext();
    assertThat(MDC.get("pairName")).isNull();
  }

  /** Copies the MDC at append time; logback reads it lazily otherwise. */
  private static final class CapturingAppender extends AppenderBase<ILoggingEvent> {

    private final List<Map<String, String>> mdc = new ArrayList<>();

    @Override
    protected void append(ILoggingEvent event) {
      mdc.add(new HashMap<>(event.getMDCPropertyMap()));
    }
  }
}
