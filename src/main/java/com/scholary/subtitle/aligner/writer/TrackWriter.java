package com.scholary.subtitle.aligner.writer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.scholary.subtitle.aligner.caption.Caption;
import com.scholary.subtitle.aligner.caption.CaptionTrack;
import com.scholary.subtitle.aligner.caption.SrtTimestamp;
import com.scholary.subtitle.aligner.matching.AlignedRow;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes caption tracks and aligned rows in their exchange formats.
 *
 * <p>Supports SRT (rewritten tracks for the cleanup tool) and NDJSON (aligned rows for the
 * ingestion store).
 */
@Component
public class TrackWriter {

  private final ObjectWriter rowWriter;

  public TrackWriter(ObjectMapper objectMapper) {
    this.rowWriter = objectMapper.writerFor(AlignedRow.class);
  }

  /**
   * Write a track as SRT (SubRip subtitle format).
   *
   * <p>Format:
   *
   * <pre>
   * 1
   * 00:00:01,000 --> 00:00:05,000
   * One long line
   *
   * 2
   * 00:00:06,000 --> 00:00:09,000
   * Where are you going?
   * </pre>
   *
   * <p>Indices run 1..N over the captions actually written; captions with blank text are left out.
   * There is no blank line after the last block.
   */
  public String writeSrt(CaptionTrack track) {
    StringBuilder srt = new StringBuilder();
    int index = 0;

    for (Caption caption : track.captions()) {
      if (caption.text().isBlank()) {
        continue;
      }
      if (index > 0) {
        srt.append("\n");
      }
      index++;

      srt.append(index).append("\n");
      srt.append(SrtTimestamp.formatRange(caption.span())).append("\n");
      srt.append(caption.text()).append("\n");
    }

    return srt.toString();
  }

  /** {@link #writeSrt(CaptionTrack)} encoded as UTF-8. */
  public byte[] writeSrtBytes(CaptionTrack track) {
    return writeSrt(track).getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Write aligned rows as NDJSON, one JSON object per line.
   *
   * <p>Format:
   *
   * <pre>
   * {"en":"Hello","ru":"Привет","file_en":"a_en.srt","file_ru":"a_ru.srt",
   *  "time_en":"00:00:01,000 --> 00:00:02,000","time_ru":"...","seq_id":1}
   * </pre>
   */
  public byte[] writeNdjson(List<AlignedRow> rows) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (AlignedRow row : rows) {
      out.write(rowWriter.writeValueAsBytes(row));
      out.write('\n');
    }
    return out.toByteArray();
  }
}
