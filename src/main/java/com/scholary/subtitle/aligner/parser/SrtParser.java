package com.scholary.subtitle.aligner.parser;

import com.scholary.subtitle.aligner.caption.Caption;
import com.scholary.subtitle.aligner.caption.CaptionTrack;
import com.scholary.subtitle.aligner.caption.SrtTimestamp;
import com.scholary.subtitle.aligner.caption.TimeSpan;
import com.scholary.subtitle.aligner.config.AlignmentProperties;
import com.scholary.subtitle.aligner.text.TextNormalizer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Parses SubRip (.srt) files into caption tracks.
 *
 * <p>Expected block layout:
 *
 * <pre>
 * 1
 * 00:00:01,000 --> 00:00:04,000
 * First subtitle text
 *
 * 2
 * 00:00:05,000 --> 00:00:08,000
 * Second subtitle text
 * </pre>
 *
 * <p>Real-world files are messy: stray blocks, missing index lines, odd encodings. Blocks that
 * don't fit the layout are skipped, never fatal. Music cues and single-character blocks are
 * dropped before the text is normalized.
 */
@Component
public class SrtParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(SrtParser.class);

  private static final Pattern TIME_LINE =
      Pattern.compile(
          "^(\\d{2}):(\\d{2}):(\\d{2}),(\\d{3})\\s*-->\\s*(\\d{2}):(\\d{2}):(\\d{2}),(\\d{3})$");
  private static final Pattern INDEX_LINE = Pattern.compile("^\\d+$");
  private static final char BOM = '\uFEFF';
  private static final char NUL = '\0';

  private final TextNormalizer normalizer;
  private final List<Charset> fallbackCharsets;

  @Autowired
  public SrtParser(TextNormalizer normalizer, AlignmentProperties properties) {
    this(normalizer, properties.parser().fallbackCharsets());
  }

  public SrtParser(TextNormalizer normalizer, List<String> fallbackCharsets) {
    this.normalizer = normalizer;
    this.fallbackCharsets = resolveCharsets(fallbackCharsets);
  }

  /**
   * Decode and parse a subtitle file.
   *
   * <p>UTF-8 is tried first. If the bytes are not valid UTF-8, each fallback charset is tried
   * strictly in order; if none fits, the last one decodes with undecodable bytes replaced. Stray
   * NUL characters are dropped from the decoded text. Input that starts with a UTF-16 byte order
   * mark, or whose bytes are more than a quarter NUL, is treated as UTF-16 or binary and rejected.
   *
   * @param bytes raw file content
   * @return the parsed track; empty with {@link DecodeStatus#UNDECODABLE} if the input is not a
   *     byte-oriented text file
   */
  public ParseResult parse(byte[] bytes) {
    Optional<DecodedText> decoded = decode(bytes);
    if (decoded.isEmpty()) {
      LOGGER.warn(
          "Rejected {} bytes as UTF-16 or binary, or no usable charset in {}",
          bytes.length,
          fallbackCharsets);
      return ParseResult.undecodable();
    }
    return parseText(decoded.get().text(), decoded.get().charset());
  }

  /** Parse text that has already been decoded. */
  public ParseResult parse(String content) {
    return parseText(content, null);
  }

  private ParseResult parseText(String content, String charset) {
    List<List<String>> blocks = splitBlocks(content);
    if (blocks.isEmpty()) {
      LOGGER.debug("No caption blocks found");
      return new ParseResult(
          CaptionTrack.empty(), DecodeStatus.EMPTY, charset, ParseDiagnostics.NONE);
    }

    List<Caption> captions = new ArrayList<>();
    int structuralSkips = 0;
    int musicFiltered = 0;
    int singleGlyphFiltered = 0;

    for (List<String> block : blocks) {
      Optional<RawBlock> raw = readBlock(block);
      if (raw.isEmpty()) {
        structuralSkips++;
        continue;
      }

      String joined = raw.get().text();
      if (normalizer.containsMusicMarker(joined)) {
        musicFiltered++;
        continue;
      }
      if (normalizer.isSingleGlyphAfterTagStrip(joined)) {
        singleGlyphFiltered++;
        continue;
      }

      captions.add(
          new Caption(captions.size() + 1, raw.get().span(), normalizer.normalize(joined)));
    }

    ParseDiagnostics diagnostics =
        new ParseDiagnostics(blocks.size(), structuralSkips, musicFiltered, singleGlyphFiltered);

    LOGGER.debug(
        "Parsed {} captions from {} blocks: {} skipped, {} music, {} single-character",
        captions.size(),
        blocks.size(),
        structuralSkips,
        musicFiltered,
        singleGlyphFiltered);

    return new ParseResult(new CaptionTrack(captions), DecodeStatus.DECODED, charset, diagnostics);
  }

  /**
   * Split text into blocks of non-blank lines.
   *
   * <p>One or more blank (whitespace-only) lines end a block.
   */
  private List<List<String>> splitBlocks(String content) {
    String text = content;
    if (!text.isEmpty() && text.charAt(0) == BOM) {
      text = text.substring(1);
    }
    text = text.replace("\r\n", "\n").replace('\r', '\n');

    List<List<String>> blocks = new ArrayList<>();
    List<String> current = new ArrayList<>();
    for (String line : text.split("\n", -1)) {
      if (line.isBlank()) {
        if (!current.isEmpty()) {
          blocks.add(current);
          current = new ArrayList<>();
        }
      } else {
        current.add(line);
      }
    }
    if (!current.isEmpty()) {
      blocks.add(current);
    }
    return blocks;
  }

  /** Optional index line, required time line, one or more text lines. */
  private Optional<RawBlock> readBlock(List<String> lines) {
    int position = 0;
    if (INDEX_LINE.matcher(lines.get(0).trim()).matches()) {
      position++;
    }
    if (position >= lines.size()) {
      return Optional.empty();
    }

    Optional<TimeSpan> span = parseTimeLine(lines.get(position).trim());
    if (span.isEmpty()) {
      return Optional.empty();
    }
    position++;

    if (position >= lines.size()) {
      return Optional.empty();
    }
    String text = String.join("\n", lines.subList(position, lines.size()));
    return Optional.of(new RawBlock(span.get(), text));
  }

  private Optional<TimeSpan> parseTimeLine(String line) {
    Matcher matcher = TIME_LINE.matcher(line);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    Optional<Long> start = toMillis(matcher, 1);
    Optional<Long> end = toMillis(matcher, 5);
    if (start.isEmpty() || end.isEmpty() || end.get() < start.get()) {
      return Optional.empty();
    }
    return Optional.of(new TimeSpan(start.get(), end.get()));
  }

  // Groups are fixed-width digit runs, so parseInt cannot fail here.
  private Optional<Long> toMillis(Matcher matcher, int firstGroup) {
    int hours = Integer.parseInt(matcher.group(firstGroup));
    int minutes = Integer.parseInt(matcher.group(firstGroup + 1));
    int seconds = Integer.parseInt(matcher.group(firstGroup + 2));
    int millis = Integer.parseInt(matcher.group(firstGroup + 3));
    if (minutes > 59 || seconds > 59) {
      return Optional.empty();
    }
    return Optional.of(SrtTimestamp.toMillis(hours, minutes, seconds, millis));
  }

  private Optional<DecodedText> decode(byte[] bytes) {
    if (looksLikeUtf16OrBinary(bytes)) {
      LOGGER.debug("Input looks like UTF-16 or binary data");
      return Optional.empty();
    }

    Optional<String> utf8 = decodeStrict(bytes, StandardCharsets.UTF_8);
    if (utf8.isPresent()) {
      return Optional.of(new DecodedText(stripNuls(utf8.get()), StandardCharsets.UTF_8.name()));
    }

    for (Charset charset : fallbackCharsets) {
      Optional<String> text = decodeStrict(bytes, charset);
      if (text.isPresent()) {
        LOGGER.debug("Decoded input as {}", charset.name());
        return Optional.of(new DecodedText(stripNuls(text.get()), charset.name()));
      }
    }
    if (fallbackCharsets.isEmpty()) {
      return Optional.empty();
    }

    Charset last = fallbackCharsets.get(fallbackCharsets.size() - 1);
    LOGGER.debug("Decoding input as {} with replacement", last.name());
    return Optional.of(new DecodedText(stripNuls(new String(bytes, last)), last.name()));
  }

  private static Optional<String> decodeStrict(byte[] bytes, Charset charset) {
    try {
      return Optional.of(
          charset
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes))
              .toString());
    } catch (CharacterCodingException e) {
      LOGGER.debug("Input is not valid {}: {}", charset.name(), e.getMessage());
      return Optional.empty();
    }
  }

  /** A UTF-16 byte order mark, or NULs in more than a quarter of the bytes. */
  private static boolean looksLikeUtf16OrBinary(byte[] bytes) {
    if (bytes.length >= 2) {
      int first = bytes[0] & 0xFF;
      int second = bytes[1] & 0xFF;
      if ((first == 0xFF && second == 0xFE) || (first == 0xFE && second == 0xFF)) {
        return true;
      }
    }
    int nuls = 0;
    for (byte b : bytes) {
      if (b == 0) {
        nuls++;
      }
    }
    return nuls * 4 > bytes.length;
  }

  private static String stripNuls(String text) {
    return text.indexOf(NUL) < 0 ? text : text.replace(String.valueOf(NUL), "");
  }

  private static List<Charset> resolveCharsets(List<String> names) {
    Set<Charset> charsets = new LinkedHashSet<>();
    for (String name : names) {
      String trimmed = name.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      try {
        charsets.add(Charset.forName(trimmed));
      } catch (IllegalArgumentException e) {
        LOGGER.warn("Ignoring unsupported fallback charset: {}", trimmed);
      }
    }
    return List.copyOf(charsets);
  }

  private record RawBlock(TimeSpan span, String text) {}

  private record DecodedText(String text, String charset) {}
}
