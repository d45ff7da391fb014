package com.scholary.subtitle.aligner.text;

import com.scholary.subtitle.aligner.caption.Caption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cleans raw caption text and collapses repeated captions.
 *
 * <p>Cleanup order:
 *
 * <ol>
 *   <li>Strip markup tags such as {@code <i>} and {@code <font color="...">}
 *   <li>Remove bracketed content: {@code (...)}, {@code [...]}, {@code {...}}
 *   <li>Collapse whitespace (multi-line captions become one line)
 *   <li>Trim leading and trailing dashes, including mis-decoded en/em dashes
 * </ol>
 *
 * <p>Tags must go before brackets because tags may wrap bracketed text.
 */
@Component
public class TextNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TextNormalizer.class);

  private static final Pattern TAG = Pattern.compile("<[^>]+>");
  private static final Pattern PARENTHESES = Pattern.compile("\\([^)]*\\)");
  private static final Pattern BRACKETS = Pattern.compile("\\[[^\\]]*\\]");
  private static final Pattern BRACES = Pattern.compile("\\{[^}]*\\}");
  private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Cntrl}]+");

  // ASCII hyphen, en dash, em dash, both dashes as UTF-8 bytes read back as Windows-1252 or
  // Latin-1, and the Windows-1252 dash bytes read as Latin-1 (C1 controls U+0096 and U+0097).
  private static final String DASH =
      "(?:-|–|—|â€[“”]|â\u0080[\u0093\u0094]|[\u0096\u0097])";
  private static final Pattern LEADING_DASHES = Pattern.compile("^(?:" + DASH + "+\\s*)+");
  private static final Pattern TRAILING_DASHES = Pattern.compile("(?:\\s*" + DASH + "+)+$");

  private static final String MUSIC_NOTE = "♪";
  private static final String MUSIC_NOTE_CP1252 = "â™ª";
  private static final String MUSIC_NOTE_LATIN1 = "â\u0099ª";

  /**
   * Normalize raw caption text.
   *
   * <p>Total and idempotent: {@code normalize(normalize(x)).equals(normalize(x))}.
   *
   * @param raw caption text, possibly multi-line and marked up; null is treated as empty
   * @return cleaned single-line text, possibly empty
   */
  public String normalize(String raw) {
    if (raw == null || raw.isEmpty()) {
      return "";
    }
    String text = stripTags(raw);
    text = PARENTHESES.matcher(text).replaceAll("");
    text = BRACKETS.matcher(text).replaceAll("");
    text = BRACES.matcher(text).replaceAll("");
    text = WHITESPACE.matcher(text).replaceAll(" ").trim();
    text = LEADING_DASHES.matcher(text).replaceFirst("");
    text = TRAILING_DASHES.matcher(text).replaceFirst("");
    return text.trim();
  }

  /**
   * Check for a musical note, either as the real glyph or as its mojibake.
   *
   * <p>Music cues carry lyrics or "♪ music playing ♪" filler that has no counterpart in the
   * other language's track.
   */
  public boolean containsMusicMarker(String text) {
    if (text == null) {
      return false;
    }
    return text.contains(MUSIC_NOTE)
        || text.contains(MUSIC_NOTE_CP1252)
        || text.contains(MUSIC_NOTE_LATIN1);
  }

  /** True iff exactly one character remains once markup tags are stripped and the text trimmed. */
  public boolean isSingleGlyphAfterTagStrip(String text) {
    if (text == null) {
      return false;
    }
    String stripped = stripTags(text).strip();
    return stripped.codePointCount(0, stripped.length()) == 1;
  }

  /**
   * Merge runs of consecutive captions whose normalized text is identical.
   *
   * <p>A run keeps the first caption's start and extends to the furthest end seen in the run.
   * Output captions carry normalized text and are renumbered from 1.
   *
   * @param captions captions in track order
   * @return merged captions, never longer than the input
   */
  public List<Caption> mergeConsecutiveDuplicates(List<Caption> captions) {
    if (captions.isEmpty()) {
      return List.of();
    }

    List<Caption> merged = new ArrayList<>();
    Caption current = captions.get(0);
    String currentText = normalize(current.text());
    long currentEnd = current.endMs();
    int mergedCount = 0;

    for (int i = 1; i < captions.size(); i++) {
      Caption next = captions.get(i);
      String nextText = normalize(next.text());

      if (nextText.equals(currentText)) {
        currentEnd = Math.max(currentEnd, next.endMs());
        mergedCount++;
      } else {
        merged.add(new Caption(merged.size() + 1, current.startMs(), currentEnd, currentText));
        current = next;
        currentText = nextText;
        currentEnd = next.endMs();
      }
    }
    merged.add(new Caption(merged.size() + 1, current.startMs(), currentEnd, currentText));

    if (mergedCount > 0) {
      LOGGER.debug(
          "Merged {} duplicate captions: {} -> {}", mergedCount, captions.size(), merged.size());
    }
    return merged;
  }

  private String stripTags(String text) {
    return TAG.matcher(text).replaceAll("");
  }
}
