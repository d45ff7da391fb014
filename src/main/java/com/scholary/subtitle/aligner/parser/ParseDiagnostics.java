package com.scholary.subtitle.aligner.parser;

/**
 * Counters describing what the parser did with each block of a file.
 *
 * @param blocksSeen blank-line separated blocks found in the decoded text
 * @param structuralSkips blocks without a usable time line or text
 * @param musicFiltered blocks dropped because they contain a musical note
 * @param singleGlyphFiltered blocks dropped because only one character remained
 */
public record ParseDiagnostics(
    int blocksSeen, int structuralSkips, int musicFiltered, int singleGlyphFiltered) {

  public static final ParseDiagnostics NONE = new ParseDiagnostics(0, 0, 0, 0);

  public int filtered() {
    return musicFiltered + singleGlyphFiltered;
  }
}
