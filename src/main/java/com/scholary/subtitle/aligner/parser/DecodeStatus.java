package com.scholary.subtitle.aligner.parser;

/** How the raw bytes of a subtitle file were interpreted. */
public enum DecodeStatus {
  /** Text was decoded and contained at least one caption block. */
  DECODED,

  /** Text was decoded but held no blocks at all (empty or whitespace-only file). */
  EMPTY,

  /** No supported encoding produced usable text. */
  UNDECODABLE
}
