package dev.vidcrawl.query;

/** Comparison applied between a field and its values. */
public enum Operation {
  EQ,
  IN,
  GT,
  GTE,
  LT,
  LTE
}
