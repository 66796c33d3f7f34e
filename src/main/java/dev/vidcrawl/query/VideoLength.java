package dev.vidcrawl.query;

/** Duration buckets: SHORT under 15s, MID 15-60s, LONG 1-5min, EXTRA_LONG over 5min. */
public enum VideoLength {
  SHORT,
  MID,
  LONG,
  EXTRA_LONG
}
