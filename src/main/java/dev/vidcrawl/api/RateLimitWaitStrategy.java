package dev.vidcrawl.api;

/** How long the client backs off after the API reports that the request quota is exhausted. */
public enum RateLimitWaitStrategy {
  /** Sleep a fixed four hours before trying again. */
  WAIT_FOUR_HOURS,
  /** Sleep until the quota resets at the next midnight UTC. */
  WAIT_NEXT_UTC_MIDNIGHT
}
