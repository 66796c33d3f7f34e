package dev.vidcrawl.crawl;

import org.jspecify.annotations.Nullable;

/**
 * Request ceiling for one run, checked between pages. Counts every request sent during the run,
 * retries and enrichment lookups included.
 *
 * @param maxApiRequests {@code null} for no ceiling
 */
public record CrawlLimits(@Nullable Long maxApiRequests) {

  public CrawlLimits {
    if (maxApiRequests != null && maxApiRequests <= 0) {
      throw new IllegalArgumentException("maxApiRequests must be positive");
    }
  }

  public static CrawlLimits unlimited() {
    return new CrawlLimits(null);
  }

  public static CrawlLimits maxRequests(long maxApiRequests) {
    return new CrawlLimits(maxApiRequests);
  }

  /** Stops after the first page. */
  public static CrawlLimits oneShot() {
    return new CrawlLimits(1L);
  }

  public boolean isReached(long requestsSent) {
    return maxApiRequests != null && requestsSent >= maxApiRequests;
  }

  /** What is left of this ceiling after {@code requestsSent} requests. */
  public CrawlLimits remainingAfter(long requestsSent) {
    if (maxApiRequests == null) {
      return this;
    }
    return new CrawlLimits(Math.max(1L, maxApiRequests - requestsSent));
  }
}
