package dev.vidcrawl.crawl;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * What one crawl asks for.
 *
 * @param query serialized query JSON, sent and stored verbatim
 * @param startDate first day, inclusive
 * @param endDate last day, exclusive on the wire
 * @param maxCount videos requested per page
 * @param crawlTags labels attached to the crawl and its videos
 * @param fetchUserInfo also look up the author of every video; costs one request per new author
 * @param fetchComments also page through the comments of every video; costs at least one request
 *     per video
 */
public record VideoQueryConfig(
    String query,
    LocalDate startDate,
    LocalDate endDate,
    int maxCount,
    List<String> crawlTags,
    boolean fetchUserInfo,
    boolean fetchComments) {

  public VideoQueryConfig {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(startDate, "startDate");
    Objects.requireNonNull(endDate, "endDate");
    crawlTags = crawlTags == null ? List.of() : List.copyOf(crawlTags);
    if (endDate.isBefore(startDate)) {
      throw new IllegalArgumentException(
          "End date " + endDate + " is before start date " + startDate);
    }
    if (maxCount <= 0) {
      throw new IllegalArgumentException("maxCount must be positive");
    }
  }

  public VideoQueryConfig withDates(LocalDate newStartDate, LocalDate newEndDate) {
    return new VideoQueryConfig(
        query, newStartDate, newEndDate, maxCount, crawlTags, fetchUserInfo, fetchComments);
  }
}
