package dev.vidcrawl.schedule;

import java.time.LocalDate;
import java.util.Objects;

/** A {@code [startDate, endDate)} range of days to crawl. */
public record CrawlDateWindow(LocalDate startDate, LocalDate endDate) {

  public CrawlDateWindow {
    Objects.requireNonNull(startDate, "startDate");
    Objects.requireNonNull(endDate, "endDate");
    if (endDate.isBefore(startDate)) {
      throw new IllegalArgumentException(
          "Window end " + endDate + " is before its start " + startDate);
    }
  }
}
