package dev.vidcrawl.schedule;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Date-window arithmetic for rolling and catch-up crawls. */
public final class CrawlDateWindows {

  private CrawlDateWindows() {}

  /**
   * Builds a window of {@code crawlSpan} days.
   *
   * @param crawlSpan window length in days
   * @param crawlLag days the window trails today by
   * @param startDate explicit start; when {@code null} the window ends {@code crawlLag} days
   *     before today
   */
  public static CrawlDateWindow make(
      int crawlSpan, int crawlLag, @Nullable LocalDate startDate, LocalDate today) {
    if (crawlSpan <= 0) {
      throw new IllegalArgumentException("crawl span must be positive, got " + crawlSpan);
    }
    if (crawlLag <= 0) {
      throw new IllegalArgumentException("crawl lag must be positive, got " + crawlLag);
    }
    LocalDate start = startDate != null ? startDate : today.minusDays(crawlLag + crawlSpan);
    return new CrawlDateWindow(start, start.plusDays(crawlSpan));
  }

  /** True while the window ends strictly before {@code today - crawlLag}. */
  public static boolean isBehindToday(CrawlDateWindow window, int crawlLag, LocalDate today) {
    return window.endDate().isBefore(today.minusDays(crawlLag));
  }

  /**
   * Cuts a window into consecutive pieces of at most {@code daysPerIteration} days. A window whose
   * start equals its end is returned as is.
   */
  public static List<CrawlDateWindow> split(CrawlDateWindow window, int daysPerIteration) {
    if (daysPerIteration <= 0) {
      throw new IllegalArgumentException(
          "days per iteration must be positive, got " + daysPerIteration);
    }
    if (window.startDate().equals(window.endDate())) {
      return List.of(window);
    }
    List<CrawlDateWindow> windows = new ArrayList<>();
    LocalDate start = window.startDate();
    while (start.isBefore(window.endDate())) {
      LocalDate end = start.plusDays(daysPerIteration);
      if (end.isAfter(window.endDate())) {
        end = window.endDate();
      }
      windows.add(new CrawlDateWindow(start, end));
      start = start.plusDays(daysPerIteration);
    }
    return windows;
  }
}
