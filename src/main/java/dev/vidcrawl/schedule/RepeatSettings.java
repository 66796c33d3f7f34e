package dev.vidcrawl.schedule;

import java.time.LocalDate;
import org.jspecify.annotations.Nullable;

/**
 * Parameters of a repeated crawl.
 *
 * @param crawlSpan days covered by each run
 * @param crawlLag days each window trails today by
 * @param repeatIntervalDays days between the starts of consecutive runs
 * @param catchUpFromStartDate when set, first crawl forward from this date without pausing until
 *     the window reaches today minus the lag
 */
public record RepeatSettings(
    int crawlSpan,
    int crawlLag,
    int repeatIntervalDays,
    @Nullable LocalDate catchUpFromStartDate) {

  public RepeatSettings {
    if (crawlSpan <= 0) {
      throw new IllegalArgumentException("crawlSpan must be positive");
    }
    if (crawlLag <= 0) {
      throw new IllegalArgumentException("crawlLag must be positive");
    }
    if (repeatIntervalDays <= 0) {
      throw new IllegalArgumentException("repeatIntervalDays must be positive");
    }
  }
}
