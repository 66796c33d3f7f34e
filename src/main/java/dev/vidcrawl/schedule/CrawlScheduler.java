package dev.vidcrawl.schedule;

import dev.vidcrawl.api.ResearchApiClient;
import dev.vidcrawl.crawl.CrawlLimits;
import dev.vidcrawl.crawl.CrawlProperties;
import dev.vidcrawl.crawl.CrawlService;
import dev.vidcrawl.crawl.FetchResult;
import dev.vidcrawl.crawl.VideoQueryConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Service;

/**
 * Drives crawls across date windows: once over a fixed window, or forever over a rolling window
 * that trails today, optionally catching up from a historical start date first.
 *
 * <p>Failures are not caught; a failed run ends the process and is left to its supervisor.
 */
@Service
public class CrawlScheduler {

  private static final Logger log = LoggerFactory.getLogger(CrawlScheduler.class);

  private final CrawlService crawlService;
  private final ResearchApiClient apiClient;
  private final CrawlProperties properties;
  private final Clock clock;
  private final Sleeper sleeper;

  public CrawlScheduler(
      CrawlService crawlService,
      ResearchApiClient apiClient,
      CrawlProperties properties,
      Clock clock,
      Sleeper sleeper) {
    this.crawlService = crawlService;
    this.apiClient = apiClient;
    this.properties = properties;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /**
   * Crawls the window of {@code config}, split into sub-windows of {@code days-per-iteration}
   * days. The request ceiling covers all sub-windows together.
   */
  public List<FetchResult> runWindow(VideoQueryConfig config, CrawlLimits limits) {
    CrawlDateWindow window = new CrawlDateWindow(config.startDate(), config.endDate());
    List<CrawlDateWindow> windows =
        CrawlDateWindows.split(window, properties.daysPerIteration());
    long requestsAtStart = apiClient.getRequestsSent();
    List<FetchResult> results = new ArrayList<>();

    for (CrawlDateWindow subWindow : windows) {
      long requestsSoFar = apiClient.getRequestsSent() - requestsAtStart;
      if (limits.isReached(requestsSoFar)) {
        log.info(
            "Max API requests {} reached after {} requests, skipping {} to {}",
            limits.maxApiRequests(),
            requestsSoFar,
            subWindow.startDate(),
            subWindow.endDate());
        break;
      }
      log.info("Running crawl for {} to {}", subWindow.startDate(), subWindow.endDate());
      results.add(
          crawlService.fetchAndStoreAll(
              config.withDates(subWindow.startDate(), subWindow.endDate()),
              limits.remainingAfter(requestsSoFar)));
    }
    return results;
  }

  /**
   * Runs forever, or until the thread is interrupted while waiting between runs. Each run covers
   * the {@code crawlSpan} days ending {@code crawlLag} days before today.
   */
  public void runRepeated(VideoQueryConfig config, RepeatSettings settings) {
    if (settings.catchUpFromStartDate() != null) {
      catchUp(config, settings);
    }
    while (!Thread.currentThread().isInterrupted()) {
      Instant executionStart = clock.instant();
      runRepeatedOnce(config, settings);
      if (!waitUntilRepeatIntervalElapsed(executionStart, settings.repeatIntervalDays())) {
        return;
      }
    }
  }

  /** Crawls consecutive windows from the catch-up date, without pausing or request ceiling. */
  void catchUp(VideoQueryConfig config, RepeatSettings settings) {
    CrawlDateWindow window =
        CrawlDateWindows.make(
            settings.crawlSpan(), settings.crawlLag(), settings.catchUpFromStartDate(), today());
    while (CrawlDateWindows.isBehindToday(window, settings.crawlLag(), today())) {
      log.info(
          "Still catching up from {} (with {} crawl lag), will begin next run immediately",
          window.startDate(),
          settings.crawlLag());
      startNewRun();
      runWindow(config.withDates(window.startDate(), window.endDate()), CrawlLimits.unlimited());
      window =
          CrawlDateWindows.make(
              settings.crawlSpan(), settings.crawlLag(), window.endDate(), today());
    }
    log.info("We have caught up to today minus crawl lag ({} days)", settings.crawlLag());
  }

  /** One steady-state run, capped at the daily quota times the interval. */
  void runRepeatedOnce(VideoQueryConfig config, RepeatSettings settings) {
    CrawlDateWindow window =
        CrawlDateWindows.make(settings.crawlSpan(), settings.crawlLag(), null, today());
    long maxApiRequests = (long) properties.dailyRequestQuota() * settings.repeatIntervalDays();
    log.info(
        "Repeated run for {} to {} with max API requests {}",
        window.startDate(),
        window.endDate(),
        maxApiRequests);
    startNewRun();
    runWindow(
        config.withDates(window.startDate(), window.endDate()),
        CrawlLimits.maxRequests(maxApiRequests));
  }

  /**
   * Blocks until {@code repeatIntervalDays} after {@code executionStart}.
   *
   * @return false if the thread was interrupted while sleeping
   */
  boolean waitUntilRepeatIntervalElapsed(Instant executionStart, int repeatIntervalDays) {
    Instant nextExecution = executionStart.plus(Duration.ofDays(repeatIntervalDays));
    Instant now = clock.instant();
    if (!now.isBefore(nextExecution)) {
      log.warn(
          "Previous crawl started at {} and took longer than repeat interval {} days. "
              + "Starting now",
          executionStart,
          repeatIntervalDays);
      return true;
    }
    log.info("Sleeping until {}", nextExecution);
    try {
      sleeper.sleep(Duration.between(now, nextExecution).toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("Interrupted while waiting for the next run, stopping");
      return false;
    }
  }

  /** Each run starts with empty lookup caches and a request count of zero. */
  private void startNewRun() {
    crawlService.clearCaches();
    apiClient.resetRequestCount();
  }

  private LocalDate today() {
    return LocalDate.now(clock);
  }
}
