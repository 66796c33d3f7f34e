package dev.vidcrawl.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vidcrawl.crawl.CrawlProperties;
import dev.vidcrawl.crawl.VideoQueryConfig;
import dev.vidcrawl.schedule.CrawlScheduler;
import dev.vidcrawl.schedule.RepeatSettings;
import java.io.PrintStream;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Dispatches the first non-option argument to a command.
 *
 * <ul>
 *   <li>{@code run --start-date=YYYYMMDD --end-date=YYYYMMDD} crawls one window
 *   <li>{@code run-repeated --crawl-span=N} crawls a rolling window forever
 *   <li>{@code print-query} prints the query generated from the query options
 * </ul>
 */
@Component
public class CrawlCommandRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(CrawlCommandRunner.class);

  static final String USAGE =
      "Usage: vidcrawl <run|run-repeated|print-query> [options]\n"
          + "  run           --start-date=YYYYMMDD --end-date=YYYYMMDD [--max-api-requests=N]\n"
          + "  run-repeated  --crawl-span=N [--crawl-lag=1] [--repeat-interval=1]"
          + " [--catch-up-from-start-date=YYYYMMDD]\n"
          + "  print-query   [query options]\n"
          + "Common: [--crawl-tag=T] [--fetch-user-info] [--fetch-comments]"
          + " [--query-file=path | query options]\n"
          + "Query options: --region --include-any-hashtags --include-all-hashtags"
          + " --exclude-any-hashtags --exclude-all-hashtags (and the same for keywords)"
          + " --only-from-usernames --exclude-from-usernames";

  private final CrawlScheduler scheduler;
  private final CrawlProperties crawlProperties;
  private final ObjectMapper objectMapper;
  private final PrintStream out;

  @Autowired
  public CrawlCommandRunner(
      CrawlScheduler scheduler, CrawlProperties crawlProperties, ObjectMapper objectMapper) {
    this(scheduler, crawlProperties, objectMapper, System.out);
  }

  CrawlCommandRunner(
      CrawlScheduler scheduler,
      CrawlProperties crawlProperties,
      ObjectMapper objectMapper,
      PrintStream out) {
    this.scheduler = scheduler;
    this.crawlProperties = crawlProperties;
    this.objectMapper = objectMapper;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> commands = args.getNonOptionArgs();
    if (commands.isEmpty()) {
      log.info(USAGE);
      return;
    }
    CommandOptions options = new CommandOptions(args, objectMapper);
    String command = commands.get(0);
    switch (command) {
      case "run" -> run(options);
      case "run-repeated" -> runRepeated(options);
      case PrintQueryCommand.NAME -> printQuery(options);
      default -> throw new IllegalArgumentException("Unknown command: " + command + "\n" + USAGE);
    }
  }

  private void run(CommandOptions options) {
    LocalDate startDate = options.requiredDate("start-date");
    LocalDate endDate = options.requiredDate("end-date");
    VideoQueryConfig config =
        options.queryConfig(startDate, endDate, crawlProperties.maxCount());
    log.info("Running crawl for {} to {}", startDate, endDate);
    scheduler.runWindow(config, options.limits());
  }

  private void runRepeated(CommandOptions options) {
    RepeatSettings settings = options.repeatSettings();
    // dates are replaced by the scheduler for every window
    LocalDate placeholder = LocalDate.EPOCH;
    VideoQueryConfig config =
        options.queryConfig(placeholder, placeholder, crawlProperties.maxCount());
    log.info(
        "Repeating crawl every {} days over {} days lagging {} days",
        settings.repeatIntervalDays(),
        settings.crawlSpan(),
        settings.crawlLag());
    scheduler.runRepeated(config, settings);
  }

  private void printQuery(CommandOptions options) {
    PrintQueryCommand.print(options, objectMapper, out);
  }
}
