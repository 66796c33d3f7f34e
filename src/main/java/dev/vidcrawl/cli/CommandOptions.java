package dev.vidcrawl.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vidcrawl.crawl.CrawlLimits;
import dev.vidcrawl.crawl.VideoQueryConfig;
import dev.vidcrawl.query.QueryGenerator;
import dev.vidcrawl.query.QueryOptions;
import dev.vidcrawl.schedule.RepeatSettings;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.ApplicationArguments;

/** Turns {@code --option=value} arguments into crawl, query and repeat settings. */
final class CommandOptions {

  static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

  static final List<String> QUERY_OPTIONS =
      List.of(
          "region",
          "include-any-hashtags",
          "include-all-hashtags",
          "exclude-any-hashtags",
          "exclude-all-hashtags",
          "include-any-keywords",
          "include-all-keywords",
          "exclude-any-keywords",
          "exclude-all-keywords",
          "only-from-usernames",
          "exclude-from-usernames");

  private final ApplicationArguments args;
  private final ObjectMapper objectMapper;

  CommandOptions(ApplicationArguments args, ObjectMapper objectMapper) {
    this.args = args;
    this.objectMapper = objectMapper;
  }

  /** Query options from the command line; no option at all is rejected. */
  QueryOptions queryOptions() {
    QueryOptions options =
        QueryOptions.builder()
            .regionCodes(regionCodes())
            .includeAnyHashtags(value("include-any-hashtags"))
            .includeAllHashtags(value("include-all-hashtags"))
            .excludeAnyHashtags(value("exclude-any-hashtags"))
            .excludeAllHashtags(value("exclude-all-hashtags"))
            .includeAnyKeywords(value("include-any-keywords"))
            .includeAllKeywords(value("include-all-keywords"))
            .excludeAnyKeywords(value("exclude-any-keywords"))
            .excludeAllKeywords(value("exclude-all-keywords"))
            .onlyFromUsernames(value("only-from-usernames"))
            .excludeFromUsernames(value("exclude-from-usernames"))
            .build();
    if (options.isEmpty()) {
      throw new IllegalArgumentException("Must specify --query-file or at least one query option");
    }
    return options;
  }

  /** The query as compact JSON, from {@code --query-file} or from the query options. */
  String queryJson() {
    String queryFile = value("query-file");
    if (queryFile != null) {
      List<String> conflicting =
          QUERY_OPTIONS.stream().filter(args::containsOption).collect(Collectors.toList());
      if (!conflicting.isEmpty()) {
        throw new IllegalArgumentException(
            "--query-file cannot be combined with query options " + conflicting);
      }
      return readQueryFile(Path.of(queryFile));
    }
    try {
      return objectMapper.writeValueAsString(QueryGenerator.generate(queryOptions()));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize query", e);
    }
  }

  VideoQueryConfig queryConfig(LocalDate startDate, LocalDate endDate, int maxCount) {
    return new VideoQueryConfig(
        queryJson(),
        startDate,
        endDate,
        maxCount,
        values("crawl-tag"),
        args.containsOption("fetch-user-info"),
        args.containsOption("fetch-comments"));
  }

  CrawlLimits limits() {
    String maxApiRequests = value("max-api-requests");
    if (maxApiRequests == null) {
      return CrawlLimits.unlimited();
    }
    return CrawlLimits.maxRequests(positiveInt("max-api-requests", maxApiRequests));
  }

  RepeatSettings repeatSettings() {
    String crawlSpan = value("crawl-span");
    if (crawlSpan == null) {
      throw new IllegalArgumentException("--crawl-span is required");
    }
    return new RepeatSettings(
        positiveInt("crawl-span", crawlSpan),
        positiveInt("crawl-lag", valueOrDefault("crawl-lag", "1")),
        positiveInt("repeat-interval", valueOrDefault("repeat-interval", "1")),
        optionalDate("catch-up-from-start-date"));
  }

  LocalDate requiredDate(String name) {
    LocalDate date = optionalDate(name);
    if (date == null) {
      throw new IllegalArgumentException("--" + name + " is required");
    }
    return date;
  }

  @Nullable LocalDate optionalDate(String name) {
    String raw = value(name);
    if (raw == null) {
      return null;
    }
    try {
      return LocalDate.parse(raw, DATE_FORMAT);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(
          "--" + name + " must be a date in YYYYMMDD format, got " + raw, e);
    }
  }

  private List<String> regionCodes() {
    return values("region").stream()
        .flatMap(value -> Arrays.stream(value.split(",")))
        .map(String::trim)
        .filter(code -> !code.isEmpty())
        .map(String::toUpperCase)
        .collect(Collectors.toList());
  }

  private String readQueryFile(Path path) {
    try {
      JsonNode query = objectMapper.readTree(Files.readString(path));
      if (query == null || !query.isObject()) {
        throw new IllegalArgumentException("--query-file " + path + " must hold a JSON object");
      }
      return objectMapper.writeValueAsString(query);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("--query-file " + path + " is not valid JSON", e);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read query file " + path, e);
    }
  }

  private @Nullable String value(String name) {
    List<String> values = values(name);
    if (values.size() > 1) {
      throw new IllegalArgumentException("--" + name + " given more than once");
    }
    return values.isEmpty() ? null : values.get(0);
  }

  private String valueOrDefault(String name, String defaultValue) {
    String value = value(name);
    return value == null ? defaultValue : value;
  }

  private List<String> values(String name) {
    List<String> values = args.getOptionValues(name);
    return values == null ? List.of() : values;
  }

  private static int positiveInt(String name, String raw) {
    int value;
    try {
      value = Integer.parseInt(raw);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--" + name + " must be an integer, got " + raw, e);
    }
    if (value <= 0) {
      throw new IllegalArgumentException("--" + name + " must be positive, got " + raw);
    }
    return value;
  }
}
