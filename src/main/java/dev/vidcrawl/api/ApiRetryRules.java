package dev.vidcrawl.api;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Factory for the rules of the semantic retry layer, in evaluation order. */
public final class ApiRetryRules {

  private static final Logger log = LoggerFactory.getLogger(ApiRetryRules.class);

  static final Duration FOUR_HOURS = Duration.ofHours(4);

  private ApiRetryRules() {}

  public static List<ApiRetryRule> standard(ResearchApiProperties properties, Clock clock) {
    ResearchApiProperties.InvalidSearchIdRetry searchIdRetry = properties.invalidSearchIdRetry();
    return List.of(
        retryDecodingErrorOnce(),
        retryInvalidSearchId(searchIdRetry.maxRetries(), Duration.ofMillis(searchIdRetry.waitMs())),
        retryRateLimit(properties.rateLimitWaitStrategy(), clock));
  }

  /** A body that is not JSON is retried once, immediately. */
  public static ApiRetryRule retryDecodingErrorOnce() {
    return new ApiRetryRule(
        "decoding-error",
        context ->
            context.getLastThrowable() instanceof ResponseDecodingException
                && context.getRetryCount() <= 1,
        context -> Duration.ZERO);
  }

  /** Rejected search ids and cursors are retried a bounded number of times with a fixed wait. */
  public static ApiRetryRule retryInvalidSearchId(int maxRetries, Duration wait) {
    return new ApiRetryRule(
        "invalid-search-id",
        context -> {
          Throwable error = context.getLastThrowable();
          return (error instanceof InvalidSearchIdException
                  || error instanceof InvalidCountOrCursorException)
              && context.getRetryCount() <= maxRetries;
        },
        context -> wait);
  }

  /** Rate limits always match; only the global attempt cap stops them. */
  public static ApiRetryRule retryRateLimit(RateLimitWaitStrategy strategy, Clock clock) {
    return new ApiRetryRule(
        "rate-limit",
        context -> context.getLastThrowable() instanceof ApiRateLimitException,
        context -> {
          Duration wait = rateLimitWait(strategy, clock);
          log.warn(
              "API rate limit reached after {} attempt(s). Waiting {} until {}",
              context.getRetryCount(),
              wait,
              ZonedDateTime.now(clock).plus(wait));
          return wait;
        });
  }

  static Duration rateLimitWait(RateLimitWaitStrategy strategy, Clock clock) {
    return switch (strategy) {
      case WAIT_FOUR_HOURS -> FOUR_HOURS;
      case WAIT_NEXT_UTC_MIDNIGHT -> untilNextUtcMidnight(clock);
    };
  }

  static Duration untilNextUtcMidnight(Clock clock) {
    ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
    ZonedDateTime nextMidnight = now.toLocalDate().plusDays(1).atStartOfDay(ZoneOffset.UTC);
    return Duration.between(now, nextMidnight).truncatedTo(ChronoUnit.SECONDS);
  }
}
