package dev.vidcrawl.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalised configuration for the research API client, bound from {@code vidcrawl.api.*}.
 *
 * @param videoQueryUrl endpoint for video search pages
 * @param userInfoUrl endpoint for user profile lookups
 * @param commentListUrl endpoint for paged video comments
 * @param tokenUrl OAuth client-credentials endpoint
 * @param credentialsFile YAML file holding {@code client_id}, {@code client_secret} and {@code
 *     client_key}
 * @param rawResponsesOutputDir when set, every successful response body is archived here
 * @param rateLimitWaitStrategy how long to wait after HTTP 429
 * @param maxRateLimitRetries total attempt cap for the semantic retry layer; {@code null} retries
 *     rate limits indefinitely
 * @param connectTimeoutMs TCP connect timeout
 * @param readTimeoutMs response read timeout
 * @param transportRetry exponential retry on I/O failures
 * @param invalidSearchIdRetry fixed retry on rejected search ids
 */
@Validated
@ConfigurationProperties(prefix = "vidcrawl.api")
public record ResearchApiProperties(
    @NotBlank String videoQueryUrl,
    @NotBlank String userInfoUrl,
    @NotBlank String commentListUrl,
    @NotBlank String tokenUrl,
    @NotNull Path credentialsFile,
    @Nullable Path rawResponsesOutputDir,
    @NotNull RateLimitWaitStrategy rateLimitWaitStrategy,
    @Nullable @Positive Integer maxRateLimitRetries,
    @Positive int connectTimeoutMs,
    @Positive int readTimeoutMs,
    @Valid @NotNull TransportRetry transportRetry,
    @Valid @NotNull InvalidSearchIdRetry invalidSearchIdRetry) {

  /** Transport-layer retry: wait is {@code multiplier * 2^(attempt-1)} clamped to [min, max]. */
  public record TransportRetry(
      @Positive int maxAttempts,
      @Positive long multiplierMs,
      @Positive long minWaitMs,
      @Positive long maxWaitMs) {}

  /** Bounded retry for the remote defect that rejects a search id it just issued. */
  public record InvalidSearchIdRetry(@Positive int maxRetries, long waitMs) {}
}
