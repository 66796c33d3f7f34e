package dev.vidcrawl.crawl;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Crawl behaviour, bound from {@code vidcrawl.crawl.*}.
 *
 * @param maxCount videos requested per page
 * @param daysPerIteration windows longer than this are split into consecutive sub-windows
 * @param raiseErrorOnPersistentApiServerError re-raise server and search-id errors that survived
 *     retries; when false the crawl stops with {@code hasMore} still true
 * @param dailyRequestQuota requests the API allows per day
 */
@Validated
@ConfigurationProperties(prefix = "vidcrawl.crawl")
public record CrawlProperties(
    @Positive int maxCount,
    @Positive int daysPerIteration,
    boolean raiseErrorOnPersistentApiServerError,
    @Positive int dailyRequestQuota) {}
