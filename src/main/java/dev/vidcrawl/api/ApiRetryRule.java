package dev.vidcrawl.api;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Predicate;
import org.springframework.retry.RetryContext;

/**
 * One (predicate, wait) pair of the semantic retry layer. The predicate sees the failed attempt
 * through the Spring Retry context: {@link RetryContext#getLastThrowable()} is the failure and
 * {@link RetryContext#getRetryCount()} the number of attempts made so far.
 *
 * @param name label used in debug logging
 * @param predicate whether this rule asks for another attempt
 * @param delay this rule's contribution to the wait before the next attempt
 */
public record ApiRetryRule(
    String name, Predicate<RetryContext> predicate, Function<RetryContext, Duration> delay) {

  public boolean matches(RetryContext context) {
    return context.getLastThrowable() != null && predicate.test(context);
  }

  public Duration waitFor(RetryContext context) {
    return delay.apply(context);
  }
}
