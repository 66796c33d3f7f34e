package dev.vidcrawl.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * Exponential back-off for transport failures: after attempt {@code n} the wait is {@code
 * multiplier * 2^(n-1)} clamped to {@code [min, max]}.
 */
public class ClampedExponentialBackOffPolicy implements BackOffPolicy {

  private static final Logger log = LoggerFactory.getLogger(ClampedExponentialBackOffPolicy.class);

  private final long multiplierMs;
  private final long minWaitMs;
  private final long maxWaitMs;
  private final Sleeper sleeper;

  public ClampedExponentialBackOffPolicy(
      long multiplierMs, long minWaitMs, long maxWaitMs, Sleeper sleeper) {
    this.multiplierMs = multiplierMs;
    this.minWaitMs = minWaitMs;
    this.maxWaitMs = maxWaitMs;
    this.sleeper = sleeper;
  }

  @Override
  public BackOffContext start(RetryContext context) {
    return new RetryContextBackOffContext(context);
  }

  @Override
  public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
    RetryContext context = ((RetryContextBackOffContext) backOffContext).retryContext();
    long wait = waitMillis(context.getRetryCount());
    log.debug(
        "Transport attempt {} failed with {}; retrying in {} ms",
        context.getRetryCount(),
        context.getLastThrowable(),
        wait);
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackOffInterruptedException("Interrupted while waiting to retry", e);
    }
  }

  long waitMillis(int attempt) {
    // 2^62 already exceeds any sensible cap
    int exponent = Math.min(Math.max(attempt - 1, 0), 62);
    double raw = multiplierMs * Math.pow(2, exponent);
    return (long) Math.max(minWaitMs, Math.min(maxWaitMs, raw));
  }
}
