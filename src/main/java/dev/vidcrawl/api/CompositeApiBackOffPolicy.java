package dev.vidcrawl.api;

import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/** Waits the SUM of the waits of every rule matching the last failure; non-matching rules add 0. */
public class CompositeApiBackOffPolicy implements BackOffPolicy {

  private static final Logger log = LoggerFactory.getLogger(CompositeApiBackOffPolicy.class);

  private final List<ApiRetryRule> rules;
  private final Sleeper sleeper;

  public CompositeApiBackOffPolicy(List<ApiRetryRule> rules, Sleeper sleeper) {
    this.rules = List.copyOf(rules);
    this.sleeper = sleeper;
  }

  @Override
  public BackOffContext start(RetryContext context) {
    return new RetryContextBackOffContext(context);
  }

  @Override
  public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
    RetryContext context = ((RetryContextBackOffContext) backOffContext).retryContext();
    Duration wait =
        rules.stream()
            .filter(rule -> rule.matches(context))
            .map(rule -> rule.waitFor(context))
            .reduce(Duration.ZERO, Duration::plus);
    log.debug(
        "Retrying after attempt {} failed with {}; sleeping {}",
        context.getRetryCount(),
        context.getLastThrowable(),
        wait);
    try {
      sleeper.sleep(wait.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackOffInterruptedException("Interrupted while waiting to retry", e);
    }
  }
}
