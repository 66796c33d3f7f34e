package dev.vidcrawl.api;

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.context.RetryContextSupport;

/**
 * Retries while ANY rule matches the last failure, up to an optional cap on the total number of
 * attempts. The cap applies to every rule, not only the rate-limit one.
 */
public class CompositeApiRetryPolicy implements RetryPolicy {

  private final List<ApiRetryRule> rules;
  private final @Nullable Integer maxAttempts;

  public CompositeApiRetryPolicy(List<ApiRetryRule> rules, @Nullable Integer maxAttempts) {
    this.rules = List.copyOf(rules);
    this.maxAttempts = maxAttempts;
  }

  @Override
  public boolean canRetry(RetryContext context) {
    if (context.getLastThrowable() == null) {
      return true;
    }
    if (maxAttempts != null && context.getRetryCount() >= maxAttempts) {
      return false;
    }
    return rules.stream().anyMatch(rule -> rule.matches(context));
  }

  @Override
  public RetryContext open(RetryContext parent) {
    return new RetryContextSupport(parent);
  }

  @Override
  public void close(RetryContext context) {}

  @Override
  public void registerThrowable(RetryContext context, Throwable throwable) {
    ((RetryContextSupport) context).registerThrowable(throwable);
  }

  @Override
  public int getMaxAttempts() {
    return maxAttempts == null ? NO_MAXIMUM_ATTEMPTS_SET : maxAttempts;
  }
}
