package dev.vidcrawl.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * Provides the UTC {@link Clock} and the blocking {@link Sleeper} used for rate-limit waits and
 * the pause between repeated runs. Tests replace both.
 */
@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public Sleeper sleeper() {
    return new ThreadWaitSleeper();
  }
}
