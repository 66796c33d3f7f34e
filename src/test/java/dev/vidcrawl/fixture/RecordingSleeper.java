package dev.vidcrawl.fixture;

import java.util.ArrayList;
import java.util.List;
import org.springframework.retry.backoff.Sleeper;

/** {@link Sleeper} that records requested waits instead of blocking. */
public final class RecordingSleeper implements Sleeper {

  private final List<Long> sleeps = new ArrayList<>();

  @Override
  public void sleep(long backOffPeriod) {
    sleeps.add(backOffPeriod);
  }

  public List<Long> sleeps() {
    return List.copyOf(sleeps);
  }

  public long totalMillis() {
    return sleeps.stream().mapToLong(Long::longValue).sum();
  }
}
