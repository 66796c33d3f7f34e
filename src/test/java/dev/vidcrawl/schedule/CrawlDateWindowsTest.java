package dev.vidcrawl.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class CrawlDateWindowsTest {

  static final LocalDate TODAY = LocalDate.of(2024, 3, 20);

  @Test
  void defaultWindowEndsLagDaysBeforeToday() {
    CrawlDateWindow window = CrawlDateWindows.make(3, 1, null, TODAY);

    assertThat(window)
        .isEqualTo(new CrawlDateWindow(LocalDate.of(2024, 3, 16), LocalDate.of(2024, 3, 19)));
  }

  @Test
  void explicitStartDateIsKept() {
    CrawlDateWindow window = CrawlDateWindows.make(7, 2, LocalDate.of(2024, 1, 1), TODAY);

    assertThat(window)
        .isEqualTo(new CrawlDateWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 8)));
  }

  @Test
  void spanAndLagMustBePositive() {
    assertThatThrownBy(() -> CrawlDateWindows.make(0, 1, null, TODAY))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> CrawlDateWindows.make(1, 0, null, TODAY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void windowEndingOnTodayMinusLagIsNotBehind() {
    CrawlDateWindow atBoundary =
        new CrawlDateWindow(LocalDate.of(2024, 3, 16), LocalDate.of(2024, 3, 19));
    CrawlDateWindow oneDayEarlier =
        new CrawlDateWindow(LocalDate.of(2024, 3, 15), LocalDate.of(2024, 3, 18));

    assertThat(CrawlDateWindows.isBehindToday(atBoundary, 1, TODAY)).isFalse();
    assertThat(CrawlDateWindows.isBehindToday(oneDayEarlier, 1, TODAY)).isTrue();
  }

  @Test
  void splitCutsIntoConsecutivePiecesClippedToEnd() {
    CrawlDateWindow window =
        new CrawlDateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 18));

    assertThat(CrawlDateWindows.split(window, 7))
        .containsExactly(
            new CrawlDateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 8)),
            new CrawlDateWindow(LocalDate.of(2024, 3, 8), LocalDate.of(2024, 3, 15)),
            new CrawlDateWindow(LocalDate.of(2024, 3, 15), LocalDate.of(2024, 3, 18)));
  }

  @Test
  void singleDayWindowIsNotSplit() {
    CrawlDateWindow window =
        new CrawlDateWindow(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 1));

    assertThat(CrawlDateWindows.split(window, 7)).containsExactly(window);
  }

  @Test
  void windowEndingBeforeStartIsRejected() {
    assertThatThrownBy(
            () -> new CrawlDateWindow(LocalDate.of(2024, 3, 2), LocalDate.of(2024, 3, 1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
