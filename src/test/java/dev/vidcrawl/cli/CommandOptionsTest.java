package dev.vidcrawl.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vidcrawl.crawl.CrawlLimits;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

class CommandOptionsTest {

  @TempDir Path tempDir;

  private static CommandOptions options(String... args) {
    return new CommandOptions(new DefaultApplicationArguments(args), new ObjectMapper());
  }

  @Test
  void queryFileIsReadAndCompacted() throws Exception {
    Path file = tempDir.resolve("query.json");
    Files.writeString(file, "{\n  \"and\": [ ]\n}\n");

    assertThat(options("--query-file=" + file).queryJson()).isEqualTo("{\"and\":[]}");
  }

  @Test
  void queryFileMustHoldAnObject() throws Exception {
    Path file = tempDir.resolve("query.json");
    Files.writeString(file, "[1, 2]");

    assertThatThrownBy(() -> options("--query-file=" + file).queryJson())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("JSON object");
  }

  @Test
  void invalidJsonInQueryFileIsRejected() throws Exception {
    Path file = tempDir.resolve("query.json");
    Files.writeString(file, "{not json");

    assertThatThrownBy(() -> options("--query-file=" + file).queryJson())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("not valid JSON");
  }

  @Test
  void maxApiRequestsMustBePositive() {
    assertThatThrownBy(() -> options("--max-api-requests=0").limits())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("--max-api-requests");
    assertThat(options().limits()).isEqualTo(CrawlLimits.unlimited());
  }

  @Test
  void singleValuedOptionGivenTwiceIsRejected() {
    assertThatThrownBy(() -> options("--crawl-span=1", "--crawl-span=2").repeatSettings())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("more than once");
  }
}
