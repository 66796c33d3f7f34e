package dev.vidcrawl.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes raw response bodies to {@code vidcrawl.api.raw-responses-output-dir}, one file per
 * response named {@code <epoch-millis>.json}. Existing files are never overwritten; a clash within
 * the same millisecond gets a numeric suffix.
 */
@Component
public class RawResponseArchiver {

  private static final Logger log = LoggerFactory.getLogger(RawResponseArchiver.class);

  private final @Nullable Path outputDir;
  private final Clock clock;

  public RawResponseArchiver(ResearchApiProperties properties, Clock clock) {
    this(properties.rawResponsesOutputDir(), clock);
  }

  RawResponseArchiver(@Nullable Path outputDir, Clock clock) {
    this.outputDir = outputDir;
    this.clock = clock;
  }

  public boolean isEnabled() {
    return outputDir != null;
  }

  /**
   * Archives one response body.
   *
   * @return the written file, or empty when archiving is disabled
   */
  public Optional<Path> archive(String body) {
    if (outputDir == null) {
      return Optional.empty();
    }
    try {
      Files.createDirectories(outputDir);
      long millis = clock.millis();
      for (int suffix = 0; ; suffix++) {
        String name = suffix == 0 ? millis + ".json" : millis + "-" + suffix + ".json";
        Path file = outputDir.resolve(name);
        try {
          Files.writeString(
              file, body, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
          log.info("Raw response written to {}", file);
          return Optional.of(file);
        } catch (FileAlreadyExistsException e) {
          log.debug("{} already exists, trying next suffix", file);
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to archive raw response under " + outputDir, e);
    }
  }
}
