package dev.vidcrawl.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vidcrawl.query.QueryGenerator;
import java.io.PrintStream;
import java.util.List;
import org.springframework.boot.DefaultApplicationArguments;

/**
 * {@code print-query}: prints the query built from the query options. Needs neither the database
 * nor the API, so it runs before any application context is started.
 */
public final class PrintQueryCommand {

  static final String NAME = "print-query";

  private PrintQueryCommand() {}

  /** True when the first non-option argument is {@code print-query}. */
  public static boolean isRequested(String... args) {
    List<String> commands = new DefaultApplicationArguments(args).getNonOptionArgs();
    return !commands.isEmpty() && NAME.equals(commands.get(0));
  }

  public static void run(String[] args, PrintStream out) {
    ObjectMapper objectMapper = new ObjectMapper();
    CommandOptions options =
        new CommandOptions(new DefaultApplicationArguments(args), objectMapper);
    print(options, objectMapper, out);
  }

  static void print(CommandOptions options, ObjectMapper objectMapper, PrintStream out) {
    try {
      out.println(
          objectMapper
              .writerWithDefaultPrettyPrinter()
              .writeValueAsString(QueryGenerator.generate(options.queryOptions())));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize query", e);
    }
  }
}
