package dev.vidcrawl.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * Builds a {@link VideoQuery} from command-line style options.
 *
 * <p>"Any" options become one {@code IN} condition over the normalized, deduplicated, sorted
 * values; "all" options become one {@code EQ} condition per value. Inclusions and region codes go
 * to {@code and}, exclusions to {@code not}.
 */
public final class QueryGenerator {

  private QueryGenerator() {}

  public static VideoQuery generate(QueryOptions options) {
    List<Condition> and = new ArrayList<>();
    List<Condition> not = new ArrayList<>();

    addAnyOrAll(
        and,
        Field.HASHTAG_NAME,
        options.includeAnyHashtags(),
        options.includeAllHashtags(),
        QueryGenerator::normalizeHashtag);
    addAnyOrAll(
        not,
        Field.HASHTAG_NAME,
        options.excludeAnyHashtags(),
        options.excludeAllHashtags(),
        QueryGenerator::normalizeHashtag);
    addAnyOrAll(
        and,
        Field.KEYWORD,
        options.includeAnyKeywords(),
        options.includeAllKeywords(),
        QueryGenerator::normalizeKeyword);
    addAnyOrAll(
        not,
        Field.KEYWORD,
        options.excludeAnyKeywords(),
        options.excludeAllKeywords(),
        QueryGenerator::normalizeKeyword);

    if (options.onlyFromUsernames() != null) {
      and.add(
          anyCondition(
              Field.USERNAME, options.onlyFromUsernames(), QueryGenerator::normalizeUsername));
    }
    if (options.excludeFromUsernames() != null) {
      not.add(
          anyCondition(
              Field.USERNAME, options.excludeFromUsernames(), QueryGenerator::normalizeUsername));
    }
    if (!options.regionCodes().isEmpty()) {
      List<String> regions = List.copyOf(new TreeSet<>(options.regionCodes()));
      and.add(new Condition(Field.REGION_CODE, regions, Operation.IN));
    }

    return new VideoQuery(and, List.of(), not);
  }

  /** Lower-cased, without leading {@code #}. */
  public static String normalizeHashtag(String hashtag) {
    int start = 0;
    while (start < hashtag.length() && hashtag.charAt(start) == '#') {
      start++;
    }
    return hashtag.substring(start).toLowerCase(Locale.ROOT);
  }

  public static String normalizeKeyword(String keyword) {
    return keyword.toLowerCase(Locale.ROOT);
  }

  /** Lower-cased, without {@code @} at either end. */
  public static String normalizeUsername(String username) {
    int start = 0;
    int end = username.length();
    while (start < end && username.charAt(start) == '@') {
      start++;
    }
    while (end > start && username.charAt(end - 1) == '@') {
      end--;
    }
    return username.substring(start, end).toLowerCase(Locale.ROOT);
  }

  /** Splits on commas, normalizes each value, and returns the distinct values in sorted order. */
  public static List<String> normalizedSortedSet(
      String commaSeparated, UnaryOperator<String> normalizer) {
    TreeSet<String> values = new TreeSet<>();
    Arrays.stream(commaSeparated.split(",", -1)).map(normalizer).forEach(values::add);
    return List.copyOf(values);
  }

  private static void addAnyOrAll(
      List<Condition> target,
      Field field,
      @Nullable String any,
      @Nullable String all,
      UnaryOperator<String> normalizer) {
    if (any != null) {
      target.add(anyCondition(field, any, normalizer));
    } else if (all != null) {
      for (String value : normalizedSortedSet(all, normalizer)) {
        target.add(Condition.of(field, value, Operation.EQ));
      }
    }
  }

  private static Condition anyCondition(
      Field field, String values, UnaryOperator<String> normalizer) {
    return new Condition(field, normalizedSortedSet(values, normalizer), Operation.IN);
  }
}
