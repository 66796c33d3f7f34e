package dev.vidcrawl.query;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Inputs of {@link QueryGenerator}. Text options are comma-separated lists. The "any" and "all"
 * variants of the same option are mutually exclusive.
 */
public record QueryOptions(
    List<String> regionCodes,
    @Nullable String includeAnyHashtags,
    @Nullable String includeAllHashtags,
    @Nullable String excludeAnyHashtags,
    @Nullable String excludeAllHashtags,
    @Nullable String includeAnyKeywords,
    @Nullable String includeAllKeywords,
    @Nullable String excludeAnyKeywords,
    @Nullable String excludeAllKeywords,
    @Nullable String onlyFromUsernames,
    @Nullable String excludeFromUsernames) {

  public QueryOptions {
    regionCodes = regionCodes == null ? List.of() : List.copyOf(regionCodes);
    requireExclusive(
        includeAnyHashtags, includeAllHashtags, "include-any-hashtags", "include-all-hashtags");
    requireExclusive(
        excludeAnyHashtags, excludeAllHashtags, "exclude-any-hashtags", "exclude-all-hashtags");
    requireExclusive(
        includeAnyKeywords, includeAllKeywords, "include-any-keywords", "include-all-keywords");
    requireExclusive(
        excludeAnyKeywords, excludeAllKeywords, "exclude-any-keywords", "exclude-all-keywords");
    for (String region : regionCodes) {
      if (!Field.isRegionCode(region)) {
        throw new IllegalArgumentException("Unknown region code: " + region);
      }
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEmpty() {
    return regionCodes.isEmpty()
        && includeAnyHashtags == null
        && includeAllHashtags == null
        && excludeAnyHashtags == null
        && excludeAllHashtags == null
        && includeAnyKeywords == null
        && includeAllKeywords == null
        && excludeAnyKeywords == null
        && excludeAllKeywords == null
        && onlyFromUsernames == null
        && excludeFromUsernames == null;
  }

  private static void requireExclusive(
      @Nullable String any, @Nullable String all, String anyName, String allName) {
    if (any != null && all != null) {
      throw new IllegalArgumentException(
          "--" + anyName + " and --" + allName + " are mutually exclusive");
    }
  }

  /** Mutable builder, mostly for command-line parsing. */
  public static final class Builder {
    private List<String> regionCodes = List.of();
    private @Nullable String includeAnyHashtags;
    private @Nullable String includeAllHashtags;
    private @Nullable String excludeAnyHashtags;
    private @Nullable String excludeAllHashtags;
    private @Nullable String includeAnyKeywords;
    private @Nullable String includeAllKeywords;
    private @Nullable String excludeAnyKeywords;
    private @Nullable String excludeAllKeywords;
    private @Nullable String onlyFromUsernames;
    private @Nullable String excludeFromUsernames;

    private Builder() {}

    public Builder regionCodes(List<String> regionCodes) {
      this.regionCodes = regionCodes;
      return this;
    }

    public Builder includeAnyHashtags(@Nullable String value) {
      this.includeAnyHashtags = value;
      return this;
    }

    public Builder includeAllHashtags(@Nullable String value) {
      this.includeAllHashtags = value;
      return this;
    }

    public Builder excludeAnyHashtags(@Nullable String value) {
      this.excludeAnyHashtags = value;
      return this;
    }

    public Builder excludeAllHashtags(@Nullable String value) {
      this.excludeAllHashtags = value;
      return this;
    }

    public Builder includeAnyKeywords(@Nullable String value) {
      this.includeAnyKeywords = value;
      return this;
    }

    public Builder includeAllKeywords(@Nullable String value) {
      this.includeAllKeywords = value;
      return this;
    }

    public Builder excludeAnyKeywords(@Nullable String value) {
      this.excludeAnyKeywords = value;
      return this;
    }

    public Builder excludeAllKeywords(@Nullable String value) {
      this.excludeAllKeywords = value;
      return this;
    }

    public Builder onlyFromUsernames(@Nullable String value) {
      this.onlyFromUsernames = value;
      return this;
    }

    public Builder excludeFromUsernames(@Nullable String value) {
      this.excludeFromUsernames = value;
      return this;
    }

    public QueryOptions build() {
      return new QueryOptions(
          regionCodes,
          includeAnyHashtags,
          includeAllHashtags,
          excludeAnyHashtags,
          excludeAllHashtags,
          includeAnyKeywords,
          includeAllKeywords,
          excludeAnyKeywords,
          excludeAllKeywords,
          onlyFromUsernames,
          excludeFromUsernames);
    }
  }
}
