package dev.vidcrawl.query;

import com.fasterxml.jackson.annotation.JsonValue;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/** Queryable fields of the video search endpoint, each with the values it accepts. */
public enum Field {
  USERNAME("username", value -> true),
  HASHTAG_NAME("hashtag_name", value -> true),
  KEYWORD("keyword", value -> true),
  VIDEO_ID("video_id", value -> true),
  MUSIC_ID("music_id", value -> true),
  EFFECT_ID("effect_id", value -> true),
  REGION_CODE("region_code", Field::isRegionCode),
  VIDEO_LENGTH("video_length", Field::isVideoLength),
  CREATE_DATE("create_date", Field::isCreateDate);

  private static final Set<String> REGION_CODES = Set.of(Locale.getISOCountries());
  private static final Set<String> VIDEO_LENGTHS =
      Arrays.stream(VideoLength.values()).map(Enum::name).collect(Collectors.toUnmodifiableSet());

  private final String fieldName;
  private final Predicate<String> accepts;

  Field(String fieldName, Predicate<String> accepts) {
    this.fieldName = fieldName;
    this.accepts = accepts;
  }

  @JsonValue
  public String fieldName() {
    return fieldName;
  }

  /**
   * @throws IllegalArgumentException if this field does not accept {@code value}
   */
  public void validate(String value) {
    if (value == null || !accepts.test(value)) {
      throw new IllegalArgumentException("Invalid value for " + fieldName + ": " + value);
    }
  }

  public static boolean isRegionCode(String value) {
    return REGION_CODES.contains(value);
  }

  private static boolean isVideoLength(String value) {
    return VIDEO_LENGTHS.contains(value);
  }

  private static boolean isCreateDate(String value) {
    try {
      LocalDate.parse(value, DateTimeFormatter.BASIC_ISO_DATE);
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }
}
