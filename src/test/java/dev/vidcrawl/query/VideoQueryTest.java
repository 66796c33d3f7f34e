package dev.vidcrawl.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class VideoQueryTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void serializesConditionsAndOmitsEmptyGroups() throws Exception {
    VideoQuery query =
        new VideoQuery(
            List.of(new Condition(Field.REGION_CODE, List.of("US", "CA"), Operation.IN)),
            List.of(),
            List.of(Condition.of(Field.HASHTAG_NAME, "spam", Operation.EQ)));

    assertThat(objectMapper.writeValueAsString(query))
        .isEqualTo(
            "{\"and\":[{\"operation\":\"IN\",\"field_name\":\"region_code\","
                + "\"field_values\":[\"US\",\"CA\"]}],"
                + "\"not\":[{\"operation\":\"EQ\",\"field_name\":\"hashtag_name\","
                + "\"field_values\":[\"spam\"]}]}");
  }

  @Test
  void queryWithoutConditionsIsRejected() {
    assertThatThrownBy(() -> new VideoQuery(List.of(), List.of(), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void conditionValuesAreValidatedAgainstTheirField() {
    assertThatThrownBy(() -> Condition.of(Field.REGION_CODE, "ZZ", Operation.EQ))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("region_code");
    assertThatThrownBy(() -> Condition.of(Field.VIDEO_LENGTH, "TINY", Operation.EQ))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Condition.of(Field.CREATE_DATE, "2024-03-01", Operation.GTE))
        .isInstanceOf(IllegalArgumentException.class);

    assertThat(Condition.of(Field.CREATE_DATE, "20240301", Operation.GTE).values())
        .containsExactly("20240301");
    assertThat(Condition.of(Field.VIDEO_LENGTH, "LONG", Operation.EQ).values())
        .containsExactly("LONG");
  }

  @Test
  void conditionWithoutValuesIsRejected() {
    assertThatThrownBy(() -> new Condition(Field.KEYWORD, List.of(), Operation.IN))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
