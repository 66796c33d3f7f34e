package dev.vidcrawl.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.vidcrawl.fixture.VideoItems;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ApiRecordMapperTest {

  private static ValidatorFactory validatorFactory;
  private static Validator validator;

  private final ObjectMapper objectMapper = new ObjectMapper();

  @BeforeAll
  static void createValidator() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
    validator = validatorFactory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    validatorFactory.close();
  }

  private ApiRecordMapper mapper() {
    return new ApiRecordMapper(objectMapper, validator);
  }

  @Test
  void mapsVideoItemsAndDefaultsAbsentLists() {
    Map<String, Object> item = new HashMap<>(VideoItems.video(42L, "alice", "cats"));
    item.put("effect_ids", null);
    item.put("unexpected_field", "ignored");

    List<VideoRecord> records = mapper().toVideoRecords(List.of(item));

    VideoRecord record = records.get(0);
    assertThat(record.id()).isEqualTo(42L);
    assertThat(record.username()).isEqualTo("alice");
    assertThat(record.hashtagNames()).containsExactly("cats");
    assertThat(record.effectIds()).isEmpty();
    assertThat(record.createInstant().getEpochSecond()).isEqualTo(VideoItems.CREATE_TIME);
  }

  @Test
  void oneInvalidItemRejectsTheWholeBatch() {
    Map<String, Object> missingUsername = new HashMap<>(VideoItems.video(2L, "bob"));
    missingUsername.remove("username");

    assertThatThrownBy(
            () -> mapper().toVideoRecords(List.of(VideoItems.video(1L, "alice"), missingUsername)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Item 1")
        .hasMessageContaining("username");
  }

  @Test
  void unreadableItemIsRejected() {
    Map<String, Object> item = new HashMap<>(VideoItems.video(1L, "alice"));
    item.put("like_count", "many");

    assertThatThrownBy(() -> mapper().toVideoRecords(List.of(item)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("VideoRecord");
  }

  @Test
  void mapsUserInfoAndComments() {
    List<UserInfoRecord> users =
        mapper()
            .toUserInfoRecords(
                List.of(Map.of("username", "alice", "follower_count", 12, "is_verified", true)));
    List<CommentRecord> comments =
        mapper()
            .toCommentRecords(
                List.of(
                    Map.of("id", 9, "video_id", 1, "text", "hi", "create_time", 1_709_251_200)));

    assertThat(users.get(0).followerCount()).isEqualTo(12L);
    assertThat(users.get(0).isVerified()).isTrue();
    assertThat(comments.get(0).videoId()).isEqualTo(1L);
    assertThat(comments.get(0).text()).isEqualTo("hi");
  }

  @Test
  void commentWithoutCreateTimeIsRejected() {
    assertThatThrownBy(() -> mapper().toCommentRecords(List.of(Map.of("id", 9, "video_id", 1))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("createTime");
  }
}
