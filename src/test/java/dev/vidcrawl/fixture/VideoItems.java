package dev.vidcrawl.fixture;

import dev.vidcrawl.store.VideoRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Raw API video items and typed records for tests. */
public final class VideoItems {

  public static final long CREATE_TIME = 1_709_251_200L;

  private VideoItems() {}

  /** A raw item as the API returns it. */
  public static Map<String, Object> video(long id, String username, String... hashtags) {
    Map<String, Object> item = new LinkedHashMap<>();
    item.put("id", id);
    item.put("create_time", CREATE_TIME);
    item.put("username", username);
    item.put("region_code", "US");
    item.put("video_description", "video " + id);
    item.put("like_count", 10L);
    item.put("hashtag_names", List.of(hashtags));
    return item;
  }

  /** {@code count} consecutive items starting at {@code firstId}. */
  public static List<Map<String, Object>> videos(long firstId, int count) {
    List<Map<String, Object>> items = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      items.add(video(firstId + i, "user" + (firstId + i)));
    }
    return items;
  }

  public static VideoRecord record(
      long id, String username, List<String> hashtags, List<String> effectIds) {
    return new VideoRecord(
        id,
        CREATE_TIME,
        username,
        "US",
        "video " + id,
        null,
        10L,
        null,
        null,
        null,
        null,
        null,
        hashtags,
        effectIds);
  }
}
