package dev.vidcrawl.api;

import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A decoded page of video results. Items stay as loosely-typed maps; they are mapped and validated
 * when they are stored.
 */
public record VideoResponse(
    List<Map<String, Object>> videos,
    @Nullable Long cursor,
    boolean hasMore,
    @Nullable String searchId,
    @Nullable ApiError error) {

  public VideoResponse {
    videos = List.copyOf(videos);
  }
}
