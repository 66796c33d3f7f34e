package dev.vidcrawl.api;

import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

public record CommentsResponse(
    List<Map<String, Object>> comments,
    @Nullable Long cursor,
    boolean hasMore,
    @Nullable ApiError error) {

  public CommentsResponse {
    comments = List.copyOf(comments);
  }

  public boolean isOk() {
    return error != null && error.isOk();
  }
}
