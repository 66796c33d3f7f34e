package dev.vidcrawl.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/** One page of comments for a video; the API refuses cursors above 999. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommentsRequest(
    @JsonProperty("video_id") long videoId,
    @JsonProperty("max_count") int maxCount,
    @JsonProperty("cursor") @Nullable Long cursor) {

  public static final int DEFAULT_MAX_COUNT = 100;

  public static CommentsRequest firstPage(long videoId) {
    return new CommentsRequest(videoId, DEFAULT_MAX_COUNT, null);
  }
}
