package dev.vidcrawl.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import org.jspecify.annotations.Nullable;

/**
 * @param createTime seconds since the epoch
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommentRecord(
    @NotNull @JsonProperty("id") Long id,
    @NotNull @JsonProperty("video_id") Long videoId,
    @JsonProperty("text") @Nullable String text,
    @JsonProperty("parent_comment_id") @Nullable Long parentCommentId,
    @JsonProperty("like_count") @Nullable Long likeCount,
    @JsonProperty("reply_count") @Nullable Long replyCount,
    @NotNull @JsonProperty("create_time") Long createTime) {}
