package dev.vidcrawl.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A video item of a search page, typed at the ingestion boundary.
 *
 * <p>Only {@code id}, {@code create_time} and {@code username} are required. Absent lists default
 * to empty, absent scalars to {@code null}.
 *
 * @param createTime seconds since the epoch
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VideoRecord(
    @NotNull @JsonProperty("id") Long id,
    @NotNull @JsonProperty("create_time") Long createTime,
    @NotBlank @JsonProperty("username") String username,
    @JsonProperty("region_code") @Nullable String regionCode,
    @JsonProperty("video_description") @Nullable String videoDescription,
    @JsonProperty("music_id") @Nullable Long musicId,
    @JsonProperty("like_count") @Nullable Long likeCount,
    @JsonProperty("comment_count") @Nullable Long commentCount,
    @JsonProperty("share_count") @Nullable Long shareCount,
    @JsonProperty("view_count") @Nullable Long viewCount,
    @JsonProperty("playlist_id") @Nullable Long playlistId,
    @JsonProperty("voice_to_text") @Nullable String voiceToText,
    @JsonProperty("hashtag_names") List<String> hashtagNames,
    @JsonProperty("effect_ids") List<String> effectIds) {

  public VideoRecord {
    hashtagNames = hashtagNames == null ? List.of() : List.copyOf(hashtagNames);
    effectIds = effectIds == null ? List.of() : List.copyOf(effectIds);
  }

  public Instant createInstant() {
    return Instant.ofEpochSecond(createTime);
  }
}
