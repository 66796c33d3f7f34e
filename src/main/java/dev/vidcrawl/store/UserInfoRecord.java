package dev.vidcrawl.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UserInfoRecord(
    @NotBlank @JsonProperty("username") String username,
    @JsonProperty("display_name") @Nullable String displayName,
    @JsonProperty("bio_description") @Nullable String bioDescription,
    @JsonProperty("avatar_url") @Nullable String avatarUrl,
    @JsonProperty("is_verified") @Nullable Boolean isVerified,
    @JsonProperty("likes_count") @Nullable Long likesCount,
    @JsonProperty("video_count") @Nullable Long videoCount,
    @JsonProperty("follower_count") @Nullable Long followerCount,
    @JsonProperty("following_count") @Nullable Long followingCount) {}
