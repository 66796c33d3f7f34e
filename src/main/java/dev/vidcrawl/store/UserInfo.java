package dev.vidcrawl.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/** Profile of a video author, keyed by username. Replaced wholesale on every upsert. */
@Entity
@Table(name = "user_info")
public class UserInfo {

  @Id private String username;

  @Column(name = "display_name")
  private String displayName;

  @Column(name = "bio_description", columnDefinition = "TEXT")
  private String bioDescription;

  @Column(name = "avatar_url", columnDefinition = "TEXT")
  private String avatarUrl;

  @Column(name = "is_verified")
  private Boolean verified;

  @Column(name = "likes_count")
  private Long likesCount;

  @Column(name = "video_count")
  private Long videoCount;

  @Column(name = "follower_count")
  private Long followerCount;

  @Column(name = "following_count")
  private Long followingCount;

  protected UserInfo() {
    // JPA requires no-arg constructor
  }

  public UserInfo(UserInfoRecord record) {
    this.username = record.username();
    this.displayName = record.displayName();
    this.bioDescription = record.bioDescription();
    this.avatarUrl = record.avatarUrl();
    this.verified = record.isVerified();
    this.likesCount = record.likesCount();
    this.videoCount = record.videoCount();
    this.followerCount = record.followerCount();
    this.followingCount = record.followingCount();
  }

  public String getUsername() {
    return username;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getBioDescription() {
    return bioDescription;
  }

  public String getAvatarUrl() {
    return avatarUrl;
  }

  public Boolean getVerified() {
    return verified;
  }

  public Long getLikesCount() {
    return likesCount;
  }

  public Long getVideoCount() {
    return videoCount;
  }

  public Long getFollowerCount() {
    return followerCount;
  }

  public Long getFollowingCount() {
    return followingCount;
  }
}
