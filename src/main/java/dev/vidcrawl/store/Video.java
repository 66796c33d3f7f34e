package dev.vidcrawl.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

/**
 * A video keyed by the API's own id.
 *
 * <p>Scalar fields are fully replaced on every upsert. Relation sets only grow: hashtags, effects,
 * crawl tags and observing crawls are unioned with what is already stored.
 *
 * <p>Relation sets are loaded lazily, one query per set for up to a page of videos at a time.
 */
@Entity
@Table(name = "video")
public class Video implements Persistable<Long> {

  @Id private Long id;

  @Column(name = "create_time", nullable = false)
  private Instant createTime;

  @Column(nullable = false)
  private String username;

  @Column(name = "region_code")
  private String regionCode;

  @Column(name = "video_description", columnDefinition = "TEXT")
  private String videoDescription;

  @Column(name = "music_id")
  private Long musicId;

  @Column(name = "like_count")
  private Long likeCount;

  @Column(name = "comment_count")
  private Long commentCount;

  @Column(name = "share_count")
  private Long shareCount;

  @Column(name = "view_count")
  private Long viewCount;

  @Column(name = "playlist_id")
  private Long playlistId;

  @Column(name = "voice_to_text", columnDefinition = "TEXT")
  private String voiceToText;

  @Column(name = "crawled_at", nullable = false, updatable = false)
  private Instant crawledAt;

  @Column(name = "crawled_updated_at")
  private Instant crawledUpdatedAt;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "extra_data", columnDefinition = "JSONB")
  private Map<String, Object> extraData;

  @ManyToMany
  @BatchSize(size = 100)
  @JoinTable(
      name = "videos_to_hashtags",
      joinColumns = @JoinColumn(name = "video_id"),
      inverseJoinColumns = @JoinColumn(name = "hashtag_id"))
  private Set<Hashtag> hashtags = new HashSet<>();

  @ManyToMany
  @BatchSize(size = 100)
  @JoinTable(
      name = "videos_to_effect_ids",
      joinColumns = @JoinColumn(name = "video_id"),
      inverseJoinColumns = @JoinColumn(name = "effect_id"))
  private Set<Effect> effects = new HashSet<>();

  @ManyToMany
  @BatchSize(size = 100)
  @JoinTable(
      name = "videos_to_crawl_tags",
      joinColumns = @JoinColumn(name = "video_id"),
      inverseJoinColumns = @JoinColumn(name = "crawl_tag_id"))
  private Set<CrawlTag> crawlTags = new HashSet<>();

  @ManyToMany
  @BatchSize(size = 100)
  @JoinTable(
      name = "videos_to_crawls",
      joinColumns = @JoinColumn(name = "video_id"),
      inverseJoinColumns = @JoinColumn(name = "crawl_id"))
  private Set<Crawl> crawls = new HashSet<>();

  @Transient private boolean isNew = true;

  protected Video() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a video first seen at {@code crawledAt}. Scalars are filled by {@link
   * #replaceScalars}.
   */
  public Video(Long id, Instant crawledAt) {
    this.id = id;
    this.crawledAt = crawledAt;
  }

  @PostLoad
  @PostPersist
  void markNotNew() {
    this.isNew = false;
  }

  @Override
  public boolean isNew() {
    return isNew;
  }

  /**
   * Overwrites every scalar with the record's value, including fields the record leaves empty.
   * The first-seen timestamp is kept.
   */
  public void replaceScalars(VideoRecord record, Instant updatedAt) {
    this.createTime = record.createInstant();
    this.username = record.username();
    this.regionCode = record.regionCode();
    this.videoDescription = record.videoDescription();
    this.musicId = record.musicId();
    this.likeCount = record.likeCount();
    this.commentCount = record.commentCount();
    this.shareCount = record.shareCount();
    this.viewCount = record.viewCount();
    this.playlistId = record.playlistId();
    this.voiceToText = record.voiceToText();
    this.crawledUpdatedAt = updatedAt;
  }

  public void addHashtags(Collection<Hashtag> hashtags) {
    this.hashtags.addAll(hashtags);
  }

  public void addEffects(Collection<Effect> effects) {
    this.effects.addAll(effects);
  }

  public void addCrawlTags(Collection<CrawlTag> crawlTags) {
    this.crawlTags.addAll(crawlTags);
  }

  public void addCrawl(Crawl crawl) {
    this.crawls.add(crawl);
  }

  @Override
  public Long getId() {
    return id;
  }

  public Instant getCreateTime() {
    return createTime;
  }

  public String getUsername() {
    return username;
  }

  public String getRegionCode() {
    return regionCode;
  }

  public String getVideoDescription() {
    return videoDescription;
  }

  public Long getMusicId() {
    return musicId;
  }

  public Long getLikeCount() {
    return likeCount;
  }

  public Long getCommentCount() {
    return commentCount;
  }

  public Long getShareCount() {
    return shareCount;
  }

  public Long getViewCount() {
    return viewCount;
  }

  public Long getPlaylistId() {
    return playlistId;
  }

  public String getVoiceToText() {
    return voiceToText;
  }

  public Instant getCrawledAt() {
    return crawledAt;
  }

  public Instant getCrawledUpdatedAt() {
    return crawledUpdatedAt;
  }

  public Map<String, Object> getExtraData() {
    return extraData == null ? Map.of() : Collections.unmodifiableMap(extraData);
  }

  public Set<Hashtag> getHashtags() {
    return Collections.unmodifiableSet(hashtags);
  }

  public Set<Effect> getEffects() {
    return Collections.unmodifiableSet(effects);
  }

  public Set<CrawlTag> getCrawlTags() {
    return Collections.unmodifiableSet(crawlTags);
  }

  public Set<Crawl> getCrawls() {
    return Collections.unmodifiableSet(crawls);
  }
}
