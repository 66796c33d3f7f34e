package dev.vidcrawl.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** A comment on a video, keyed by the API's comment id. Replaced wholesale on every upsert. */
@Entity
@Table(name = "comment")
public class Comment {

  @Id private Long id;

  @Column(name = "video_id", nullable = false)
  private Long videoId;

  @Column(columnDefinition = "TEXT")
  private String text;

  @Column(name = "parent_comment_id")
  private Long parentCommentId;

  @Column(name = "like_count")
  private Long likeCount;

  @Column(name = "reply_count")
  private Long replyCount;

  @Column(name = "create_time", nullable = false)
  private Instant createTime;

  protected Comment() {
    // JPA requires no-arg constructor
  }

  public Comment(CommentRecord record) {
    this.id = record.id();
    this.videoId = record.videoId();
    this.text = record.text();
    this.parentCommentId = record.parentCommentId();
    this.likeCount = record.likeCount();
    this.replyCount = record.replyCount();
    this.createTime = Instant.ofEpochSecond(record.createTime());
  }

  public Long getId() {
    return id;
  }

  public Long getVideoId() {
    return videoId;
  }

  public String getText() {
    return text;
  }

  public Long getParentCommentId() {
    return parentCommentId;
  }

  public Long getLikeCount() {
    return likeCount;
  }

  public Long getReplyCount() {
    return replyCount;
  }

  public Instant getCreateTime() {
    return createTime;
  }
}
