package dev.vidcrawl.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * One acquisition run: a query paged from the first request until the API reports no more
 * results.
 *
 * <p>A crawl starts in memory with {@code hasMore = true} and no cursor, search id or database id.
 * The pagination engine mutates cursor, has-more, search id and extra data after every page; the
 * store assigns the id on first save. Tag names given at creation are resolved to {@link CrawlTag}
 * rows when the crawl is saved.
 *
 * <p>Maps to the {@code crawl} table managed by Flyway migrations.
 */
@Entity
@Table(name = "crawl")
public class Crawl {

  public static final String POSSIBLY_DELETED = "possibly_deleted";

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "crawl_started_at", nullable = false, updatable = false)
  private Instant crawlStartedAt;

  @Column(name = "updated_at")
  private Instant updatedAt;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String query;

  private Long cursor;

  @Column(name = "has_more", nullable = false)
  private boolean hasMore;

  @Column(name = "search_id")
  private String searchId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "extra_data", columnDefinition = "JSONB")
  private Map<String, Object> extraData;

  @ManyToMany(fetch = FetchType.EAGER)
  @JoinTable(
      name = "crawls_to_crawl_tags",
      joinColumns = @JoinColumn(name = "crawl_id"),
      inverseJoinColumns = @JoinColumn(name = "crawl_tag_id"))
  private Set<CrawlTag> crawlTags = new HashSet<>();

  @Transient private Set<String> pendingTagNames = new LinkedHashSet<>();

  protected Crawl() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a crawl that has not issued any request yet.
   *
   * @param query serialized query, stored verbatim
   * @param crawlTagNames labels to attach once the crawl is saved
   * @param startedAt creation time
   */
  public Crawl(String query, Collection<String> crawlTagNames, Instant startedAt) {
    this.query = query;
    this.crawlStartedAt = startedAt;
    this.hasMore = true;
    this.pendingTagNames.addAll(crawlTagNames);
  }

  public Long getId() {
    return id;
  }

  public Instant getCrawlStartedAt() {
    return crawlStartedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }

  public String getQuery() {
    return query;
  }

  public @Nullable Long getCursor() {
    return cursor;
  }

  public void setCursor(@Nullable Long cursor) {
    this.cursor = cursor;
  }

  public boolean isHasMore() {
    return hasMore;
  }

  public void setHasMore(boolean hasMore) {
    this.hasMore = hasMore;
  }

  public @Nullable String getSearchId() {
    return searchId;
  }

  public void setSearchId(@Nullable String searchId) {
    this.searchId = searchId;
  }

  public Map<String, Object> getExtraData() {
    return extraData == null ? Map.of() : Collections.unmodifiableMap(extraData);
  }

  /** Running total of (requested - received) videos across all pages so far. */
  public long getPossiblyDeleted() {
    Object value = extraData == null ? null : extraData.get(POSSIBLY_DELETED);
    return value instanceof Number number ? number.longValue() : 0L;
  }

  public void addPossiblyDeleted(long count) {
    Map<String, Object> updated =
        extraData == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extraData);
    updated.put(POSSIBLY_DELETED, getPossiblyDeleted() + count);
    this.extraData = updated;
  }

  public Set<CrawlTag> getCrawlTags() {
    return Collections.unmodifiableSet(crawlTags);
  }

  /** Names given at creation that have not been resolved to stored tags yet. */
  public Set<String> getPendingTagNames() {
    return Collections.unmodifiableSet(pendingTagNames);
  }

  /** Resolved and pending tag names together. */
  public Set<String> getCrawlTagNames() {
    Set<String> names =
        crawlTags.stream()
            .map(CrawlTag::getName)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    names.addAll(pendingTagNames);
    return names;
  }

  void attachCrawlTags(Collection<CrawlTag> tags) {
    crawlTags.addAll(tags);
    tags.forEach(tag -> pendingTagNames.remove(tag.getName()));
  }

  @Override
  public String toString() {
    return "Crawl{id="
        + id
        + ", cursor="
        + cursor
        + ", hasMore="
        + hasMore
        + ", searchId='"
        + searchId
        + "', extraData="
        + extraData
        + ", tags="
        + getCrawlTagNames()
        + "}";
  }
}
