package dev.vidcrawl.crawl;

import dev.vidcrawl.api.ApiServerException;
import dev.vidcrawl.api.CommentsRequest;
import dev.vidcrawl.api.CommentsResponse;
import dev.vidcrawl.api.InvalidCountOrCursorException;
import dev.vidcrawl.api.InvalidRequestException;
import dev.vidcrawl.api.InvalidSearchIdException;
import dev.vidcrawl.api.InvalidUsernameException;
import dev.vidcrawl.api.RefusedUsernameException;
import dev.vidcrawl.api.ResearchApiClient;
import dev.vidcrawl.api.UserInfoRequest;
import dev.vidcrawl.api.UserInfoResponse;
import dev.vidcrawl.api.VideoRequest;
import dev.vidcrawl.api.VideoResponse;
import dev.vidcrawl.store.Crawl;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pages one video query from the first request until the API reports no more results.
 *
 * <p>Each page request carries the crawl's current cursor and search id; the response overwrites
 * both, along with has-more. Pages are requested strictly one after another since every cursor
 * comes from the previous response.
 *
 * <p>User info and comment lookups are cached for the lifetime of the crawler: a username or video
 * seen again is not requested twice. {@link #clearCache()} empties both caches.
 */
@Service
public class VideoCrawler {

  private static final Logger log = LoggerFactory.getLogger(VideoCrawler.class);

  /** The comment endpoint rejects larger cursors. */
  static final long MAX_COMMENTS_CURSOR = 999;

  private final ResearchApiClient apiClient;
  private final CrawlProperties properties;
  private final Clock clock;
  private final Map<String, UserInfoResponse> userInfoCache = new HashMap<>();
  private final Map<Long, List<CommentsResponse>> commentsCache = new HashMap<>();

  public VideoCrawler(ResearchApiClient apiClient, CrawlProperties properties, Clock clock) {
    this.apiClient = apiClient;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Runs one crawl.
   *
   * @param config query, window and enrichment switches
   * @param limits request ceiling for this crawl
   * @param handler receives every page, including partial results fetched before a tolerated
   *     failure
   * @return the crawl in its final state; {@code hasMore} is still true if the crawl stopped early
   */
  public Crawl crawl(VideoQueryConfig config, CrawlLimits limits, PageHandler handler) {
    Crawl crawl = new Crawl(config.query(), config.crawlTags(), clock.instant());
    long requestsAtStart = apiClient.getRequestsSent();
    log.info(
        "Beginning API results fetch for {} to {} (tags {})",
        config.startDate(),
        config.endDate(),
        config.crawlTags());

    while (crawl.isHasMore()) {
      long requestsThisRun = apiClient.getRequestsSent() - requestsAtStart;
      if (limits.isReached(requestsThisRun)) {
        log.info(
            "Stopping crawl: reached max API requests {} ({} sent)",
            limits.maxApiRequests(),
            requestsThisRun);
        break;
      }

      VideoRequest request =
          new VideoRequest(
              config.query(),
              config.startDate(),
              config.endDate(),
              config.maxCount(),
              false,
              crawl.getCursor(),
              crawl.getSearchId());

      List<Map<String, Object>> videos = List.of();
      List<Map<String, Object>> userInfos = List.of();
      List<Map<String, Object>> comments = List.of();
      boolean stop = false;
      try {
        VideoResponse response = apiClient.fetchVideos(request);
        videos = response.videos();
        log.debug(
            "API response: cursor {}, has_more {}, search_id {}, error {}",
            response.cursor(),
            response.hasMore(),
            response.searchId(),
            response.error());
        applyResponse(crawl, response, config.maxCount(), clock.instant());

        if (videos.isEmpty() && crawl.isHasMore()) {
          log.error(
              "API returned no videos but has_more is true (cursor {}, search_id {})",
              crawl.getCursor(),
              crawl.getSearchId());
        }
        if (config.fetchUserInfo()) {
          userInfos = fetchUserInfo(videos);
        }
        if (config.fetchComments()) {
          comments = fetchComments(videos);
        }
      } catch (ApiServerException | InvalidSearchIdException | InvalidCountOrCursorException e) {
        if (properties.raiseErrorOnPersistentApiServerError()) {
          throw e;
        }
        log.error("Stopping crawl after persistent API error: {}", e.getMessage());
        stop = true;
      }

      CrawlPage page = new CrawlPage(videos, userInfos, comments, crawl);
      if (!stop || !page.isEmpty()) {
        handler.onPage(page);
      }
      if (stop) {
        break;
      }
    }

    log.info(
        "Crawl completed (or reached configured max API requests: {}). API requests: {}. "
            + "Expected remaining API request quota: {}",
        limits.maxApiRequests(),
        apiClient.getRequestsSent() - requestsAtStart,
        apiClient.expectedRemainingQuota(properties.dailyRequestQuota()));
    return crawl;
  }

  /**
   * Moves the crawl to the state reported by a page response.
   *
   * <p>A changed search id is adopted; it is logged as an error unless the crawl had none yet.
   * {@code requestedCount - received} is added to the possibly-deleted counter.
   */
  static void applyResponse(
      Crawl crawl, VideoResponse response, int requestedCount, Instant updatedAt) {
    crawl.setCursor(response.cursor());
    crawl.setHasMore(response.hasMore());

    String searchId = response.searchId();
    if (searchId != null && !searchId.equals(crawl.getSearchId())) {
      if (crawl.getSearchId() != null) {
        log.error("search_id changed! Was {} now {}", crawl.getSearchId(), searchId);
      }
      crawl.setSearchId(searchId);
    }
    crawl.setUpdatedAt(updatedAt);
    crawl.addPossiblyDeleted(requestedCount - response.videos().size());
  }

  /** Profiles of the distinct authors of {@code videos}; unknown and refused users are skipped. */
  List<Map<String, Object>> fetchUserInfo(List<Map<String, Object>> videos) {
    Set<String> usernames = new LinkedHashSet<>();
    for (Map<String, Object> video : videos) {
      Object username = video.get("username");
      if (username != null) {
        usernames.add(username.toString());
      }
    }
    List<Map<String, Object>> userInfos = new ArrayList<>();
    for (String username : usernames) {
      UserInfoResponse response = userInfo(username);
      if (response.isOk()) {
        userInfos.add(Objects.requireNonNull(response.userInfo()));
      } else {
        log.warn("Error fetching user info for {}: {}", username, response.error());
      }
    }
    return userInfos;
  }

  UserInfoResponse userInfo(String username) {
    UserInfoResponse cached = userInfoCache.get(username);
    if (cached != null) {
      return cached;
    }
    UserInfoResponse response;
    try {
      response = apiClient.fetchUserInfo(new UserInfoRequest(username));
    } catch (InvalidUsernameException | RefusedUsernameException e) {
      log.info("User info for {} unavailable: {}", username, describe(e));
      response = new UserInfoResponse(username, null, e.getError());
    }
    userInfoCache.put(username, response);
    return response;
  }

  /** All comments of every video in {@code videos}, flattened. */
  List<Map<String, Object>> fetchComments(List<Map<String, Object>> videos) {
    List<Map<String, Object>> comments = new ArrayList<>();
    for (Map<String, Object> video : videos) {
      Long videoId = videoId(video);
      if (videoId == null) {
        continue;
      }
      for (CommentsResponse response : videoComments(videoId)) {
        comments.addAll(response.comments());
      }
    }
    return comments;
  }

  /** Pages through the comments of one video, stopping past the maximum cursor. */
  List<CommentsResponse> videoComments(long videoId) {
    List<CommentsResponse> cached = commentsCache.get(videoId);
    if (cached != null) {
      return cached;
    }
    List<CommentsResponse> responses = new ArrayList<>();
    Long cursor = null;
    boolean hasMore = true;
    while (hasMore) {
      CommentsResponse response =
          apiClient.fetchComments(
              new CommentsRequest(videoId, CommentsRequest.DEFAULT_MAX_COUNT, cursor));
      if (!response.isOk()) {
        log.warn("Error fetching comments for video id {}: {}", videoId, response.error());
        break;
      }
      if (!response.comments().isEmpty()) {
        responses.add(response);
      }
      hasMore = response.hasMore();
      cursor = response.cursor();
      if (cursor == null || cursor > MAX_COMMENTS_CURSOR) {
        log.debug(
            "Stopping comments fetch for video {}: cursor {} past {}",
            videoId,
            cursor,
            MAX_COMMENTS_CURSOR);
        hasMore = false;
      }
    }
    commentsCache.put(videoId, List.copyOf(responses));
    return responses;
  }

  public void clearCache() {
    userInfoCache.clear();
    commentsCache.clear();
  }

  private static @Nullable Long videoId(Map<String, Object> video) {
    Object id = video.get("id");
    if (id instanceof Number number) {
      return number.longValue();
    }
    return id == null ? null : Long.valueOf(id.toString());
  }

  private static String describe(InvalidRequestException e) {
    return e.getError() == null ? e.getMessage() : e.getError().message();
  }
}
