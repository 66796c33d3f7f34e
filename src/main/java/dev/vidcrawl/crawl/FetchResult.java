package dev.vidcrawl.crawl;

import dev.vidcrawl.store.Crawl;
import java.util.List;
import java.util.Map;

/** Everything one crawl returned, with the crawl in its final state. */
public record FetchResult(
    List<Map<String, Object>> videos,
    List<Map<String, Object>> userInfos,
    List<Map<String, Object>> comments,
    Crawl crawl) {

  public FetchResult {
    videos = List.copyOf(videos);
    userInfos = List.copyOf(userInfos);
    comments = List.copyOf(comments);
  }
}
