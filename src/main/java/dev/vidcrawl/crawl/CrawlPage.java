package dev.vidcrawl.crawl;

import dev.vidcrawl.store.Crawl;
import java.util.List;
import java.util.Map;

/**
 * One page of results with the live crawl state as it stands after the page.
 *
 * @param videos raw video items of the page
 * @param userInfos profiles of the page's authors, when requested
 * @param comments comments of the page's videos, when requested
 * @param crawl the crawl being paged; mutated again by the next page
 */
public record CrawlPage(
    List<Map<String, Object>> videos,
    List<Map<String, Object>> userInfos,
    List<Map<String, Object>> comments,
    Crawl crawl) {

  public CrawlPage {
    videos = List.copyOf(videos);
    userInfos = List.copyOf(userInfos);
    comments = List.copyOf(comments);
  }

  public boolean isEmpty() {
    return videos.isEmpty() && userInfos.isEmpty() && comments.isEmpty();
  }
}
