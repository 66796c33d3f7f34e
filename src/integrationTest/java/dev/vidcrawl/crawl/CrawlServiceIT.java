package dev.vidcrawl.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import dev.vidcrawl.BaseIntegrationTest;
import dev.vidcrawl.api.ApiHttpResponse;
import dev.vidcrawl.api.ApiTransport;
import dev.vidcrawl.store.Crawl;
import dev.vidcrawl.store.CrawlRepository;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

class CrawlServiceIT extends BaseIntegrationTest {

  private static final String OK = "\"error\":{\"code\":\"ok\",\"message\":\"\",\"log_id\":\"l\"}";

  @MockitoBean private ApiTransport transport;

  @Autowired private CrawlService crawlService;
  @Autowired private CrawlRepository crawlRepository;

  private static ApiHttpResponse page(String videos, long cursor, boolean hasMore) {
    return new ApiHttpResponse(
        200,
        "{\"data\":{\"videos\":["
            + videos
            + "],\"cursor\":"
            + cursor
            + ",\"has_more\":"
            + hasMore
            + ",\"search_id\":\"7345\"},"
            + OK
            + "}");
  }

  private static String video(long id, String username, String hashtag) {
    return "{\"id\":" + id + ",\"username\":\"" + username
        + "\",\"create_time\":1709251200,\"region_code\":\"US\",\"hashtag_names\":[\""
        + hashtag + "\"]}";
  }

  @Test
  void crawlIsPagedToTheEndAndStoredPageByPage() {
    when(transport.post(anyString(), anyString()))
        .thenReturn(
            page(video(1, "alice", "cats") + "," + video(2, "bob", "cats"), 100, true),
            page(video(3, "carol", "dogs"), 200, false));
    VideoQueryConfig config =
        new VideoQueryConfig(
            "{\"and\":[]}",
            LocalDate.of(2024, 3, 1),
            LocalDate.of(2024, 3, 2),
            100,
            List.of("weekly"),
            false,
            false);

    FetchResult result = crawlService.fetchAndStoreAll(config, CrawlLimits.unlimited());

    assertThat(result.videos()).hasSize(3);
    List<Crawl> crawls = crawlRepository.findAll();
    assertThat(crawls).hasSize(1);
    Crawl stored = crawls.get(0);
    assertThat(stored.isHasMore()).isFalse();
    assertThat(stored.getCursor()).isEqualTo(200L);
    assertThat(stored.getSearchId()).isEqualTo("7345");
    assertThat(stored.getPossiblyDeleted()).isEqualTo(98 + 99);
    assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM video", Long.class))
        .isEqualTo(3L);
    assertThat(
            jdbcTemplate.queryForList(
                "SELECT h.name FROM hashtag h ORDER BY h.name", String.class))
        .containsExactly("cats", "dogs");
    assertThat(
            jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM videos_to_crawl_tags", Long.class))
        .isEqualTo(3L);
  }
}
