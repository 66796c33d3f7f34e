package dev.vidcrawl.store;

import static dev.vidcrawl.fixture.VideoItems.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.vidcrawl.BaseIntegrationTest;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionTemplate;

class VideoUpsertServiceIT extends BaseIntegrationTest {

  @Autowired private VideoUpsertService videoUpsertService;
  @Autowired private VideoRepository videoRepository;
  @Autowired private HashtagRepository hashtagRepository;
  @Autowired private TransactionTemplate transactionTemplate;

  private Crawl newCrawl(String... tags) {
    return videoUpsertService.saveCrawl(
        new Crawl("{}", List.of(tags), Instant.parse("2024-03-01T00:00:00Z")));
  }

  private long count(String table) {
    Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
    return count == null ? 0 : count;
  }

  @Test
  void upsertingTheSamePageTwiceChangesNothing() {
    Crawl crawl = newCrawl("weekly");
    List<VideoRecord> page =
        List.of(
            record(1L, "alice", List.of("cats", "dogs"), List.of("e-1")),
            record(2L, "bob", List.of("cats"), List.of()));

    videoUpsertService.upsertVideos(page, crawl.getId(), List.of("weekly"));
    List<Long> hashtagIds =
        jdbcTemplate.queryForList("SELECT id FROM hashtag ORDER BY name", Long.class);
    videoUpsertService.upsertVideos(page, crawl.getId(), List.of("weekly"));

    assertThat(count("video")).isEqualTo(2);
    assertThat(count("hashtag")).isEqualTo(2);
    assertThat(count("effect")).isEqualTo(1);
    assertThat(count("videos_to_hashtags")).isEqualTo(3);
    assertThat(count("videos_to_crawls")).isEqualTo(2);
    assertThat(jdbcTemplate.queryForList("SELECT id FROM hashtag ORDER BY name", Long.class))
        .isEqualTo(hashtagIds);
  }

  @Test
  void onlyTheNewHashtagIsCreated() {
    Crawl crawl = newCrawl();
    videoUpsertService.upsertVideos(
        List.of(record(1L, "alice", List.of("hashtag1", "hashtag2"), List.of())),
        crawl.getId(),
        List.of());
    List<Long> knownIds =
        jdbcTemplate.queryForList("SELECT id FROM hashtag ORDER BY name", Long.class);

    videoUpsertService.upsertVideos(
        List.of(record(2L, "bob", List.of("hashtag1", "hashtag2", "hashtag3"), List.of())),
        crawl.getId(),
        List.of());

    assertThat(count("hashtag")).isEqualTo(3);
    assertThat(
            jdbcTemplate.queryForList(
                "SELECT id FROM hashtag WHERE name IN ('hashtag1', 'hashtag2') ORDER BY name",
                Long.class))
        .isEqualTo(knownIds);
  }

  @Test
  void laterCrawlIsAddedWithoutLosingEarlierRelations() {
    Crawl first = newCrawl("weekly");
    Crawl second = newCrawl("daily");

    videoUpsertService.upsertVideos(
        List.of(record(7L, "alice", List.of("cats"), List.of())), first.getId(), List.of("weekly"));
    videoUpsertService.upsertVideos(
        List.of(record(7L, "alice-renamed", List.of("dogs"), List.of())),
        second.getId(),
        List.of("daily"));

    transactionTemplate.executeWithoutResult(
        status -> {
          Video video = videoRepository.findById(7L).orElseThrow();
          assertThat(video.getUsername()).isEqualTo("alice-renamed");
          assertThat(video.getHashtags())
              .extracting(Hashtag::getName)
              .containsExactlyInAnyOrder("cats", "dogs");
          assertThat(video.getCrawlTags())
              .extracting(CrawlTag::getName)
              .containsExactlyInAnyOrder("weekly", "daily");
          assertThat(video.getCrawls())
              .extracting(Crawl::getId)
              .containsExactlyInAnyOrder(first.getId(), second.getId());
        });
  }

  @Test
  void relationsOfEveryVideoInAPageAreMergedOnce() {
    Crawl first = newCrawl("weekly");
    Crawl second = newCrawl("daily");
    List<VideoRecord> page =
        List.of(
            record(1L, "alice", List.of("a", "b", "c"), List.of("e-1", "e-2")),
            record(2L, "bob", List.of("b", "c", "d"), List.of("e-2")),
            record(3L, "carol", List.of(), List.of()));

    videoUpsertService.upsertVideos(page, first.getId(), List.of("weekly"));
    videoUpsertService.upsertVideos(page, second.getId(), List.of("daily"));

    assertThat(count("videos_to_hashtags")).isEqualTo(6);
    assertThat(count("videos_to_effect_ids")).isEqualTo(3);
    assertThat(count("videos_to_crawl_tags")).isEqualTo(6);
    assertThat(count("videos_to_crawls")).isEqualTo(6);
    transactionTemplate.executeWithoutResult(
        status ->
            assertThat(videoRepository.findAllByIdIn(List.of(1L, 2L, 3L)))
                .allSatisfy(video -> assertThat(video.getCrawls()).hasSize(2)));
  }

  @Test
  void failedBatchLeavesNoPartialRows() {
    assertThatThrownBy(
            () ->
                videoUpsertService.upsertVideos(
                    List.of(record(1L, "alice", List.of("cats"), List.of("e-1"))),
                    999L,
                    List.of("weekly")))
        .isInstanceOf(IllegalArgumentException.class);

    assertThat(count("video")).isZero();
    assertThat(hashtagRepository.count()).isZero();
    assertThat(count("effect")).isZero();
    assertThat(count("crawl_tag")).isZero();
  }

  @Test
  void crawlStateIsUpdatedInPlace() {
    Crawl crawl = newCrawl();
    crawl.setCursor(100L);
    crawl.setSearchId("7345");
    crawl.addPossiblyDeleted(2);
    videoUpsertService.saveCrawl(crawl);

    assertThat(count("crawl")).isEqualTo(1);
    assertThat(
            jdbcTemplate.queryForObject(
                "SELECT cursor FROM crawl WHERE id = ?", Long.class, crawl.getId()))
        .isEqualTo(100L);
  }
}
