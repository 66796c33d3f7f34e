package dev.vidcrawl;

import static dev.vidcrawl.fixture.VideoItems.record;
import static org.assertj.core.api.Assertions.assertThat;

import dev.vidcrawl.store.Comment;
import dev.vidcrawl.store.CommentRecord;
import dev.vidcrawl.store.CommentRepository;
import dev.vidcrawl.store.Crawl;
import dev.vidcrawl.store.CrawlRepository;
import dev.vidcrawl.store.CrawlTag;
import dev.vidcrawl.store.CrawlTagRepository;
import dev.vidcrawl.store.Effect;
import dev.vidcrawl.store.EffectRepository;
import dev.vidcrawl.store.Hashtag;
import dev.vidcrawl.store.HashtagRepository;
import dev.vidcrawl.store.UserInfo;
import dev.vidcrawl.store.UserInfoRecord;
import dev.vidcrawl.store.UserInfoRepository;
import dev.vidcrawl.store.Video;
import dev.vidcrawl.store.VideoRepository;
import dev.vidcrawl.store.VideoUpsertService;
import jakarta.persistence.EntityManager;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compensates for ddl-auto=none by verifying each JPA entity can be persisted and read back
 * against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  private static final Instant STARTED_AT = Instant.parse("2024-03-01T10:15:30Z");

  @Autowired private CrawlRepository crawlRepository;
  @Autowired private CrawlTagRepository crawlTagRepository;
  @Autowired private HashtagRepository hashtagRepository;
  @Autowired private EffectRepository effectRepository;
  @Autowired private VideoRepository videoRepository;
  @Autowired private UserInfoRepository userInfoRepository;
  @Autowired private CommentRepository commentRepository;
  @Autowired private VideoUpsertService videoUpsertService;
  @Autowired private EntityManager entityManager;

  @Test
  void crawlEntityRoundtripsAgainstFlywaySchema() {
    Crawl crawl = new Crawl("{\"and\":[]}", List.of("weekly"), STARTED_AT);
    crawl.setCursor(200L);
    crawl.setSearchId("7345");
    crawl.setHasMore(false);
    crawl.setUpdatedAt(STARTED_AT.plusSeconds(60));
    crawl.addPossiblyDeleted(3);

    Crawl saved = videoUpsertService.saveCrawl(crawl);
    entityManager.flush();
    entityManager.clear();
    Crawl found = crawlRepository.findById(saved.getId()).orElseThrow();

    assertThat(found.getQuery()).isEqualTo("{\"and\":[]}");
    assertThat(found.getCrawlStartedAt()).isEqualTo(STARTED_AT);
    assertThat(found.getCursor()).isEqualTo(200L);
    assertThat(found.getSearchId()).isEqualTo("7345");
    assertThat(found.isHasMore()).isFalse();
    assertThat(found.getPossiblyDeleted()).isEqualTo(3);
    assertThat(found.getCrawlTagNames()).containsExactly("weekly");
  }

  @Test
  void videoEntityRoundtripsWithEveryRelation() {
    Hashtag hashtag = hashtagRepository.saveAndFlush(new Hashtag("cats"));
    Effect effect = effectRepository.saveAndFlush(new Effect("e-1"));
    CrawlTag tag = crawlTagRepository.saveAndFlush(new CrawlTag("weekly"));
    Crawl crawl = crawlRepository.saveAndFlush(new Crawl("{}", List.of(), STARTED_AT));

    Video video = new Video(42L, STARTED_AT);
    video.replaceScalars(record(42L, "alice", List.of("cats"), List.of("e-1")), STARTED_AT);
    video.addHashtags(List.of(hashtag));
    video.addEffects(List.of(effect));
    video.addCrawlTags(List.of(tag));
    video.addCrawl(crawl);
    videoRepository.saveAndFlush(video);
    entityManager.clear();

    Video found = videoRepository.findById(42L).orElseThrow();
    assertThat(found.getUsername()).isEqualTo("alice");
    assertThat(found.getRegionCode()).isEqualTo("US");
    assertThat(found.getCreateTime()).isEqualTo(Instant.ofEpochSecond(1_709_251_200L));
    assertThat(found.getHashtags()).extracting(Hashtag::getName).containsExactly("cats");
    assertThat(found.getEffects()).extracting(Effect::getEffectId).containsExactly("e-1");
    assertThat(found.getCrawlTags()).extracting(CrawlTag::getName).containsExactly("weekly");
    assertThat(found.getCrawls()).extracting(Crawl::getId).containsExactly(crawl.getId());
  }

  @Test
  void userInfoEntityRoundtripsAgainstFlywaySchema() {
    userInfoRepository.saveAndFlush(
        new UserInfo(
            new UserInfoRecord("alice", "Alice", "bio", "https://a/x.png", true, 5L, 2L, 7L, 1L)));
    entityManager.clear();

    UserInfo found = userInfoRepository.findById("alice").orElseThrow();
    assertThat(found.getDisplayName()).isEqualTo("Alice");
    assertThat(found.getVerified()).isTrue();
    assertThat(found.getFollowerCount()).isEqualTo(7L);
  }

  @Test
  void commentEntityRoundtripsAgainstFlywaySchema() {
    commentRepository.saveAndFlush(
        new Comment(new CommentRecord(9L, 42L, "nice", null, 3L, 0L, 1_709_251_200L)));
    entityManager.clear();

    Comment found = commentRepository.findById(9L).orElseThrow();
    assertThat(found.getVideoId()).isEqualTo(42L);
    assertThat(found.getText()).isEqualTo("nice");
    assertThat(found.getParentCommentId()).isNull();
    assertThat(found.getCreateTime()).isEqualTo(Instant.ofEpochSecond(1_709_251_200L));
    assertThat(found.getLikeCount()).isEqualTo(3L);
    assertThat(found.getReplyCount()).isZero();
  }
}
