package dev.vidcrawl.store;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes pages of video records and the crawls that observed them.
 *
 * <p>Lookup entities (hashtags, effects, crawl tags) are resolved in bulk: one {@code IN} query
 * per key space, then exactly the missing keys are inserted. This lookup-then-create is not safe
 * against concurrent writers racing on the same new key; callers must serialize writers to one
 * store.
 */
@Service
public class VideoUpsertService {

  private static final Logger log = LoggerFactory.getLogger(VideoUpsertService.class);

  private final VideoRepository videoRepository;
  private final HashtagRepository hashtagRepository;
  private final EffectRepository effectRepository;
  private final CrawlTagRepository crawlTagRepository;
  private final CrawlRepository crawlRepository;
  private final Clock clock;

  public VideoUpsertService(
      VideoRepository videoRepository,
      HashtagRepository hashtagRepository,
      EffectRepository effectRepository,
      CrawlTagRepository crawlTagRepository,
      CrawlRepository crawlRepository,
      Clock clock) {
    this.videoRepository = videoRepository;
    this.hashtagRepository = hashtagRepository;
    this.effectRepository = effectRepository;
    this.crawlTagRepository = crawlTagRepository;
    this.crawlRepository = crawlRepository;
    this.clock = clock;
  }

  /**
   * Inserts or updates a crawl, resolving its pending tag names to stored tags first.
   *
   * <p>The passed instance keeps its identity: a new crawl gets its id assigned in place, so the
   * pagination engine can keep mutating it between pages.
   *
   * @return the crawl as stored
   */
  @Transactional
  public Crawl saveCrawl(Crawl crawl) {
    if (!crawl.getPendingTagNames().isEmpty()) {
      crawl.attachCrawlTags(resolveCrawlTags(crawl.getPendingTagNames()).values());
    }
    Crawl saved = crawlRepository.save(crawl);
    log.debug("Saved crawl {}", saved);
    return saved;
  }

  /**
   * Merges a batch of video records in one transaction.
   *
   * <p>Existing videos get every scalar replaced by the record (empty record fields included) and
   * their relation sets unioned with the record's hashtags and effects, the crawl tags and the
   * crawl. New videos are inserted with only the record's relations. When the batch repeats a
   * video id, the last record wins.
   *
   * @param records validated page items
   * @param crawlId id of an already saved crawl
   * @param crawlTagNames tags to attach to every video of the batch
   * @return the merged videos, in batch order
   * @throws IllegalArgumentException if no crawl with {@code crawlId} exists
   */
  @Transactional
  public List<Video> upsertVideos(
      List<VideoRecord> records, long crawlId, Collection<String> crawlTagNames) {
    if (records.isEmpty()) {
      return List.of();
    }
    Map<Long, VideoRecord> recordsById = new LinkedHashMap<>();
    records.forEach(record -> recordsById.put(record.id(), record));

    Map<String, Hashtag> hashtags =
        resolve(
            collectKeys(recordsById.values(), VideoRecord::hashtagNames),
            hashtagRepository::findAllByNameIn,
            Hashtag::getName,
            Hashtag::new,
            hashtagRepository::saveAll);
    Map<String, Effect> effects =
        resolve(
            collectKeys(recordsById.values(), VideoRecord::effectIds),
            effectRepository::findAllByEffectIdIn,
            Effect::getEffectId,
            Effect::new,
            effectRepository::saveAll);
    Collection<CrawlTag> crawlTags = resolveCrawlTags(crawlTagNames).values();
    Crawl crawl =
        crawlRepository
            .findById(crawlId)
            .orElseThrow(() -> new IllegalArgumentException("No crawl with id " + crawlId));

    Map<Long, Video> existing = new HashMap<>();
    videoRepository
        .findAllByIdIn(recordsById.keySet())
        .forEach(video -> existing.put(video.getId(), video));

    Instant now = clock.instant();
    List<Video> merged = new ArrayList<>(recordsById.size());
    List<Video> created = new ArrayList<>();
    for (VideoRecord record : recordsById.values()) {
      Video video = existing.get(record.id());
      if (video == null) {
        video = new Video(record.id(), now);
        created.add(video);
      }
      video.replaceScalars(record, now);
      video.addHashtags(record.hashtagNames().stream().map(hashtags::get).toList());
      video.addEffects(record.effectIds().stream().map(effects::get).toList());
      video.addCrawlTags(crawlTags);
      video.addCrawl(crawl);
      merged.add(video);
    }
    videoRepository.saveAll(created);

    log.debug(
        "Upserted {} videos for crawl {} ({} new, {} updated)",
        merged.size(),
        crawlId,
        created.size(),
        merged.size() - created.size());
    return merged;
  }

  private Map<String, CrawlTag> resolveCrawlTags(Collection<String> names) {
    return resolve(
        new LinkedHashSet<>(names),
        crawlTagRepository::findAllByNameIn,
        CrawlTag::getName,
        CrawlTag::new,
        crawlTagRepository::saveAll);
  }

  private static Set<String> collectKeys(
      Collection<VideoRecord> records, Function<VideoRecord, List<String>> keys) {
    Set<String> collected = new LinkedHashSet<>();
    records.forEach(record -> collected.addAll(keys.apply(record)));
    return collected;
  }

  /**
   * Looks up all {@code keys} with one query and inserts exactly the ones that are missing.
   *
   * @return every key mapped to its stored entity
   */
  private static <T> Map<String, T> resolve(
      Set<String> keys,
      Function<Collection<String>, List<T>> findExisting,
      Function<T, String> naturalKey,
      Function<String, T> factory,
      Function<List<T>, List<T>> saveAll) {
    if (keys.isEmpty()) {
      return Map.of();
    }
    Map<String, T> byKey = new HashMap<>();
    findExisting.apply(keys).forEach(entity -> byKey.put(naturalKey.apply(entity), entity));

    List<T> missing = keys.stream().filter(key -> !byKey.containsKey(key)).map(factory).toList();
    if (!missing.isEmpty()) {
      saveAll.apply(missing).forEach(entity -> byKey.put(naturalKey.apply(entity), entity));
    }
    return byKey;
  }
}
