package dev.vidcrawl.crawl;

import dev.vidcrawl.store.ApiRecordMapper;
import dev.vidcrawl.store.CommentRecord;
import dev.vidcrawl.store.CommentUpsertService;
import dev.vidcrawl.store.Crawl;
import dev.vidcrawl.store.UserInfoRecord;
import dev.vidcrawl.store.UserInfoUpsertService;
import dev.vidcrawl.store.VideoRecord;
import dev.vidcrawl.store.VideoUpsertService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a crawl and optionally stores every page before the next one is requested, so a crawl
 * interrupted after hours keeps everything fetched so far.
 */
@Service
public class CrawlService {

  private static final Logger log = LoggerFactory.getLogger(CrawlService.class);

  private final VideoCrawler videoCrawler;
  private final ApiRecordMapper recordMapper;
  private final VideoUpsertService videoUpsertService;
  private final UserInfoUpsertService userInfoUpsertService;
  private final CommentUpsertService commentUpsertService;

  public CrawlService(
      VideoCrawler videoCrawler,
      ApiRecordMapper recordMapper,
      VideoUpsertService videoUpsertService,
      UserInfoUpsertService userInfoUpsertService,
      CommentUpsertService commentUpsertService) {
    this.videoCrawler = videoCrawler;
    this.recordMapper = recordMapper;
    this.videoUpsertService = videoUpsertService;
    this.userInfoUpsertService = userInfoUpsertService;
    this.commentUpsertService = commentUpsertService;
  }

  /**
   * Fetches every page of a query.
   *
   * @param storeAfterEachPage persist each page with videos before requesting the next one
   * @return all items fetched, with the final crawl state
   */
  public FetchResult fetchAll(
      VideoQueryConfig config, CrawlLimits limits, boolean storeAfterEachPage) {
    List<Map<String, Object>> videos = new ArrayList<>();
    List<Map<String, Object>> userInfos = new ArrayList<>();
    List<Map<String, Object>> comments = new ArrayList<>();

    Crawl crawl =
        videoCrawler.crawl(
            config,
            limits,
            page -> {
              videos.addAll(page.videos());
              userInfos.addAll(page.userInfos());
              comments.addAll(page.comments());
              if (storeAfterEachPage && !page.videos().isEmpty()) {
                store(page);
              }
            });

    log.debug("Fetched {} videos in crawl {}", videos.size(), crawl.getId());
    return new FetchResult(videos, userInfos, comments, crawl);
  }

  public FetchResult fetchAndStoreAll(VideoQueryConfig config, CrawlLimits limits) {
    return fetchAll(config, limits, true);
  }

  /** Forgets cached user info and comments, so the next run fetches them fresh. */
  public void clearCaches() {
    videoCrawler.clearCache();
  }

  /**
   * Persists the crawl, then its videos, user infos and comments. All items are validated before
   * anything is written.
   */
  void store(CrawlPage page) {
    List<VideoRecord> videoRecords = recordMapper.toVideoRecords(page.videos());
    List<UserInfoRecord> userInfoRecords = recordMapper.toUserInfoRecords(page.userInfos());
    List<CommentRecord> commentRecords = recordMapper.toCommentRecords(page.comments());

    log.debug("Putting crawl to database: {}", page.crawl());
    Crawl saved = videoUpsertService.saveCrawl(page.crawl());
    videoUpsertService.upsertVideos(videoRecords, saved.getId(), saved.getCrawlTagNames());
    if (!userInfoRecords.isEmpty()) {
      userInfoUpsertService.upsert(userInfoRecords);
    }
    if (!commentRecords.isEmpty()) {
      commentUpsertService.upsert(commentRecords);
    }
  }
}
