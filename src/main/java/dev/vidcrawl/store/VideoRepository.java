package dev.vidcrawl.store;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Video} entities. */
public interface VideoRepository extends JpaRepository<Video, Long> {

  /**
   * Loads videos by id. Their relation sets are batch-fetched on first access instead of joined
   * here, since joining four sets multiplies the rows per video.
   */
  List<Video> findAllByIdIn(Collection<Long> ids);
}
