package dev.vidcrawl.store;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link CrawlTag} entities. */
public interface CrawlTagRepository extends JpaRepository<CrawlTag, Long> {

  List<CrawlTag> findAllByNameIn(Collection<String> names);
}
