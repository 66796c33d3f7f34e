package dev.vidcrawl.store;

import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link Crawl} entities. */
public interface CrawlRepository extends JpaRepository<Crawl, Long> {}
