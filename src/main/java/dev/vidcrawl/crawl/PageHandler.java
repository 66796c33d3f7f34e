package dev.vidcrawl.crawl;

/** Receives every page before the next request is issued. */
@FunctionalInterface
public interface PageHandler {

  void onPage(CrawlPage page);
}
