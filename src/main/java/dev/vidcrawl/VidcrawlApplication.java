package dev.vidcrawl;

import dev.vidcrawl.cli.PrintQueryCommand;
import dev.vidcrawl.crawl.CrawlProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the vidcrawl acquisition engine.
 *
 * <p>Runs without a web server. The first program argument selects the command ({@code run},
 * {@code run-repeated} or {@code print-query}); see {@code CrawlCommandRunner}. {@code print-query}
 * is answered without starting the application context.
 */
@SpringBootApplication
@EnableConfigurationProperties(CrawlProperties.class)
public class VidcrawlApplication {
    public static void main(String[] args) {
        if (PrintQueryCommand.isRequested(args)) {
            PrintQueryCommand.run(args, System.out);
            return;
        }
        SpringApplication.run(VidcrawlApplication.class, args);
    }
}
