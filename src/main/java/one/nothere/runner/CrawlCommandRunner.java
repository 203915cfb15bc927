package one.nothere.runner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import one.nothere.application.crawl.CrawlLoop;
import one.nothere.application.crawl.CrawlStatistics;
import one.nothere.application.crawl.SeedLoader;
import one.nothere.application.frontier.FrontierManager;
import one.nothere.config.CrawlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@code --crawl [--seed=<file>] [--max-pages=<n>] [--delay=<seconds>]}.
 *
 * <p>Without {@code --seed}, an empty frontier is seeded from {@code crawler.default-seed-file}
 * when that file exists.</p>
 */
@Component
@Order(10)
public class CrawlCommandRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CrawlCommandRunner.class);

    private final ApplicationArguments arguments;
    private final CrawlLoop crawlLoop;
    private final SeedLoader seedLoader;
    private final FrontierManager frontier;
    private final CrawlerProperties properties;

    public CrawlCommandRunner(ApplicationArguments arguments,
                              CrawlLoop crawlLoop,
                              SeedLoader seedLoader,
                              FrontierManager frontier,
                              CrawlerProperties properties) {
        this.arguments = arguments;
        this.crawlLoop = crawlLoop;
        this.seedLoader = seedLoader;
        this.frontier = frontier;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        if (!arguments.containsOption("crawl")) {
            return;
        }

        Integer maxPages = CommandOptions.positiveIntOption(arguments, "max-pages");
        Double delaySeconds = CommandOptions.nonNegativeDoubleOption(arguments, "delay");
        Duration delay = delaySeconds == null ? null : Duration.ofMillis(Math.round(delaySeconds * 1000));

        String seed = CommandOptions.stringOption(arguments, "seed");
        if (seed != null) {
            seedLoader.loadSeeds(Path.of(seed));
        } else if (frontier.stats().queued() == 0) {
            Path defaultSeeds = Path.of(properties.getDefaultSeedFile());
            if (Files.isRegularFile(defaultSeeds)) {
                log.info("Frontier is empty, seeding from {}", defaultSeeds);
                seedLoader.loadSeeds(defaultSeeds);
            } else {
                log.warn("Frontier is empty and {} does not exist; nothing to crawl", defaultSeeds);
            }
        }

        CrawlStatistics.Snapshot snapshot = crawlLoop.run(maxPages, delay);
        log.info("Crawl command complete: {}", snapshot);
    }
}
