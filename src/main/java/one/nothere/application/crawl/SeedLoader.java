package one.nothere.application.crawl;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import one.nothere.application.frontier.FrontierManager;
import one.nothere.util.ListFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Feeds seed URLs from a file through the frontier's admission policy.
 */
@Component
public class SeedLoader {

    private static final Logger log = LoggerFactory.getLogger(SeedLoader.class);

    private final FrontierManager frontier;

    public SeedLoader(FrontierManager frontier) {
        this.frontier = frontier;
    }

    /**
     * @return number of seeds admitted
     * @throws IllegalArgumentException when the file does not exist
     */
    public int loadSeeds(Path seedFile) {
        if (!Files.isRegularFile(seedFile)) {
            throw new IllegalArgumentException("Seed file not found: " + seedFile.toAbsolutePath());
        }
        List<String> seeds = ListFileReader.readEntries(seedFile);
        int admitted = 0;
        for (String seed : seeds) {
            if (frontier.enqueue(seed)) {
                admitted++;
            } else {
                log.debug("Seed not admitted: {}", seed);
            }
        }
        log.info("Seeded {} of {} URLs from {}", admitted, seeds.size(), seedFile);
        return admitted;
    }
}
