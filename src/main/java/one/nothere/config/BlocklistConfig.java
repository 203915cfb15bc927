package one.nothere.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import one.nothere.application.blocklist.BlocklistDefaults;
import one.nothere.application.blocklist.Tier1Blocklist;
import one.nothere.util.ListFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Builds the Tier-1 blocklist shared by the frontier and the crawl worker.
 */
@Configuration
public class BlocklistConfig {

    private static final Logger log = LoggerFactory.getLogger(BlocklistConfig.class);

    @Bean
    public Tier1Blocklist tier1Blocklist(CrawlerProperties properties) {
        Tier1Blocklist blocklist = BlocklistDefaults.newBlocklist();
        String extraFile = properties.getBlocklist().getExtraDomainsFile();
        if (StringUtils.hasText(extraFile)) {
            Path path = Path.of(extraFile);
            if (!Files.isRegularFile(path)) {
                throw new IllegalStateException("crawler.blocklist.extra-domains-file not found: " + path.toAbsolutePath());
            }
            List<String> extra = ListFileReader.readEntries(path);
            int added = blocklist.addDomains(extra);
            log.info("Loaded {} extra blocked domains from {} ({} new)", extra.size(), path, added);
        }
        Tier1Blocklist.Stats stats = blocklist.stats();
        log.info("Tier-1 blocklist ready: {} domains, {} TLDs, {} patterns",
            stats.blockedDomains(), stats.blockedTlds(), stats.blockedPatterns());
        return blocklist;
    }
}
