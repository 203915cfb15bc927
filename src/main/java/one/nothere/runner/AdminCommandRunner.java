package one.nothere.runner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import one.nothere.application.blocklist.Tier1Blocklist;
import one.nothere.application.frontier.FrontierManager;
import one.nothere.util.ListFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Blocklist and frontier maintenance: {@code --blocklist-stats}, {@code --blocklist-add=<d>[,<d>...]},
 * {@code --blocklist-import=<file>}, {@code --frontier-stats}, {@code --frontier-clear}.
 *
 * <p>Blocklist additions apply to this process only; runs before the crawl runner so that a
 * crawl in the same invocation sees them.</p>
 */
@Component
@Order(5)
public class AdminCommandRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminCommandRunner.class);

    private final ApplicationArguments arguments;
    private final Tier1Blocklist blocklist;
    private final FrontierManager frontier;

    public AdminCommandRunner(ApplicationArguments arguments, Tier1Blocklist blocklist, FrontierManager frontier) {
        this.arguments = arguments;
        this.blocklist = blocklist;
        this.frontier = frontier;
    }

    @Override
    public void run(String... args) {
        List<String> additions = CommandOptions.listOption(arguments, "blocklist-add");
        if (!additions.isEmpty()) {
            int added = blocklist.addDomains(additions);
            log.info("Added {} of {} domains to the blocklist", added, additions.size());
        }

        String importFile = CommandOptions.stringOption(arguments, "blocklist-import");
        if (importFile != null) {
            Path path = Path.of(importFile);
            if (!Files.isRegularFile(path)) {
                throw new IllegalArgumentException("Blocklist file not found: " + path.toAbsolutePath());
            }
            List<String> domains = ListFileReader.readEntries(path);
            int added = blocklist.addDomains(domains);
            log.info("Imported {} new domains from {} ({} entries)", added, path, domains.size());
        }

        if (arguments.containsOption("blocklist-stats")) {
            Tier1Blocklist.Stats stats = blocklist.stats();
            log.info("Blocklist: {} domains, {} TLDs, {} patterns",
                stats.blockedDomains(), stats.blockedTlds(), stats.blockedPatterns());
        }

        if (arguments.containsOption("frontier-clear")) {
            frontier.clear();
        }

        if (arguments.containsOption("frontier-stats")) {
            FrontierManager.Stats stats = frontier.stats();
            log.info("Frontier: {} queued, {} seen", stats.queued(), stats.seen());
        }
    }
}
