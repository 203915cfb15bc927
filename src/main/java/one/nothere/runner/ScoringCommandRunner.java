package one.nothere.runner;

import java.util.Optional;
import one.nothere.application.scoring.CompositeScoringService;
import one.nothere.application.scoring.CompositeScoringService.RescoreSummary;
import one.nothere.domain.scoring.ScoringResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@code --score-page=<id>} and {@code --rescore [--limit=<n>]}.
 */
@Component
@Order(20)
public class ScoringCommandRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ScoringCommandRunner.class);

    private final ApplicationArguments arguments;
    private final CompositeScoringService scoringService;
    private final CommandExitStatus exitStatus;

    public ScoringCommandRunner(ApplicationArguments arguments,
                                CompositeScoringService scoringService,
                                CommandExitStatus exitStatus) {
        this.arguments = arguments;
        this.scoringService = scoringService;
        this.exitStatus = exitStatus;
    }

    @Override
    public void run(String... args) {
        if (arguments.containsOption("score-page")) {
            long pageId = CommandOptions.longOption(arguments, "score-page");
            Optional<ScoringResult> result = scoringService.scorePageById(pageId);
            if (result.isEmpty()) {
                log.error("No page with id {}", pageId);
                exitStatus.fail();
                return;
            }
            ScoringResult scored = result.get();
            log.info("Page {} scored {} ({}, indexable={}){}", pageId, scored.compositeScore(), scored.rankTier(),
                scored.indexable(), scored.orgBlocked() ? " blocked: " + scored.blocklistReason() : "");
        }

        if (arguments.containsOption("rescore")) {
            Integer limit = CommandOptions.positiveIntOption(arguments, "limit");
            RescoreSummary summary = scoringService.rescoreAll(limit);
            if (summary.failed() > 0) {
                exitStatus.fail();
            }
        }
    }
}
