package dev.matchengine;

import dev.matchengine.config.MatchingConfig;
import dev.matchengine.model.BackfillSummary;
import dev.matchengine.model.MatchQuery;
import dev.matchengine.service.MatchBackfillService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one cache backfill at startup when {@code matching.backfill.enabled} is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "matching.backfill", name = "enabled", havingValue = "true")
public class MatchBackfillRunner implements CommandLineRunner {

    private static final String SEPARATOR = "========================================";

    private final MatchBackfillService backfillService;
    private final MatchingConfig matchingConfig;

    @Override
    public void run(String... args) {
        execute();
    }

    /**
     * @return the summary of the run
     */
    public BackfillSummary execute() {
        MatchingConfig.Backfill settings = matchingConfig.getBackfill();
        log.info(SEPARATOR);
        log.info("Match Backfill Starting (tenant '{}', {} anchors)",
                settings.getTenantId(), settings.getAnchorKind().wireName());
        log.info(SEPARATOR);

        MatchQuery query = MatchQuery.builder()
                .topK(settings.getTopK())
                .cityFilter(settings.isCityFilter())
                .build();

        try {
            BackfillSummary summary = backfillService.backfill(settings.getTenantId(), settings.getAnchorKind(),
                    query, settings.getLimit(), settings.isForce()).block();
            BackfillSummary result = summary != null ? summary : new BackfillSummary(0, 0, 0, 0);

            log.info(SEPARATOR);
            log.info("Match Backfill Completed");
            log.info("Processed: {}, computed: {}, skipped: {}, errors: {}",
                    result.processed(), result.computed(), result.skipped(), result.errors());
            log.info(SEPARATOR);
            return result;
        } catch (Exception e) {
            log.error("Match Backfill failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Backfill execution failed", e);
        }
    }
}
