package dev.matchengine.config;

import dev.matchengine.model.CacheStrategy;
import dev.matchengine.model.EntityKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the matching engine.
 * Loaded from application.yml under 'matching' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig {

    private String dataFile = "file:entities.json";
    private int defaultTopK = 5;
    private int maxTopK = 100;
    private int maxPoolSize = 1000;
    private int parallelThreshold = 256;
    private Duration rankTimeout = Duration.ofSeconds(5);
    private double tieEpsilon = 1e-9;

    private Weights weights = new Weights();
    private Cache cache = new Cache();
    private Backfill backfill = new Backfill();

    /**
     * Initial weight snapshot installed at startup.
     */
    @Data
    public static class Weights {
        private double skill = 0.85;
        private double title = 0.15;
        private double semantic = 0.0;
        private double embedding = 0.0;
        private double distance = 0.0;
        private double must = 0.7;
        private double needed = 0.3;
        private int minSkillFloor = 3;
    }

    @Data
    public static class Cache {
        private int maxEntries = 1000;
        private Duration ttl = Duration.ofMinutes(15);
        private CacheStrategy strategy = CacheStrategy.HYBRID; // used when a request names none
    }

    @Data
    public static class Backfill {
        private boolean enabled = false;
        private String tenantId;
        private EntityKind anchorKind = EntityKind.CANDIDATE;
        private int topK = 10;
        private boolean cityFilter = true;
        private Integer limit;
        private boolean force = false;
    }
}
