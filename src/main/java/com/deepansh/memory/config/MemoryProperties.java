package com.deepansh.memory.config;

import com.deepansh.memory.model.MemoryKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Strongly-typed configuration for the memory engine.
 * Bound from application.yml under the "memory" prefix.
 */
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    private Store store = new Store();
    private Decision decision = new Decision();
    private Embedding embedding = new Embedding();
    private Retrieval retrieval = new Retrieval();
    private Decay decay = new Decay();
    private Consolidation consolidation = new Consolidation();
    private Cleanup cleanup = new Cleanup();
    private Summary summary = new Summary();
    private Maintenance maintenance = new Maintenance();

    @Data
    public static class Store {
        /** mongo | in-memory */
        private String backend = "mongo";
    }

    @Data
    public static class Decision {
        private int similarTopK = 10;
        private double similarThreshold = 0.5;
        private int maxSlotRetries = 3;
        /** Initial try plus one requeue. */
        private int maxAttempts = 2;
        private Duration requeueDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class Embedding {
        private String model = "text-embedding-3-small";
        private Duration cacheTtl = Duration.ofDays(7);
    }

    @Data
    public static class Retrieval {
        private int candidatePool = 50;
        private double similarityThreshold = 0.3;
        private int defaultTokenBudget = 1000;
        private double minValuePerToken = 0.001;
        /** heuristic | llm */
        private String judge = "heuristic";
        private double judgeMinConfidence = 0.7;
    }

    @Data
    public static class Decay {
        private double floor = 0.05;
        private double pinnedFloor = 0.5;
        private Duration recentAccessWindow = Duration.ofDays(7);
        private double accessBoost = 0.05;
        private double eventHalfLifeDays = 3;
        private Map<MemoryKind, Double> halfLifeDays = defaultHalfLives();

        public double halfLifeFor(MemoryKind kind) {
            return halfLifeDays.getOrDefault(kind, 180.0);
        }

        private static Map<MemoryKind, Double> defaultHalfLives() {
            Map<MemoryKind, Double> m = new EnumMap<>(MemoryKind.class);
            m.put(MemoryKind.PREFERENCE, 365.0);
            m.put(MemoryKind.ENTITY, 365.0);
            m.put(MemoryKind.PROCEDURE, 240.0);
            m.put(MemoryKind.FACT, 180.0);
            m.put(MemoryKind.GOAL, 120.0);
            m.put(MemoryKind.DECISION, 90.0);
            m.put(MemoryKind.ACTION, 30.0);
            m.put(MemoryKind.EVENT, 14.0);
            return m;
        }
    }

    @Data
    public static class Consolidation {
        private double similarityThreshold = 0.85;
    }

    @Data
    public static class Cleanup {
        private Duration unusedAfter = Duration.ofDays(180);
        private double lowImportance = 0.2;
    }

    @Data
    public static class Summary {
        /** New records in a category since last synthesis that trigger a resummarize. */
        private int resummarizeThreshold = 5;
    }

    @Data
    public static class Maintenance {
        private boolean enabled = true;
        private long pollIntervalMs = 5000;
        private int batchSize = 10;
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(30);
        private Duration backoffMax = Duration.ofHours(1);
        private String dailyCron = "0 0 3 * * *";
        private String weeklyCron = "0 0 4 * * SUN";
        private String monthlyCron = "0 0 5 1 * *";
    }
}
