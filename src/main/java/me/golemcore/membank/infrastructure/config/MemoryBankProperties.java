package me.golemcore.membank.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Data;
import me.golemcore.membank.domain.model.DecayCurve;
import me.golemcore.membank.domain.model.OutputCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Centralized configuration properties for the memory bank, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code membank.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - durable store location and layout</li>
 * <li>{@link ScoringProperties} - reputation table and tunable scoring
 * constants</li>
 * <li>{@link DecayProperties} - per-category decay curve and half-life</li>
 * <li>{@link GovernanceProperties} - categories that require compliance</li>
 * <li>{@link RetrievalProperties} - read defaults</li>
 * <li>{@link GcProperties} - scheduled garbage collection</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "membank")
@Data
public class MemoryBankProperties {

    private StorageProperties storage = new StorageProperties();
    private ScoringProperties scoring = new ScoringProperties();
    private Map<OutputCategory, DecayProperties> decay = defaultDecay();
    private GovernanceProperties governance = new GovernanceProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private GcProperties gc = new GcProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/membank";
    }

    @Data
    public static class DirectoriesProperties {
        private String artifacts = "artifacts";
        private String ledger = "ledger";
        private String gc = "gc";
    }

    @Data
    public static class ScoringProperties {
        private double violationPenalty = 0.15;
        private int consistencyMinUses = 5;
        private double defaultReputation = 0.70;
        private Map<String, Double> componentReputation = defaultReputation();
    }

    @Data
    public static class DecayProperties {
        private DecayCurve curve;
        private Duration halfLife;

        public DecayProperties() {
        }

        public DecayProperties(DecayCurve curve, Duration halfLife) {
            this.curve = curve;
            this.halfLife = halfLife;
        }
    }

    @Data
    public static class GovernanceProperties {
        private Set<OutputCategory> requiredCategories = EnumSet.of(
                OutputCategory.DECISION,
                OutputCategory.ACTION,
                OutputCategory.PREDICTION,
                OutputCategory.GENERATION);
    }

    @Data
    public static class RetrievalProperties {
        private int defaultTopK = 10;
        private double defaultRelevance = 1.0;
        private Duration recencyWindow = Duration.ofDays(7);
    }

    // ==================== GARBAGE COLLECTION ====================

    @Data
    public static class GcProperties {
        private boolean enabled = false;
        private Duration interval = Duration.ofHours(1);
        private Duration initialDelay = Duration.ofMinutes(5);
        private boolean purgeDeleted = false;
        private boolean snapshotDecay = true;
        private GcPolicyProperties defaultPolicy = new GcPolicyProperties();
    }

    @Data
    public static class GcPolicyProperties {
        private String name = "scheduled";
        private double archiveThreshold = 0.2;
        private double deleteThreshold = 0.1;
        private Duration maxAge = Duration.ofDays(30);
        private Integer maxArtifacts;
        private boolean dryRun = false;
    }

    private static Map<OutputCategory, DecayProperties> defaultDecay() {
        Map<OutputCategory, DecayProperties> defaults = new LinkedHashMap<>();
        defaults.put(OutputCategory.REASONING, new DecayProperties(DecayCurve.HYPERBOLIC, Duration.ofDays(7)));
        defaults.put(OutputCategory.DECISION, new DecayProperties(DecayCurve.HYPERBOLIC, Duration.ofDays(7)));
        defaults.put(OutputCategory.ACTION, new DecayProperties(DecayCurve.EXPONENTIAL, Duration.ofDays(3)));
        defaults.put(OutputCategory.PREDICTION, new DecayProperties(DecayCurve.EXPONENTIAL, Duration.ofDays(3)));
        defaults.put(OutputCategory.OBSERVATION, new DecayProperties(DecayCurve.LINEAR, Duration.ofDays(2)));
        defaults.put(OutputCategory.GENERATION, new DecayProperties(DecayCurve.LINEAR, Duration.ofDays(2)));
        return defaults;
    }

    private static Map<String, Double> defaultReputation() {
        Map<String, Double> defaults = new LinkedHashMap<>();
        defaults.put("governance", 0.95);
        defaults.put("parliament", 0.90);
        defaults.put("reflection", 0.90);
        defaults.put("meta_loop", 0.88);
        defaults.put("hunter", 0.85);
        defaults.put("causal", 0.85);
        defaults.put("temporal", 0.82);
        defaults.put("planner", 0.80);
        return defaults;
    }
}
