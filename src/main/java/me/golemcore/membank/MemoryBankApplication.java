package me.golemcore.membank;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Memory Bank.
 *
 * <p>
 * A trust-scored memory retention and eviction engine shared by many
 * independent producers. Outputs are scored on write, decayed over time,
 * adjusted by usage feedback and retired by policy-driven garbage collection.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → MemoryBank, MemoryScoreModel, GarbageCollector, TrustLedger
 * Ports              → ArtifactRepositoryPort, GovernancePort, StoragePort
 * Infrastructure     → Local filesystem storage, declared-compliance gate
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code membank.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryBankApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryBankApplication.class, args);
    }

}
