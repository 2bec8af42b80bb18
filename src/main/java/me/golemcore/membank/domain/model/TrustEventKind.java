package me.golemcore.membank.domain.model;

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

/**
 * Kind of trust-affecting event recorded in the ledger.
 */
public enum TrustEventKind {
    CREATE, SUCCESS, FAILURE, NEUTRAL_USE, MANUAL_ADJUST, RESCORE, RECLASSIFY, DECAY_SNAPSHOT, GC_ARCHIVE, GC_DELETE;

    public static TrustEventKind fromOutcome(UsageOutcome outcome) {
        return switch (outcome) {
        case SUCCESS -> SUCCESS;
        case FAILURE -> FAILURE;
        case NEUTRAL -> NEUTRAL_USE;
        };
    }
}
