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
 * Outcome of a store call.
 *
 * <ul>
 * <li>{@link #ACCEPTED} - compliant, retrievable</li>
 * <li>{@link #CONSTITUTIONAL_VIOLATION} - non-compliant in a category that
 * requires compliance; kept for audit only</li>
 * <li>{@link #FLAGGED_FOR_REVIEW} - non-compliant in a category without a
 * compliance requirement; kept for audit and manual review</li>
 * </ul>
 */
public enum StoreStatus {
    ACCEPTED, CONSTITUTIONAL_VIOLATION, FLAGGED_FOR_REVIEW;

    public boolean isRetrievable() {
        return this == ACCEPTED;
    }
}
