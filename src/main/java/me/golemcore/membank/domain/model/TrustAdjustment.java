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

import lombok.Builder;
import lombok.Data;

/**
 * Usage-driven trust change. {@code delta} is the diminishing reward or
 * penalty, {@code bonus} the consistency bonus; {@code newTrust} is already
 * clamped.
 */
@Data
@Builder
public class TrustAdjustment {

    private double previousTrust;
    private double delta;
    private double bonus;
    private double newTrust;

    public double getAppliedDelta() {
        return newTrust - previousTrust;
    }
}
