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
 * Time decay model applied to composite trust.
 *
 * <ul>
 * <li>{@link #HYPERBOLIC} - {@code v / (1 + t/h)}, slow start with a long
 * tail</li>
 * <li>{@link #EXPONENTIAL} - {@code v * 2^(-t/h)}, fast and
 * context-sensitive</li>
 * <li>{@link #LINEAR} - {@code max(0, v * (1 - t/2h))}, reaches zero at twice
 * the half-life</li>
 * </ul>
 */
public enum DecayCurve {
    HYPERBOLIC, EXPONENTIAL, LINEAR
}
