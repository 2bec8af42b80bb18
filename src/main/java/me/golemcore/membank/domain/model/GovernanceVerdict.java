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

import java.util.List;

/**
 * Pass/fail answer from the governance gate.
 */
@Data
@Builder
public class GovernanceVerdict {

    private boolean compliant;

    @Builder.Default
    private List<String> violations = List.of();

    public static GovernanceVerdict pass() {
        return GovernanceVerdict.builder().compliant(true).build();
    }

    public static GovernanceVerdict fail(List<String> violations) {
        return GovernanceVerdict.builder()
                .compliant(false)
                .violations(violations != null ? List.copyOf(violations) : List.of())
                .build();
    }
}
