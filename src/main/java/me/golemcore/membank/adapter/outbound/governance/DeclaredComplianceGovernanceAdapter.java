package me.golemcore.membank.adapter.outbound.governance;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.membank.domain.model.GovernanceVerdict;
import me.golemcore.membank.domain.model.ProducerOutput;
import me.golemcore.membank.port.outbound.GovernancePort;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Governance gate that trusts what the producer declares about itself: an
 * output is compliant unless it reports {@code constitutionalCompliance=false}
 * or carries at least one violation.
 */
@Component
@Slf4j
public class DeclaredComplianceGovernanceAdapter implements GovernancePort {

    static final String UNSPECIFIED_VIOLATION = "declared non-compliant";

    @Override
    public GovernanceVerdict evaluate(ProducerOutput output) {
        List<String> violations = output.getViolations() == null ? List.of()
                : output.getViolations().stream()
                        .filter(v -> v != null && !v.isBlank())
                        .map(String::trim)
                        .toList();
        boolean declaredNonCompliant = Boolean.FALSE.equals(output.getConstitutionalCompliance());

        if (!declaredNonCompliant && violations.isEmpty()) {
            return GovernanceVerdict.pass();
        }
        if (violations.isEmpty()) {
            violations = List.of(UNSPECIFIED_VIOLATION);
        }
        log.debug("[Governance] {} output from {} failed compliance: {}",
                output.getCategory(), output.getComponent(), violations);
        return GovernanceVerdict.fail(violations);
    }
}
