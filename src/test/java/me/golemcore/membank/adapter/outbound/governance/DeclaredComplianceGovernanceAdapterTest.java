package me.golemcore.membank.adapter.outbound.governance;

import me.golemcore.membank.domain.model.GovernanceVerdict;
import me.golemcore.membank.domain.model.ProducerOutput;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeclaredComplianceGovernanceAdapterTest {

    private final DeclaredComplianceGovernanceAdapter adapter = new DeclaredComplianceGovernanceAdapter();

    @Test
    void shouldPassWhenComplianceIsUndeclared() {
        GovernanceVerdict verdict = adapter.evaluate(output().build());

        assertTrue(verdict.isCompliant());
        assertTrue(verdict.getViolations().isEmpty());
    }

    @Test
    void shouldPassDeclaredCompliantOutput() {
        assertTrue(adapter.evaluate(output().constitutionalCompliance(true).build()).isCompliant());
    }

    @Test
    void shouldFailOnReportedViolationsEvenIfDeclaredCompliant() {
        GovernanceVerdict verdict = adapter.evaluate(output()
                .constitutionalCompliance(true)
                .violations(Arrays.asList(" leaks credentials ", null, " "))
                .build());

        assertFalse(verdict.isCompliant());
        assertEquals(List.of("leaks credentials"), verdict.getViolations());
    }

    @Test
    void shouldRecordPlaceholderViolationWhenNoneGiven() {
        GovernanceVerdict verdict = adapter.evaluate(output().constitutionalCompliance(false).build());

        assertFalse(verdict.isCompliant());
        assertEquals(List.of(DeclaredComplianceGovernanceAdapter.UNSPECIFIED_VIOLATION), verdict.getViolations());
    }

    private static ProducerOutput.ProducerOutputBuilder output() {
        return ProducerOutput.builder()
                .loopId("loop-1")
                .component("planner")
                .category("decision");
    }
}
