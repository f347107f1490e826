package io.kairon.core.result;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

public class ValidationSummaryTest {

    private final ValidationResult clean = ValidationResult.builder("A").build();
    private final ValidationResult warned =
            ValidationResult.builder("B").add(Diagnostic.warning("r", "B", "w")).build();
    private final ValidationResult failed =
            ValidationResult.builder("C")
                    .add(Diagnostic.error("r", "C", "e1"))
                    .add(Diagnostic.error("r", "C", "e2"))
                    .add(Diagnostic.warning("r", "C", "w"))
                    .build();

    @Test
    void shouldSumCounts() {
        var summary = ValidationSummary.of(List.of(clean, warned, failed));

        assertThat(summary).isEqualTo(new ValidationSummary(3, 2, 2, 1));
    }

    @Test
    void shouldExitWithOneOnErrors() {
        var summary = ValidationSummary.of(List.of(clean, failed));

        assertThat(summary.exitCode(false)).isEqualTo(ValidationSummary.EXIT_ERRORS);
        assertThat(summary.exitCode(true)).isEqualTo(ValidationSummary.EXIT_ERRORS);
    }

    @Test
    void shouldExitWithTwoOnlyForStrictWarnings() {
        var summary = ValidationSummary.of(List.of(clean, warned));

        assertThat(summary.exitCode(false)).isEqualTo(ValidationSummary.EXIT_OK);
        assertThat(summary.exitCode(true)).isEqualTo(ValidationSummary.EXIT_WARNINGS);
    }

    @Test
    void shouldExitWithZeroWhenClean() {
        assertThat(ValidationSummary.of(List.of(clean)).exitCode(true))
                .isEqualTo(ValidationSummary.EXIT_OK);
        assertThat(ValidationSummary.of(List.of())).isEqualTo(ValidationSummary.empty());
    }
}
