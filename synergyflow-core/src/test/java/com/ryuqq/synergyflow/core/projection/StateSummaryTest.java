package com.ryuqq.synergyflow.core.projection;

import com.ryuqq.synergyflow.core.statemachine.WorkflowState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.ryuqq.synergyflow.core.statemachine.WorkflowState.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateSummaryTest {

    @Test
    void of_CountsEachStateAndFillsMissingWithZero() {
        StateSummary summary = StateSummary.of(List.of(DRAFT, REVIEW, REVIEW, REALIZED));

        assertThat(summary.countOf(DRAFT)).isEqualTo(1);
        assertThat(summary.countOf(REVIEW)).isEqualTo(2);
        assertThat(summary.countOf(APPROVED)).isZero();
        assertThat(summary.countOf(REJECTED)).isZero();
        assertThat(summary.countOf(REALIZED)).isEqualTo(1);
        assertThat(summary.total()).isEqualTo(4);
        assertThat(summary.counts()).hasSize(WorkflowState.values().length);
    }

    @Test
    void of_Empty_AllZero() {
        StateSummary summary = StateSummary.of(List.of());

        assertThat(summary.total()).isZero();
        assertThat(summary.counts().values()).containsOnly(0L);
    }

    @Test
    void constructor_NegativeCount_ThrowsException() {
        assertThatThrownBy(() -> new StateSummary(Map.of(DRAFT, -1L)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("non-negative");
    }

    @Test
    void countOf_NullState_ThrowsException() {
        StateSummary summary = StateSummary.of(List.of(DRAFT));

        assertThatThrownBy(() -> summary.countOf(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("state cannot be null");
    }
}
