package com.ryuqq.synergyflow.adapter.runner;

import com.ryuqq.synergyflow.core.model.RecordId;

import java.util.List;

/**
 * 한 레코드의 전이 체인 감사 결과.
 *
 * @param recordId 감사한 레코드
 * @param checkedCount 검사한 전이 수
 * @param violations 발견된 위반 (sequence 순)
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public record ChainAuditReport(RecordId recordId, int checkedCount, List<Violation> violations) {

    /**
     * Compact Constructor.
     */
    public ChainAuditReport {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        if (checkedCount < 0) {
            throw new IllegalArgumentException("checkedCount must be non-negative (current: " + checkedCount + ")");
        }
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    /**
     * 위반이 없는지 확인.
     *
     * @return 체인이 온전하면 true
     */
    public boolean isIntact() {
        return violations.isEmpty();
    }

    /**
     * 체인 위반 하나.
     *
     * @param sequence 위반이 발견된 전이의 sequence
     * @param kind 위반 종류
     * @param detail 사람이 읽을 수 있는 설명
     */
    public record Violation(long sequence, Kind kind, String detail) {

        /**
         * Compact Constructor.
         */
        public Violation {
            if (kind == null) {
                throw new IllegalArgumentException("kind cannot be null");
            }
        }
    }

    /**
     * 위반 종류.
     */
    public enum Kind {
        /** sequence가 1부터 연속되지 않음 */
        SEQUENCE_GAP,
        /** fromState가 직전 전이의 toState와 다름 (첫 전이는 draft) */
        BROKEN_CHAIN,
        /** 상태 머신이 허용하지 않는 전이 */
        ILLEGAL_EDGE
    }
}
