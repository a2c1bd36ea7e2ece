package com.ryuqq.synergyflow.core.statemachine;

/**
 * 시너지 레코드의 승인 워크플로우 상태.
 *
 * <p>상태는 직접 설정되지 않으며, 항상 {@link WorkflowAction}을 통해서만 전이됩니다.
 * 전이가 하나도 없는 레코드는 암묵적으로 {@link #DRAFT} 상태입니다.</p>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * DRAFT ──submit──► REVIEW ──approve──► APPROVED ──realize──► REALIZED
 *   ▲                 │  │                  │
 *   │                 │  └──reject──┐       └──reject──┐
 *   │ return_to_draft │             ▼                  ▼
 *   └─────────────────┘           REJECTED ◄───────────┘
 *   ▲                               │
 *   └────────return_to_draft────────┘
 *
 * 종료 상태:
 * - REALIZED: 어떤 전이도 불가 (완전 종료)
 * - REJECTED: return_to_draft만 허용 (재개 가능한 소프트 종료)
 * </pre>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public enum WorkflowState {

    /**
     * 작성 중 (초기 상태).
     */
    DRAFT("draft"),

    /**
     * 검토 중.
     */
    REVIEW("review"),

    /**
     * 승인됨.
     */
    APPROVED("approved"),

    /**
     * 실현됨 (완전 종료).
     */
    REALIZED("realized"),

    /**
     * 반려됨 (재개 가능).
     */
    REJECTED("rejected");

    private final String wireValue;

    WorkflowState(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 전이가 없는 레코드의 상태.
     *
     * @return {@link #DRAFT}
     */
    public static WorkflowState initial() {
        return DRAFT;
    }

    /**
     * 저장소 및 API에서 사용하는 소문자 표현.
     *
     * @return wire 값 (예: "draft")
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * 완전 종료 상태인지 확인.
     *
     * <p>REALIZED만 해당합니다. REJECTED는 return_to_draft로 재개할 수 있으므로 false입니다.</p>
     *
     * @return REALIZED인 경우 true
     */
    public boolean isTerminal() {
        return this == REALIZED;
    }

    /**
     * 재개 가능한 소프트 종료 상태인지 확인.
     *
     * @return REJECTED인 경우 true
     */
    public boolean isReopenable() {
        return this == REJECTED;
    }

    /**
     * wire 값으로 상태 조회.
     *
     * @param wireValue 소문자 상태 이름
     * @return 일치하는 상태
     * @throws IllegalArgumentException null이거나 알 수 없는 값인 경우
     */
    public static WorkflowState fromWireValue(String wireValue) {
        if (wireValue == null) {
            throw new IllegalArgumentException("workflow state cannot be null");
        }
        for (WorkflowState state : values()) {
            if (state.wireValue.equals(wireValue)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown workflow state: " + wireValue);
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
