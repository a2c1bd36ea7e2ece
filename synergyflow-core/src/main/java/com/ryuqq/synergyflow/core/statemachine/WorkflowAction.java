package com.ryuqq.synergyflow.core.statemachine;

import java.util.Locale;

/**
 * 호출자가 요청할 수 있는 워크플로우 동작.
 *
 * <p>동작은 상태 변경의 유일한 트리거입니다. 각 동작이 어떤 상태에서 허용되는지는
 * {@link StateMachine}이 결정합니다.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public enum WorkflowAction {

    /** 검토 요청 (draft → review). */
    SUBMIT("submit"),

    /** 승인 (review → approved). */
    APPROVE("approve"),

    /** 반려 (review/approved → rejected). */
    REJECT("reject"),

    /** 실현 처리 (approved → realized). */
    REALIZE("realize"),

    /** 작성 중으로 되돌림 (review/rejected → draft). */
    RETURN_TO_DRAFT("return_to_draft");

    private final String wireValue;

    WorkflowAction(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * 저장소 및 API에서 사용하는 소문자 표현.
     *
     * @return wire 값 (예: "return_to_draft")
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * 감사 타임라인에 표시할 대문자 레이블.
     *
     * @return 레이블 (예: "RETURN TO DRAFT")
     */
    public String label() {
        return wireValue.replace('_', ' ').toUpperCase(Locale.ROOT);
    }

    /**
     * wire 값으로 동작 조회.
     *
     * @param wireValue 소문자 동작 이름
     * @return 일치하는 동작
     * @throws IllegalArgumentException null이거나 알 수 없는 값인 경우
     */
    public static WorkflowAction fromWireValue(String wireValue) {
        if (wireValue == null) {
            throw new IllegalArgumentException("workflow action cannot be null");
        }
        for (WorkflowAction action : values()) {
            if (action.wireValue.equals(wireValue)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown workflow action: " + wireValue);
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
