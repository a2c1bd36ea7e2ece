package com.ryuqq.synergyflow.core.projection;

/**
 * 파이프라인 단계의 표시 상태.
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public enum StageStatus {

    /** 지나온 단계. */
    COMPLETE("complete"),

    /** 현재 단계. */
    ACTIVE("active"),

    /** 아직 도달하지 않은 단계. */
    PENDING("pending"),

    /** 반려로 인해 도달할 수 없게 된 단계. */
    REJECTED("rejected");

    private final String wireValue;

    StageStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * API에서 사용하는 소문자 표현.
     *
     * @return wire 값
     */
    public String wireValue() {
        return wireValue;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
