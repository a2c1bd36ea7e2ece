package com.ryuqq.synergyflow.core.model;

/**
 * 전이를 수행한 인증된 사용자.
 *
 * <p>엔진은 신원이나 권한을 검증하지 않습니다. 인증 계층이 이미 확인한 값을 그대로 기록합니다.</p>
 *
 * @param id 사용자 식별자 (필수)
 * @param label 표시용 문자열 (예: 이메일). null 또는 빈 값이면 id로 대체
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public record Actor(String id, String label) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    public Actor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("actor id cannot be null or blank");
        }
        if (label == null || label.isBlank()) {
            label = id;
        }
    }

    /**
     * Actor 생성.
     *
     * @param id 사용자 식별자
     * @param label 표시용 문자열
     * @return Actor 인스턴스
     */
    public static Actor of(String id, String label) {
        return new Actor(id, label);
    }

    /**
     * 표시 문자열 없이 Actor 생성.
     *
     * @param id 사용자 식별자
     * @return label이 id와 같은 Actor
     */
    public static Actor of(String id) {
        return new Actor(id, null);
    }
}
