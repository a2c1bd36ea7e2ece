package com.ryuqq.synergyflow.core.model;

import java.util.regex.Pattern;

/**
 * 워크플로우가 추적하는 비즈니스 레코드(시너지)의 식별자.
 *
 * <p>RecordId는 전이 로그의 소유자 키이며, 레코드별 sequence 순서의 범위를 정합니다.
 * 레코드의 존재 여부는 검증하지 않습니다 (레코드 CRUD 계층의 책임).</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public final class RecordId {

    private static final int MAX_LENGTH = 255;
    private static final Pattern ALLOWED = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    private final String value;

    private RecordId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RecordId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("RecordId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "RecordId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed: " + value);
        }
        this.value = value;
    }

    /**
     * RecordId 생성.
     *
     * @param value 레코드 식별자 값
     * @return RecordId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RecordId of(String value) {
        return new RecordId(value);
    }

    /**
     * 숫자 식별자로 RecordId 생성 (예: 시너지 테이블의 정수 PK).
     *
     * @param value 양수 식별자
     * @return RecordId 인스턴스
     * @throws IllegalArgumentException value가 양수가 아닌 경우
     */
    public static RecordId of(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("RecordId must be positive (current: " + value + ")");
        }
        return new RecordId(Long.toString(value));
    }

    /**
     * RecordId 값 조회.
     *
     * @return 식별자 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordId recordId = (RecordId) o;
        return value.equals(recordId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RecordId{" + value + '}';
    }
}
