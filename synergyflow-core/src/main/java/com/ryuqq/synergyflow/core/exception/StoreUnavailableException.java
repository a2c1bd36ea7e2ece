package com.ryuqq.synergyflow.core.exception;

import com.ryuqq.synergyflow.core.model.RecordId;

import java.io.Serial;

/**
 * 전이 로그 저장소의 일시적 인프라 장애.
 *
 * <p>엔진은 이 오류를 숨기거나 재시도하지 않고 그대로 전파합니다.
 * 재시도 여부는 호출자의 정책에 따릅니다.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public class StoreUnavailableException extends WorkflowException {

    @Serial
    private static final long serialVersionUID = 3095417290153318852L;

    /**
     * 생성자.
     *
     * @param message 오류 설명
     * @param recordId 대상 레코드 (null 허용)
     * @param cause 원인
     */
    public StoreUnavailableException(String message, RecordId recordId, Throwable cause) {
        super(message, recordId, null, null, cause);
    }

    /**
     * 레코드와 무관한 장애용 생성자.
     *
     * @param message 오류 설명
     * @param cause 원인
     */
    public StoreUnavailableException(String message, Throwable cause) {
        this(message, null, cause);
    }
}
