package com.ryuqq.synergyflow.core.exception;

import com.ryuqq.synergyflow.core.model.RecordId;

import java.io.Serial;

/**
 * 요청한 sequence의 전이가 존재하지 않는 경우.
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public class TransitionNotFoundException extends WorkflowException {

    @Serial
    private static final long serialVersionUID = -5931722088617207731L;

    private final long sequence;

    /**
     * 생성자.
     *
     * @param recordId 대상 레코드
     * @param sequence 조회한 sequence
     */
    public TransitionNotFoundException(RecordId recordId, long sequence) {
        super(String.format("no transition #%d found for %s", sequence, describe(recordId)),
            recordId, null, null, null);
        this.sequence = sequence;
    }

    /**
     * 조회한 sequence.
     *
     * @return sequence
     */
    public long getSequence() {
        return sequence;
    }
}
