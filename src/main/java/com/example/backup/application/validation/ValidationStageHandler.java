package com.example.backup.application.validation;

import com.example.backup.domain.model.ValidationStage;

/**
 * 검증 파이프라인의 단일 단계
 * 실패는 ValidationFailureException 으로 보고한다 (첫 실패에서 파이프라인 중단).
 */
public interface ValidationStageHandler {

    ValidationStage stage();

    /**
     * @return 단계 결과 진단 메시지
     */
    String execute(ValidationContext context);
}
