package com.yerin.submitflow.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "작업을 찾을 수 없습니다.", "JOB-001"),
    UNKNOWN_PRIORITY(HttpStatus.BAD_REQUEST, "알 수 없는 우선순위입니다.", "JOB-002"),
    UNKNOWN_QUEUE(HttpStatus.BAD_REQUEST, "알 수 없는 큐 이름입니다.", "JOB-003"),
    DLQ_MESSAGE_NOT_FOUND(HttpStatus.NOT_FOUND, "DLQ 에서 메시지를 찾을 수 없습니다.", "JOB-004");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
