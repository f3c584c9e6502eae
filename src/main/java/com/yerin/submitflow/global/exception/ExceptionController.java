package com.yerin.submitflow.global.exception;

import com.yerin.submitflow.domain.failure.PipelineException;
import com.yerin.submitflow.global.dto.ErrorResponse;
import com.yerin.submitflow.global.exception.code.CommonErrorCode;
import com.yerin.submitflow.global.exception.code.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ExceptionController {

    @ExceptionHandler(AppException.class)
    public ResponseEntity<ErrorResponse> handleAppException(AppException e,
                                                            HttpServletRequest request) {
        ErrorCode errorCode = e.getErrorCode();
        log.error("AppException: {}, path={} {}", errorCode.getMessage(),
                request.getMethod(), request.getRequestURI());

        ErrorResponse body = ErrorResponse.of(errorCode, request);
        return ResponseEntity.status(errorCode.getHttpStatus()).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e,
                                                          HttpServletRequest request) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String msg = (fieldError != null)
                ? fieldError.getDefaultMessage()
                : "입력값이 유효하지 않습니다.";

        ErrorCode errorCode = CommonErrorCode.INVALID_PARAMETER.withDetail(msg);
        log.error("Validation failed: {}, path={} {}", msg,
                request.getMethod(), request.getRequestURI());

        ErrorResponse body = ErrorResponse.of(errorCode, request);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e,
                                                          HttpServletRequest request) {
        log.error("Unreadable body, path={} {}", request.getMethod(), request.getRequestURI());
        ErrorResponse body = ErrorResponse.of(CommonErrorCode.BAD_REQUEST, request);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    // 큐/DB 일시 장애
    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> handlePipeline(PipelineException e,
                                                        HttpServletRequest request) {
        log.error("PipelineException: class={}, msg={}, path={} {}", e.getFailureClass(), e.getMessage(),
                request.getMethod(), request.getRequestURI());
        ErrorCode code = e.isRetryable() ? CommonErrorCode.SERVICE_UNAVAILABLE : CommonErrorCode.BAD_REQUEST;
        return ResponseEntity.status(code.getHttpStatus()).body(ErrorResponse.of(code, request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAll(Exception e,
                                                   HttpServletRequest request) {
        log.error("Unhandled exception: ", e);
        ErrorResponse body = ErrorResponse.of(CommonErrorCode.INTERNAL_SERVER_ERROR, request);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
