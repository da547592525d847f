package com.slb.stake_backend.common.api;

import com.slb.stake_backend.common.exception.BizException;
import com.slb.stake_backend.common.exception.StakeErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BizException.class)
    public ResponseEntity<ApiResponse<Void>> biz(BizException e) {
        HttpStatus status = HttpStatus.resolve(e.getCode());
        if (status == null) {
            status = HttpStatus.BAD_REQUEST;
        }
        log.info("Request rejected: code={}, errorCode={}, message={}", e.getCode(), e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(status)
                .body(ApiResponse.error(status.value(), e.getErrorCode(), e.getMessage(), null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> invalidBody(MethodArgumentNotValidException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        StakeErrorCode kind = StakeErrorCode.INVALID_PARAMETER;
        return ResponseEntity.status(kind.getStatus())
                .body(ApiResponse.error(kind.getStatus().value(), kind.getCode(), kind.getDefaultMessage(), errors));
    }

    /**
     * 缺参、参数类型不符或请求体无法解析，统一按 400 返回。
     */
    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiResponse<Void>> malformed(Exception e) {
        StakeErrorCode kind = StakeErrorCode.INVALID_PARAMETER;
        log.info("Malformed request: {}", e.getMessage());
        return ResponseEntity.status(kind.getStatus())
                .body(ApiResponse.error(kind.getStatus().value(), kind.getCode(), kind.getDefaultMessage(), null));
    }
}
