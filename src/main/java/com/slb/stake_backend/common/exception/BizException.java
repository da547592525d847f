package com.slb.stake_backend.common.exception;

public class BizException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // HTTP 语义的错误码
    private final int code;

    // 稳定机器码，可为空
    private final String errorCode;

    public BizException(String message) {
        this(400, null, message);
    }

    public BizException(int code, String message) {
        this(code, null, message);
    }

    public BizException(int code, String errorCode, String message) {
        super(message);
        this.code = code;
        this.errorCode = errorCode;
    }

    public BizException(int code, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.errorCode = errorCode;
    }

    public int getCode() {
        return code;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
