package com.slb.stake_backend.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 质押账本的错误类别 / Error kinds raised by the staking ledger.
 */
public enum StakeErrorCode {
    INVALID_POOL_ID(HttpStatus.NOT_FOUND, "STAKE_INVALID_POOL_ID", "invalid pid"),
    INVALID_PARAMETER(HttpStatus.BAD_REQUEST, "STAKE_INVALID_PARAMETER", "invalid parameter"),
    INSUFFICIENT_BALANCE(HttpStatus.BAD_REQUEST, "STAKE_INSUFFICIENT_BALANCE", "not enough staking token balance"),
    OVERFLOW(HttpStatus.UNPROCESSABLE_ENTITY, "STAKE_OVERFLOW", "arithmetic overflow"),
    PAUSED(HttpStatus.LOCKED, "STAKE_PAUSED", "operation is paused"),
    UNAUTHORIZED(HttpStatus.FORBIDDEN, "STAKE_UNAUTHORIZED", "caller is not authorized"),
    TRANSFER_FAILED(HttpStatus.BAD_GATEWAY, "STAKE_TRANSFER_FAILED", "asset transfer failed");

    private final HttpStatus status;
    private final String code;
    private final String defaultMessage;

    StakeErrorCode(HttpStatus status, String code, String defaultMessage) {
        this.status = status;
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
