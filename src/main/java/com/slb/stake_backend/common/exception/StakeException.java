package com.slb.stake_backend.common.exception;

/**
 * 账本操作失败。抛出即代表整个操作被放弃，调用前的状态保持不变。
 */
public class StakeException extends BizException {

    private static final long serialVersionUID = 1L;

    private final StakeErrorCode kind;

    public StakeException(StakeErrorCode kind, String message) {
        super(kind.getStatus().value(), kind.getCode(), message);
        this.kind = kind;
    }

    public StakeException(StakeErrorCode kind, String message, Throwable cause) {
        super(kind.getStatus().value(), kind.getCode(), message, cause);
        this.kind = kind;
    }

    public StakeErrorCode getKind() {
        return kind;
    }

    public static StakeException invalidPoolId(int poolId) {
        return new StakeException(StakeErrorCode.INVALID_POOL_ID, "invalid pid: " + poolId);
    }

    public static StakeException invalidParameter(String message) {
        return new StakeException(StakeErrorCode.INVALID_PARAMETER, message);
    }

    public static StakeException transferFailed(String message, Throwable cause) {
        return new StakeException(StakeErrorCode.TRANSFER_FAILED, message, cause);
    }

    public static StakeException overflow(String operation) {
        return new StakeException(StakeErrorCode.OVERFLOW, operation + " overflow");
    }
}
