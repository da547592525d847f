package com.slb.stake_backend.modules.stake.port;

/**
 * 需要 {@link Authorizer} 授权的管理操作。
 */
public enum StakeAction {
    ADD_POOL,
    UPDATE_POOL,
    SET_POOL_WEIGHT,
    SETTLE,
    SET_EMISSION,
    PAUSE,
    FUND,
    AUDIT
}
