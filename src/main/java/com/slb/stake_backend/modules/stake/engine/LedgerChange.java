package com.slb.stake_backend.modules.stake.engine;

/**
 * 用户操作的暂存结果。调用 {@link StakeLedger#commit(LedgerChange)} 之前账本不变，丢弃即放弃操作。
 *
 * @param pool        暂存的池子副本，池子未改动时为 null
 * @param user        暂存的用户记录
 * @param persistUser 提交时是否写入 user（首次存入时新建记录）
 * @param settlement  暂存过程中做的结算，池子已是最新时为 null
 */
public record LedgerChange<R>(Pool pool,
                              UserStake user,
                              boolean persistUser,
                              PoolSettlement settlement,
                              R receipt) {
}
