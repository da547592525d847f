package com.slb.stake_backend.modules.stake.port;

/**
 * 当前块高度来源，账本本身不读系统时间。
 */
@FunctionalInterface
public interface BlockClock {

    long currentHeight();
}
