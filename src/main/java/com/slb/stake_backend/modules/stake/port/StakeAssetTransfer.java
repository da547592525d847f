package com.slb.stake_backend.modules.stake.port;

import java.math.BigInteger;

/**
 * 质押资产在用户和质押金库之间的转移。
 */
public interface StakeAssetTransfer {

    /**
     * 从 from 转入 amount 的 assetId 到金库，失败时抛异常。
     */
    void pull(String assetId, String from, BigInteger amount);

    /**
     * 从金库转出 amount 的 assetId 给 to。
     *
     * @return 原始调用结果：空，或 32 字节 ABI bool 字
     */
    byte[] push(String assetId, String to, BigInteger amount);
}
