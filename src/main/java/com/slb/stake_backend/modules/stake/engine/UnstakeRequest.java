package com.slb.stake_backend.modules.stake.engine;

import java.math.BigInteger;

/**
 * 解押请求，链高度到达 maturityHeight 后可提取。
 */
public record UnstakeRequest(BigInteger amount, long maturityHeight) {

    public boolean isMatured(long height) {
        return maturityHeight <= height;
    }
}
