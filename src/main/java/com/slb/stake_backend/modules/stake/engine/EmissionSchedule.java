package com.slb.stake_backend.modules.stake.engine;

import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.modules.stake.math.CheckedMath;
import org.springframework.util.StringUtils;

import java.math.BigInteger;

/**
 * 排放参数：在 [startHeight, endHeight) 区间内每个块固定排放 ratePerBlock 的 rewardAssetId。
 */
public class EmissionSchedule {

    private String rewardAssetId;
    private long startHeight;
    private long endHeight;
    private BigInteger ratePerBlock;

    public EmissionSchedule(String rewardAssetId, long startHeight, long endHeight, BigInteger ratePerBlock) {
        if (!StringUtils.hasText(rewardAssetId)) {
            throw StakeException.invalidParameter("reward asset must not be blank");
        }
        if (startHeight < 0 || startHeight > endHeight) {
            throw StakeException.invalidParameter("invalid parameters: start height must not exceed end height");
        }
        requirePositiveRate(ratePerBlock);
        this.rewardAssetId = rewardAssetId;
        this.startHeight = startHeight;
        this.endHeight = endHeight;
        this.ratePerBlock = ratePerBlock;
    }

    /**
     * [from, to) 与排放区间相交部分的总排放量。
     */
    public BigInteger multiplier(long from, long to) {
        if (from > to) {
            throw StakeException.invalidParameter("invalid block range: from " + from + " > to " + to);
        }
        long clippedFrom = Math.max(from, startHeight);
        long clippedTo = Math.min(to, endHeight);
        if (clippedFrom >= clippedTo) {
            return BigInteger.ZERO;
        }
        BigInteger blocks = CheckedMath.sub(BigInteger.valueOf(clippedTo), BigInteger.valueOf(clippedFrom));
        return CheckedMath.mul(blocks, ratePerBlock);
    }

    public boolean hasEnded(long height) {
        return height >= endHeight;
    }

    public void setRewardAssetId(String rewardAssetId) {
        if (!StringUtils.hasText(rewardAssetId)) {
            throw StakeException.invalidParameter("reward asset must not be blank");
        }
        this.rewardAssetId = rewardAssetId;
    }

    public void setStartHeight(long startHeight) {
        if (startHeight < 0 || startHeight > endHeight) {
            throw StakeException.invalidParameter("start height must be smaller than end height");
        }
        this.startHeight = startHeight;
    }

    public void setEndHeight(long endHeight) {
        if (startHeight > endHeight) {
            throw StakeException.invalidParameter("start height must be smaller than end height");
        }
        this.endHeight = endHeight;
    }

    public void setRatePerBlock(BigInteger ratePerBlock) {
        requirePositiveRate(ratePerBlock);
        this.ratePerBlock = ratePerBlock;
    }

    public String getRewardAssetId() {
        return rewardAssetId;
    }

    public long getStartHeight() {
        return startHeight;
    }

    public long getEndHeight() {
        return endHeight;
    }

    public BigInteger getRatePerBlock() {
        return ratePerBlock;
    }

    private static void requirePositiveRate(BigInteger ratePerBlock) {
        if (!CheckedMath.isUint256(ratePerBlock) || ratePerBlock.signum() == 0) {
            throw StakeException.invalidParameter("invalid parameter: reward per block must be positive");
        }
    }
}
