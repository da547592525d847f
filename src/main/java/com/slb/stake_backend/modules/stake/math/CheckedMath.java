package com.slb.stake_backend.modules.stake.math;

import com.slb.stake_backend.common.exception.StakeException;

import java.math.BigInteger;

/**
 * 无符号 256 位运算。结果必须落在 [0, 2^256) 内，越界或除以 0 抛 OVERFLOW，不回绕。
 */
public final class CheckedMath {

    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    /** accRewardPerShare 的定点放大倍数 */
    public static final BigInteger SCALE = BigInteger.TEN.pow(18);

    private CheckedMath() {
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        return bounded(a.add(b), "add");
    }

    public static BigInteger sub(BigInteger a, BigInteger b) {
        return bounded(a.subtract(b), "sub");
    }

    public static BigInteger mul(BigInteger a, BigInteger b) {
        return bounded(a.multiply(b), "mul");
    }

    public static BigInteger div(BigInteger a, BigInteger b) {
        if (b.signum() == 0) {
            throw StakeException.overflow("div");
        }
        return bounded(a.divide(b), "div");
    }

    /** a * b / c，每一步都检查 */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger c) {
        return div(mul(a, b), c);
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static boolean isUint256(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(MAX_UINT256) <= 0;
    }

    /**
     * 校验调用方传入的数量。
     */
    public static BigInteger requireUint256(BigInteger value, String name) {
        if (!isUint256(value)) {
            throw StakeException.invalidParameter(name + " must be an unsigned 256-bit integer");
        }
        return value;
    }

    private static BigInteger bounded(BigInteger result, String operation) {
        if (result.signum() < 0 || result.compareTo(MAX_UINT256) > 0) {
            throw StakeException.overflow(operation);
        }
        return result;
    }
}
