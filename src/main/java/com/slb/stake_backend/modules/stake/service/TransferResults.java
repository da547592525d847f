package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.common.exception.StakeErrorCode;
import com.slb.stake_backend.common.exception.StakeException;

/**
 * 转账返回值校验。空返回视为成功；非空时第一个 32 字节字必须是 ABI bool 且为 true。
 */
public final class TransferResults {

    private static final int WORD = 32;

    private TransferResults() {
    }

    public static void requireSuccess(byte[] result) {
        if (result == null || result.length == 0) {
            return;
        }
        if (result.length < WORD) {
            throw new StakeException(StakeErrorCode.TRANSFER_FAILED, "transfer returned a malformed result");
        }
        for (int i = 0; i < WORD - 1; i++) {
            if (result[i] != 0) {
                throw new StakeException(StakeErrorCode.TRANSFER_FAILED, "transfer returned a malformed result");
            }
        }
        if (result[WORD - 1] != 1) {
            throw new StakeException(StakeErrorCode.TRANSFER_FAILED, "transfer was not successful");
        }
    }

    /** 32 字节 ABI true */
    public static byte[] abiTrue() {
        byte[] word = new byte[WORD];
        word[WORD - 1] = 1;
        return word;
    }
}
