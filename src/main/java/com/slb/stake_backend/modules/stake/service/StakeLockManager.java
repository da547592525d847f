package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.modules.stake.engine.StakeLedger;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * 账本锁。加锁顺序固定：先全局读写锁，再按池子 ID 升序取池子锁，奖励金库锁最后。
 * <ul>
 *     <li>单池操作：全局读锁 + 该池子的锁</li>
 *     <li>改权重 / 排放参数 / 批量结算 / 新增池子：全局写锁（排斥所有单池操作）</li>
 * </ul>
 * 池子只增不删，池子锁只为已存在的池子创建。
 */
@Component
public class StakeLockManager {

    private final ReentrantReadWriteLock globalLock = new ReentrantReadWriteLock();
    private final Map<Integer, ReentrantLock> poolLocks = new ConcurrentHashMap<>();
    private final ReentrantLock rewardVaultLock = new ReentrantLock();
    private final StakeLedger ledger;

    public StakeLockManager(StakeLedger ledger) {
        this.ledger = ledger;
    }

    public <T> T withPool(int poolId, Supplier<T> action) {
        globalLock.readLock().lock();
        try {
            // 新增池子持有写锁，读锁下池子数量不会变化
            if (poolId < 0 || poolId >= ledger.poolLength()) {
                throw StakeException.invalidPoolId(poolId);
            }
            ReentrantLock poolLock = poolLocks.computeIfAbsent(poolId, id -> new ReentrantLock());
            poolLock.lock();
            try {
                return action.get();
            } finally {
                poolLock.unlock();
            }
        } finally {
            globalLock.readLock().unlock();
        }
    }

    /** 只读全局参数（排放配置、总权重） */
    public <T> T withGlobalRead(Supplier<T> action) {
        globalLock.readLock().lock();
        try {
            return action.get();
        } finally {
            globalLock.readLock().unlock();
        }
    }

    public <T> T withAll(Supplier<T> action) {
        globalLock.writeLock().lock();
        try {
            return action.get();
        } finally {
            globalLock.writeLock().unlock();
        }
    }

    /**
     * 读奖励余额并转账期间持有，调用方须已持有池子锁或全局锁。
     */
    public <T> T withRewardVault(Supplier<T> action) {
        rewardVaultLock.lock();
        try {
            return action.get();
        } finally {
            rewardVaultLock.unlock();
        }
    }
}
