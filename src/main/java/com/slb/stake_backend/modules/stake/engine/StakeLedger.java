package com.slb.stake_backend.modules.stake.engine;

import com.slb.stake_backend.common.exception.StakeErrorCode;
import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.modules.stake.math.CheckedMath;
import org.springframework.util.StringUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 全部池子和用户的奖励记账。
 * <p>
 * 用户操作分两步：prepare* 生成池子和用户记录的暂存副本，{@link #commit(LedgerChange)} 写回。
 * 调用方在两步之间做资产转账，转账或校验失败不会留下任何修改。管理操作先完成全部校验和计算再写入。
 * <p>
 * 本类不加锁，调用方须持有全局锁和对应池子锁。
 */
public class StakeLedger {

    private final EmissionSchedule schedule;
    private final PoolRegistry registry;
    private final SettlementEngine settlementEngine;
    private final Map<UserKey, UserStake> users = new ConcurrentHashMap<>();

    public StakeLedger(EmissionSchedule schedule) {
        this.schedule = schedule;
        this.registry = new PoolRegistry();
        this.settlementEngine = new SettlementEngine(schedule, registry);
    }

    /* ----------- user operations ----------- */

    public LedgerChange<LedgerReceipts.Deposit> prepareDeposit(int poolId, String principal, BigInteger amount, long height) {
        CheckedMath.requireUint256(amount, "amount");
        Pool pool = registry.get(poolId).copy();
        if (amount.compareTo(pool.getMinDeposit()) < 0) {
            throw StakeException.invalidParameter("deposit amount is too small, minimum is " + pool.getMinDeposit());
        }
        PoolSettlement settlement = settlementEngine.settle(pool, height);
        UserStake user = stageUser(poolId, principal);

        foldAccrued(user, pool);
        if (amount.signum() > 0) {
            user.setStakeAmount(CheckedMath.add(user.getStakeAmount(), amount));
            pool.setTotalStaked(CheckedMath.add(pool.getTotalStaked(), amount));
        }
        rebase(user, pool);

        LedgerReceipts.Deposit receipt = new LedgerReceipts.Deposit(poolId, principal, pool.getStakeAssetId(), amount,
                user.getStakeAmount(), user.getPendingReward(), height);
        return new LedgerChange<>(pool, user, true, settlement, receipt);
    }

    public LedgerChange<LedgerReceipts.Unstake> prepareUnstake(int poolId, String principal, BigInteger amount, long height) {
        CheckedMath.requireUint256(amount, "amount");
        Pool pool = registry.get(poolId).copy();
        UserStake user = stageUser(poolId, principal);
        if (user.getStakeAmount().compareTo(amount) < 0) {
            throw new StakeException(StakeErrorCode.INSUFFICIENT_BALANCE,
                    "not enough staking token balance: staked " + user.getStakeAmount() + ", requested " + amount);
        }
        PoolSettlement settlement = settlementEngine.settle(pool, height);

        foldAccrued(user, pool);
        Long maturityHeight = null;
        if (amount.signum() > 0) {
            user.setStakeAmount(CheckedMath.sub(user.getStakeAmount(), amount));
            pool.setTotalStaked(CheckedMath.sub(pool.getTotalStaked(), amount));
            maturityHeight = maturityOf(height, pool.getUnstakeLockBlocks());
            user.getWithdrawalQueue().append(new UnstakeRequest(amount, maturityHeight));
        }
        rebase(user, pool);

        LedgerReceipts.Unstake receipt = new LedgerReceipts.Unstake(poolId, principal, amount,
                user.getStakeAmount(), maturityHeight, height);
        return new LedgerChange<>(pool, user, exists(poolId, principal), settlement, receipt);
    }

    /**
     * 释放队首连续到期的解押请求，不结算池子。
     */
    public LedgerChange<LedgerReceipts.Withdraw> prepareWithdraw(int poolId, String principal, long height) {
        Pool pool = registry.get(poolId);
        UserStake user = stageUser(poolId, principal);
        WithdrawalQueue queue = user.getWithdrawalQueue();

        int matured = queue.maturedPrefixLength(height);
        BigInteger amount = queue.sumOfFirst(matured);
        queue.removeFirst(matured);

        LedgerReceipts.Withdraw receipt = new LedgerReceipts.Withdraw(poolId, principal, pool.getStakeAssetId(), amount,
                matured, queue.size(), height);
        return new LedgerChange<>(null, user, exists(poolId, principal), null, receipt);
    }

    /**
     * 暂存一次领取，最多发放 availableReward。
     */
    public LedgerChange<LedgerReceipts.Claim> prepareClaim(int poolId, String principal, long height,
                                                           BigInteger availableReward, RewardShortfallMode mode) {
        Pool pool = registry.get(poolId).copy();
        PoolSettlement settlement = settlementEngine.settle(pool, height);
        UserStake user = stageUser(poolId, principal);

        BigInteger owed = owed(user, pool.getAccRewardPerShare());
        BigInteger paid = BigInteger.ZERO;
        if (owed.signum() > 0) {
            paid = CheckedMath.min(owed, availableReward);
            BigInteger carried = mode == RewardShortfallMode.STRICT ? CheckedMath.sub(owed, paid) : BigInteger.ZERO;
            user.setPendingReward(carried);
        }
        rebase(user, pool);

        LedgerReceipts.Claim receipt = new LedgerReceipts.Claim(poolId, principal, schedule.getRewardAssetId(), owed, paid,
                user.getPendingReward(), height);
        return new LedgerChange<>(pool, user, exists(poolId, principal), settlement, receipt);
    }

    public void commit(LedgerChange<?> change) {
        if (change.pool() != null) {
            registry.replace(change.pool());
        }
        if (change.persistUser()) {
            UserStake user = change.user();
            users.put(new UserKey(user.getPoolId(), user.getPrincipal()), user);
        }
    }

    /* ----------- pool administration ----------- */

    public LedgerReceipts.PoolAdded addPool(String stakeAssetId, BigInteger weight, BigInteger minDeposit,
                                            long unstakeLockBlocks, boolean withSettle, long height) {
        boolean first = registry.size() == 0;
        if (!StringUtils.hasText(stakeAssetId)) {
            throw StakeException.invalidParameter("invalid staking token address");
        }
        if (first && !Pool.NATIVE_ASSET.equals(stakeAssetId)) {
            throw StakeException.invalidParameter("invalid staking token address: pool 0 must stake the native asset");
        }
        if (!first && Pool.NATIVE_ASSET.equals(stakeAssetId)) {
            throw StakeException.invalidParameter("invalid staking token address: only pool 0 stakes the native asset");
        }
        requirePositive(weight, "invalid pool weight");
        CheckedMath.requireUint256(minDeposit, "minDeposit");
        if (unstakeLockBlocks <= 0) {
            throw StakeException.invalidParameter("invalid withdraw locked blocks");
        }
        if (schedule.hasEnded(height)) {
            throw StakeException.invalidParameter("already ended");
        }

        List<SettlementEngine.StagedSettlement> staged = withSettle ? settlementEngine.stageAll(height) : List.of();
        BigInteger newTotalWeight = CheckedMath.add(registry.getTotalWeight(), weight);

        Pool pool = new Pool();
        pool.setStakeAssetId(stakeAssetId);
        pool.setWeight(weight);
        pool.setLastSettledHeight(Math.max(height, schedule.getStartHeight()));
        pool.setAccRewardPerShare(BigInteger.ZERO);
        pool.setTotalStaked(BigInteger.ZERO);
        pool.setMinDeposit(minDeposit);
        pool.setUnstakeLockBlocks(unstakeLockBlocks);

        List<PoolSettlement> settlements = commitStaged(staged);
        registry.append(pool, newTotalWeight);
        return new LedgerReceipts.PoolAdded(pool.copy(), settlements);
    }

    public Pool updatePool(int poolId, BigInteger minDeposit, long unstakeLockBlocks) {
        CheckedMath.requireUint256(minDeposit, "minDeposit");
        if (unstakeLockBlocks <= 0) {
            throw StakeException.invalidParameter("invalid withdraw locked blocks");
        }
        Pool pool = registry.get(poolId).copy();
        pool.setMinDeposit(minDeposit);
        pool.setUnstakeLockBlocks(unstakeLockBlocks);
        registry.replace(pool);
        return pool.copy();
    }

    public LedgerReceipts.PoolWeightChanged setPoolWeight(int poolId, BigInteger weight, boolean withSettle, long height) {
        requirePositive(weight, "invalid pool weight");
        BigInteger oldWeight = registry.get(poolId).getWeight();
        BigInteger newTotalWeight = registry.totalWeightWith(poolId, weight);
        List<SettlementEngine.StagedSettlement> staged = withSettle ? settlementEngine.stageAll(height) : List.of();

        List<PoolSettlement> settlements = commitStaged(staged);
        Pool pool = registry.get(poolId).copy();
        pool.setWeight(weight);
        registry.replace(pool, newTotalWeight);
        return new LedgerReceipts.PoolWeightChanged(poolId, oldWeight, weight, newTotalWeight, settlements);
    }

    /**
     * 结算单个池子，已是最新时返回 empty。
     */
    public Optional<PoolSettlement> settlePool(int poolId, long height) {
        Pool pool = registry.get(poolId).copy();
        PoolSettlement settlement = settlementEngine.settle(pool, height);
        if (settlement == null) {
            return Optional.empty();
        }
        registry.replace(pool);
        return Optional.of(settlement);
    }

    /**
     * 按 ID 顺序结算全部池子，要么全部成功要么都不改。
     */
    public List<PoolSettlement> settleAllPools(long height) {
        return commitStaged(settlementEngine.stageAll(height));
    }

    public void setRewardAssetId(String rewardAssetId) {
        schedule.setRewardAssetId(rewardAssetId);
    }

    public void setStartHeight(long startHeight) {
        schedule.setStartHeight(startHeight);
    }

    public void setEndHeight(long endHeight) {
        schedule.setEndHeight(endHeight);
    }

    public void setRatePerBlock(BigInteger ratePerBlock) {
        schedule.setRatePerBlock(ratePerBlock);
    }

    /* ----------- queries ----------- */

    public int poolLength() {
        return registry.size();
    }

    public Pool pool(int poolId) {
        return registry.get(poolId).copy();
    }

    public List<Pool> pools() {
        return registry.snapshot();
    }

    public BigInteger totalWeight() {
        return registry.getTotalWeight();
    }

    public EmissionSchedule schedule() {
        return schedule;
    }

    public BigInteger multiplier(long from, long to) {
        return schedule.multiplier(from, to);
    }

    /** 用户记录副本，从未操作过的用户返回空记录 */
    public UserStake userStake(int poolId, String principal) {
        registry.get(poolId);
        UserStake user = users.get(new UserKey(poolId, principal));
        return user != null ? user.copy() : new UserStake(poolId, principal);
    }

    public BigInteger stakingBalance(int poolId, String principal) {
        return userStake(poolId, principal).getStakeAmount();
    }

    /**
     * height 时可领取的奖励，基于推算的累计值计算。
     */
    public BigInteger pendingRewardAt(int poolId, String principal, long height) {
        Pool pool = registry.get(poolId);
        BigInteger acc = settlementEngine.projectAccRewardPerShare(pool, height);
        return owed(userStake(poolId, principal), acc);
    }

    public LedgerReceipts.WithdrawAmounts withdrawAmount(int poolId, String principal, long height) {
        WithdrawalQueue queue = userStake(poolId, principal).getWithdrawalQueue();
        return new LedgerReceipts.WithdrawAmounts(queue.totalRequested(), queue.totalMatured(height));
    }

    /* ----------- accrual ----------- */

    private static BigInteger accrued(UserStake user, BigInteger acc) {
        return CheckedMath.mulDiv(user.getStakeAmount(), acc, CheckedMath.SCALE);
    }

    private static BigInteger owed(UserStake user, BigInteger acc) {
        return CheckedMath.add(CheckedMath.sub(accrued(user, acc), user.getSettledBaseline()), user.getPendingReward());
    }

    /**
     * 把上次操作以来新增的奖励计入 pendingReward。
     */
    private static void foldAccrued(UserStake user, Pool pool) {
        if (user.getStakeAmount().signum() == 0) {
            return;
        }
        BigInteger delta = CheckedMath.sub(accrued(user, pool.getAccRewardPerShare()), user.getSettledBaseline());
        if (delta.signum() > 0) {
            user.setPendingReward(CheckedMath.add(user.getPendingReward(), delta));
        }
    }

    private static void rebase(UserStake user, Pool pool) {
        user.setSettledBaseline(accrued(user, pool.getAccRewardPerShare()));
    }

    private UserStake stageUser(int poolId, String principal) {
        if (!StringUtils.hasText(principal)) {
            throw StakeException.invalidParameter("principal must not be blank");
        }
        UserStake existing = users.get(new UserKey(poolId, principal));
        return existing != null ? existing.copy() : new UserStake(poolId, principal);
    }

    private boolean exists(int poolId, String principal) {
        return users.containsKey(new UserKey(poolId, principal));
    }

    private List<PoolSettlement> commitStaged(List<SettlementEngine.StagedSettlement> staged) {
        List<PoolSettlement> settlements = new ArrayList<>();
        for (SettlementEngine.StagedSettlement entry : staged) {
            if (entry.settlement() != null) {
                registry.replace(entry.pool());
                settlements.add(entry.settlement());
            }
        }
        return settlements;
    }

    private static long maturityOf(long height, long lockBlocks) {
        try {
            return Math.addExact(height, lockBlocks);
        } catch (ArithmeticException e) {
            throw StakeException.overflow("maturity height");
        }
    }

    private static void requirePositive(BigInteger value, String message) {
        if (!CheckedMath.isUint256(value) || value.signum() == 0) {
            throw StakeException.invalidParameter(message);
        }
    }

    private record UserKey(int poolId, String principal) {
    }
}
