package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.common.exception.StakeErrorCode;
import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.modules.event.entity.StakeEvent;
import com.slb.stake_backend.modules.stake.config.StakingProperties;
import com.slb.stake_backend.modules.stake.engine.LedgerChange;
import com.slb.stake_backend.modules.stake.engine.LedgerReceipts;
import com.slb.stake_backend.modules.stake.engine.Pool;
import com.slb.stake_backend.modules.stake.engine.PoolSettlement;
import com.slb.stake_backend.modules.stake.engine.StakeLedger;
import com.slb.stake_backend.modules.stake.engine.UnstakeRequest;
import com.slb.stake_backend.modules.stake.engine.UserStake;
import com.slb.stake_backend.modules.stake.port.BlockClock;
import com.slb.stake_backend.modules.stake.port.PauseControl;
import com.slb.stake_backend.modules.stake.port.RewardAssetTransfer;
import com.slb.stake_backend.modules.stake.port.StakeAssetTransfer;
import com.slb.stake_backend.modules.stake.port.StakeEventPublisher;
import com.slb.stake_backend.modules.stake.vo.ClaimVo;
import com.slb.stake_backend.modules.stake.vo.DepositVo;
import com.slb.stake_backend.modules.stake.vo.EmissionVo;
import com.slb.stake_backend.modules.stake.vo.MultiplierVo;
import com.slb.stake_backend.modules.stake.vo.PoolVo;
import com.slb.stake_backend.modules.stake.vo.StakePositionVo;
import com.slb.stake_backend.modules.stake.vo.UnstakeRequestVo;
import com.slb.stake_backend.modules.stake.vo.UnstakeVo;
import com.slb.stake_backend.modules.stake.vo.WithdrawAmountVo;
import com.slb.stake_backend.modules.stake.vo.WithdrawVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 用户侧质押操作。
 * <p>
 * 每个写操作在池子锁内完成：账本先生成暂存副本，资产转账成功后才提交；转账或校验失败时
 * 副本直接丢弃，账本保持调用前状态。事件在锁内收集，释放锁之后再写入流水。
 */
@Service
@Slf4j
public class StakingService {

    private final StakeLedger ledger;
    private final StakeLockManager locks;
    private final BlockClock blockClock;
    private final PauseControl pauseControl;
    private final StakeAssetTransfer stakeAssetTransfer;
    private final RewardAssetTransfer rewardAssetTransfer;
    private final StakeEventPublisher eventPublisher;
    private final StakingProperties properties;

    public StakingService(StakeLedger ledger,
                          StakeLockManager locks,
                          BlockClock blockClock,
                          PauseControl pauseControl,
                          StakeAssetTransfer stakeAssetTransfer,
                          RewardAssetTransfer rewardAssetTransfer,
                          StakeEventPublisher eventPublisher,
                          StakingProperties properties) {
        this.ledger = ledger;
        this.locks = locks;
        this.blockClock = blockClock;
        this.pauseControl = pauseControl;
        this.stakeAssetTransfer = stakeAssetTransfer;
        this.rewardAssetTransfer = rewardAssetTransfer;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    /* ----------- 写操作 ----------- */

    /**
     * 存入原生资产（0 号池）。
     */
    public DepositVo depositNative(String principal, BigInteger amount) {
        return DepositVo.from(doDeposit(0, principal, amount));
    }

    /**
     * 存入代币池，poolId 不能为 0。
     */
    public DepositVo deposit(String principal, int poolId, BigInteger amount) {
        if (poolId == 0) {
            throw StakeException.invalidParameter("deposit not support native token staking, use the native deposit");
        }
        return DepositVo.from(doDeposit(poolId, principal, amount));
    }

    public UnstakeVo unstake(String principal, int poolId, BigInteger amount) {
        List<StakeEvent> events = new ArrayList<>(2);
        LedgerReceipts.Unstake receipt = locks.withPool(poolId, () -> {
            requireWithdrawOpen();
            long height = blockClock.currentHeight();
            LedgerChange<LedgerReceipts.Unstake> change = ledger.prepareUnstake(poolId, principal, amount, height);
            ledger.commit(change);
            collectSettlement(events, change.settlement());
            events.add(StakeEvents.unstake(change.receipt()));
            return change.receipt();
        });
        publishAll(events);
        log.info("Unstake requested: poolId={}, principal={}, amount={}, maturityHeight={}, height={}",
                poolId, principal, amount, receipt.maturityHeight(), receipt.height());
        return UnstakeVo.from(receipt);
    }

    /**
     * 提取所有已到期的解押请求（从队首开始的连续到期部分）。
     */
    public WithdrawVo withdraw(String principal, int poolId) {
        List<StakeEvent> events = new ArrayList<>(1);
        LedgerReceipts.Withdraw receipt = locks.withPool(poolId, () -> {
            requireWithdrawOpen();
            long height = blockClock.currentHeight();
            LedgerChange<LedgerReceipts.Withdraw> change = ledger.prepareWithdraw(poolId, principal, height);
            LedgerReceipts.Withdraw staged = change.receipt();
            if (staged.amount().signum() > 0) {
                pushStake(staged.stakeAssetId(), principal, staged.amount());
            }
            ledger.commit(change);
            events.add(StakeEvents.withdraw(staged));
            return staged;
        });
        publishAll(events);
        log.info("Withdraw: poolId={}, principal={}, amount={}, released={}, remaining={}, height={}",
                poolId, principal, receipt.amount(), receipt.releasedRequests(), receipt.remainingRequests(), receipt.height());
        return WithdrawVo.from(receipt);
    }

    public ClaimVo claim(String principal, int poolId) {
        List<StakeEvent> events = new ArrayList<>(2);
        LedgerReceipts.Claim receipt = locks.withPool(poolId, () -> {
            if (pauseControl.isClaimPaused()) {
                throw new StakeException(StakeErrorCode.PAUSED, "claim is paused");
            }
            long height = blockClock.currentHeight();
            String rewardAsset = ledger.schedule().getRewardAssetId();
            // 金库余额在多个池子间共享，读余额到转账之间不能被其它领取插入
            LedgerChange<LedgerReceipts.Claim> change = locks.withRewardVault(() -> {
                BigInteger available = rewardBalance(rewardAsset);
                LedgerChange<LedgerReceipts.Claim> staged = ledger.prepareClaim(poolId, principal, height, available,
                        properties.getRewardShortfallMode());
                if (staged.receipt().paid().signum() > 0) {
                    payReward(rewardAsset, principal, staged.receipt().paid());
                }
                return staged;
            });
            ledger.commit(change);
            collectSettlement(events, change.settlement());
            events.add(StakeEvents.claim(change.receipt()));
            return change.receipt();
        });
        publishAll(events);
        if (receipt.shortfall().signum() > 0) {
            log.warn("Reward vault short on claim: poolId={}, principal={}, owed={}, paid={}, mode={}",
                    poolId, principal, receipt.owed(), receipt.paid(), properties.getRewardShortfallMode());
        }
        log.info("Claim: poolId={}, principal={}, owed={}, paid={}, height={}",
                poolId, principal, receipt.owed(), receipt.paid(), receipt.height());
        return ClaimVo.from(receipt);
    }

    /* ----------- 查询 ----------- */

    public int poolLength() {
        return ledger.poolLength();
    }

    public PoolVo getPool(int poolId) {
        return locks.withPool(poolId, () -> PoolVo.from(ledger.pool(poolId)));
    }

    public List<PoolVo> listPools() {
        List<Pool> pools = locks.withAll(ledger::pools);
        List<PoolVo> list = new ArrayList<>(pools.size());
        for (Pool pool : pools) {
            list.add(PoolVo.from(pool));
        }
        return list;
    }

    public BigInteger stakingBalance(int poolId, String principal) {
        return locks.withPool(poolId, () -> ledger.stakingBalance(poolId, principal));
    }

    /**
     * 当前高度下可领取的奖励。
     */
    public BigInteger pendingReward(int poolId, String principal) {
        return pendingRewardAt(poolId, principal, blockClock.currentHeight());
    }

    /**
     * 指定高度下可领取的奖励，只读推算，不修改账本。
     */
    public BigInteger pendingRewardAt(int poolId, String principal, long height) {
        return locks.withPool(poolId, () -> ledger.pendingRewardAt(poolId, principal, height));
    }

    public WithdrawAmountVo withdrawAmount(int poolId, String principal) {
        return locks.withPool(poolId, () -> {
            LedgerReceipts.WithdrawAmounts amounts = ledger.withdrawAmount(poolId, principal, blockClock.currentHeight());
            return new WithdrawAmountVo(amounts.requestAmount(), amounts.pendingWithdrawAmount());
        });
    }

    public StakePositionVo position(int poolId, String principal) {
        return locks.withPool(poolId, () -> {
            long height = blockClock.currentHeight();
            UserStake user = ledger.userStake(poolId, principal);
            StakePositionVo vo = new StakePositionVo();
            vo.setPoolId(poolId);
            vo.setPrincipal(principal);
            vo.setStakeAmount(user.getStakeAmount());
            vo.setPendingReward(ledger.pendingRewardAt(poolId, principal, height));
            vo.setRequestAmount(user.getWithdrawalQueue().totalRequested());
            vo.setPendingWithdrawAmount(user.getWithdrawalQueue().totalMatured(height));
            vo.setHeight(height);
            List<UnstakeRequestVo> requests = new ArrayList<>();
            for (UnstakeRequest request : user.getWithdrawalQueue().view()) {
                requests.add(new UnstakeRequestVo(request.amount(), request.maturityHeight(), request.isMatured(height)));
            }
            vo.setRequests(requests);
            return vo;
        });
    }

    public MultiplierVo multiplier(long from, long to) {
        return locks.withGlobalRead(() -> new MultiplierVo(from, to, ledger.multiplier(from, to)));
    }

    public EmissionVo emission() {
        return locks.withGlobalRead(() -> {
            EmissionVo vo = new EmissionVo();
            vo.setRewardAsset(ledger.schedule().getRewardAssetId());
            vo.setStartHeight(ledger.schedule().getStartHeight());
            vo.setEndHeight(ledger.schedule().getEndHeight());
            vo.setRewardPerBlock(ledger.schedule().getRatePerBlock());
            vo.setTotalWeight(ledger.totalWeight());
            vo.setPoolLength(ledger.poolLength());
            vo.setCurrentHeight(blockClock.currentHeight());
            vo.setWithdrawPaused(pauseControl.isWithdrawPaused());
            vo.setClaimPaused(pauseControl.isClaimPaused());
            vo.setRewardShortfallMode(properties.getRewardShortfallMode().name());
            return vo;
        });
    }

    /* ----------- 内部 ----------- */

    private LedgerReceipts.Deposit doDeposit(int poolId, String principal, BigInteger amount) {
        List<StakeEvent> events = new ArrayList<>(2);
        LedgerReceipts.Deposit receipt = locks.withPool(poolId, () -> {
            long height = blockClock.currentHeight();
            LedgerChange<LedgerReceipts.Deposit> change = ledger.prepareDeposit(poolId, principal, amount, height);
            LedgerReceipts.Deposit staged = change.receipt();
            if (staged.amount().signum() > 0) {
                pullStake(staged.stakeAssetId(), principal, staged.amount());
            }
            ledger.commit(change);
            collectSettlement(events, change.settlement());
            events.add(StakeEvents.deposit(staged));
            return staged;
        });
        publishAll(events);
        log.info("Deposit: poolId={}, principal={}, asset={}, amount={}, stakeAmount={}, height={}",
                poolId, principal, receipt.stakeAssetId(), amount, receipt.stakeAmount(), receipt.height());
        return receipt;
    }

    private void requireWithdrawOpen() {
        if (pauseControl.isWithdrawPaused()) {
            throw new StakeException(StakeErrorCode.PAUSED, "withdraw is paused");
        }
    }

    private static void collectSettlement(List<StakeEvent> events, PoolSettlement settlement) {
        if (settlement != null) {
            events.add(StakeEvents.settled(settlement));
        }
    }

    /**
     * 流水写库可能很慢，必须在释放锁之后调用。
     */
    private void publishAll(List<StakeEvent> events) {
        for (StakeEvent event : events) {
            eventPublisher.publish(event);
        }
    }

    private void pullStake(String assetId, String principal, BigInteger amount) {
        try {
            stakeAssetTransfer.pull(assetId, principal, amount);
        } catch (RuntimeException e) {
            log.warn("Stake pull failed: asset={}, from={}, amount={}, reason={}", assetId, principal, amount, e.getMessage());
            throw asTransferFailure("staking asset transfer failed", e);
        }
    }

    private void pushStake(String assetId, String principal, BigInteger amount) {
        byte[] result;
        try {
            result = stakeAssetTransfer.push(assetId, principal, amount);
        } catch (RuntimeException e) {
            log.warn("Stake push failed: asset={}, to={}, amount={}, reason={}", assetId, principal, amount, e.getMessage());
            throw asTransferFailure("staking asset transfer failed", e);
        }
        try {
            TransferResults.requireSuccess(result);
        } catch (StakeException e) {
            log.warn("Stake push rejected: asset={}, to={}, amount={}, reason={}", assetId, principal, amount, e.getMessage());
            throw e;
        }
    }

    private BigInteger rewardBalance(String rewardAsset) {
        try {
            return rewardAssetTransfer.rewardBalance(rewardAsset);
        } catch (RuntimeException e) {
            throw asTransferFailure("reward balance unavailable", e);
        }
    }

    private void payReward(String rewardAsset, String principal, BigInteger amount) {
        try {
            rewardAssetTransfer.rewardTransfer(rewardAsset, principal, amount);
        } catch (RuntimeException e) {
            log.warn("Reward transfer failed: asset={}, to={}, amount={}, reason={}", rewardAsset, principal, amount, e.getMessage());
            throw asTransferFailure("reward transfer failed", e);
        }
    }

    private static StakeException asTransferFailure(String message, RuntimeException e) {
        if (e instanceof StakeException stakeException && stakeException.getKind() == StakeErrorCode.TRANSFER_FAILED) {
            return stakeException;
        }
        return StakeException.transferFailed(message + ": " + e.getMessage(), e);
    }
}
