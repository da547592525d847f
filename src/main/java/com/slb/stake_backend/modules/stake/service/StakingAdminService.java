package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.common.exception.StakeErrorCode;
import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.modules.event.entity.StakeEvent;
import com.slb.stake_backend.modules.event.enums.StakeEventType;
import com.slb.stake_backend.modules.stake.engine.LedgerReceipts;
import com.slb.stake_backend.modules.stake.engine.Pool;
import com.slb.stake_backend.modules.stake.engine.PoolSettlement;
import com.slb.stake_backend.modules.stake.engine.StakeLedger;
import com.slb.stake_backend.modules.stake.port.Authorizer;
import com.slb.stake_backend.modules.stake.port.BlockClock;
import com.slb.stake_backend.modules.stake.port.PauseControl;
import com.slb.stake_backend.modules.stake.port.StakeAction;
import com.slb.stake_backend.modules.stake.port.StakeEventPublisher;
import com.slb.stake_backend.modules.stake.vo.PoolSettlementVo;
import com.slb.stake_backend.modules.stake.vo.PoolVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * 管理侧操作：池子管理、排放参数、暂停开关、手动结算。所有方法先经过 {@link Authorizer}。
 * 事件在锁内收集，释放锁之后再写入流水。
 */
@Service
@Slf4j
public class StakingAdminService {

    private final StakeLedger ledger;
    private final StakeLockManager locks;
    private final BlockClock blockClock;
    private final PauseControl pauseControl;
    private final Authorizer authorizer;
    private final StakeEventPublisher eventPublisher;

    public StakingAdminService(StakeLedger ledger,
                               StakeLockManager locks,
                               BlockClock blockClock,
                               PauseControl pauseControl,
                               Authorizer authorizer,
                               StakeEventPublisher eventPublisher) {
        this.ledger = ledger;
        this.locks = locks;
        this.blockClock = blockClock;
        this.pauseControl = pauseControl;
        this.authorizer = authorizer;
        this.eventPublisher = eventPublisher;
    }

    /* ----------- 池子管理 ----------- */

    /**
     * 新增池子。第一个池子必须是原生资产，之后的池子必须是代币。
     */
    public PoolVo addPool(String caller, String stakeAssetId, BigInteger weight, BigInteger minDeposit,
                          long unstakeLockBlocks, boolean withSettle) {
        requireAuthorized(caller, StakeAction.ADD_POOL);
        List<StakeEvent> events = new ArrayList<>();
        Pool pool = locks.withAll(() -> {
            long height = blockClock.currentHeight();
            LedgerReceipts.PoolAdded receipt = ledger.addPool(stakeAssetId, weight, minDeposit, unstakeLockBlocks, withSettle, height);
            collectSettlements(events, receipt.settlements());
            events.add(StakeEvents.poolAdded(receipt.pool(), caller, height));
            return receipt.pool();
        });
        publishAll(events);
        log.info("Pool added by {}: poolId={}, asset={}, weight={}, minDeposit={}, lockBlocks={}, lastSettledHeight={}",
                caller, pool.getPoolId(), pool.getStakeAssetId(), pool.getWeight(), pool.getMinDeposit(),
                pool.getUnstakeLockBlocks(), pool.getLastSettledHeight());
        return PoolVo.from(pool);
    }

    /**
     * 修改最小存入量与解押锁定块数。已排队的解押请求保持原到期高度。
     */
    public PoolVo updatePool(String caller, int poolId, BigInteger minDeposit, long unstakeLockBlocks) {
        requireAuthorized(caller, StakeAction.UPDATE_POOL);
        Pool pool = locks.withPool(poolId, () -> ledger.updatePool(poolId, minDeposit, unstakeLockBlocks));
        eventPublisher.publish(StakeEvents.poolUpdated(pool, caller, blockClock.currentHeight()));
        log.info("Pool updated by {}: poolId={}, minDeposit={}, lockBlocks={}", caller, poolId, minDeposit, unstakeLockBlocks);
        return PoolVo.from(pool);
    }

    public PoolVo setPoolWeight(String caller, int poolId, BigInteger weight, boolean withSettle) {
        requireAuthorized(caller, StakeAction.SET_POOL_WEIGHT);
        List<StakeEvent> events = new ArrayList<>();
        LedgerReceipts.PoolWeightChanged receipt = locks.withAll(() -> {
            long height = blockClock.currentHeight();
            LedgerReceipts.PoolWeightChanged changed = ledger.setPoolWeight(poolId, weight, withSettle, height);
            collectSettlements(events, changed.settlements());
            events.add(StakeEvents.poolWeightSet(changed, caller, height));
            return changed;
        });
        publishAll(events);
        log.info("Pool weight set by {}: poolId={}, weight {} -> {}, totalWeight={}",
                caller, poolId, receipt.oldWeight(), receipt.newWeight(), receipt.totalWeight());
        return PoolVo.from(locks.withPool(poolId, () -> ledger.pool(poolId)));
    }

    /**
     * 结算单个池子到当前高度；已是最新时返回 empty。
     */
    public Optional<PoolSettlementVo> settlePool(String caller, int poolId) {
        requireAuthorized(caller, StakeAction.SETTLE);
        Optional<PoolSettlement> settlement = locks.withPool(poolId, () -> ledger.settlePool(poolId, blockClock.currentHeight()));
        settlement.ifPresent(s -> eventPublisher.publish(StakeEvents.settled(s)));
        return settlement.map(PoolSettlementVo::from);
    }

    public List<PoolSettlementVo> settleAllPools(String caller) {
        requireAuthorized(caller, StakeAction.SETTLE);
        return settleAllPoolsInternal();
    }

    /**
     * 定时任务入口，不做权限检查。
     */
    List<PoolSettlementVo> settleAllPoolsInternal() {
        List<PoolSettlement> settlements = locks.withAll(() -> ledger.settleAllPools(blockClock.currentHeight()));
        List<StakeEvent> events = new ArrayList<>(settlements.size());
        collectSettlements(events, settlements);
        publishAll(events);
        List<PoolSettlementVo> list = new ArrayList<>(settlements.size());
        for (PoolSettlement settlement : settlements) {
            list.add(PoolSettlementVo.from(settlement));
        }
        log.info("Settled {} pool(s)", list.size());
        return list;
    }

    /* ----------- 排放参数 ----------- */

    public void setRewardAsset(String caller, String rewardAssetId) {
        requireAuthorized(caller, StakeAction.SET_EMISSION);
        locks.withAll(() -> {
            ledger.setRewardAssetId(rewardAssetId);
            return null;
        });
        eventPublisher.publish(StakeEvents.config(StakeEventType.REWARD_ASSET_SET, caller, blockClock.currentHeight(), rewardAssetId));
        log.info("Reward asset set by {}: {}", caller, rewardAssetId);
    }

    public void setStartHeight(String caller, long startHeight) {
        requireAuthorized(caller, StakeAction.SET_EMISSION);
        locks.withAll(() -> {
            ledger.setStartHeight(startHeight);
            return null;
        });
        eventPublisher.publish(StakeEvents.config(StakeEventType.START_HEIGHT_SET, caller, blockClock.currentHeight(), startHeight));
        log.info("Start height set by {}: {}", caller, startHeight);
    }

    public void setEndHeight(String caller, long endHeight) {
        requireAuthorized(caller, StakeAction.SET_EMISSION);
        locks.withAll(() -> {
            ledger.setEndHeight(endHeight);
            return null;
        });
        eventPublisher.publish(StakeEvents.config(StakeEventType.END_HEIGHT_SET, caller, blockClock.currentHeight(), endHeight));
        log.info("End height set by {}: {}", caller, endHeight);
    }

    public void setEmissionRate(String caller, BigInteger ratePerBlock) {
        requireAuthorized(caller, StakeAction.SET_EMISSION);
        locks.withAll(() -> {
            ledger.setRatePerBlock(ratePerBlock);
            return null;
        });
        eventPublisher.publish(StakeEvents.config(StakeEventType.EMISSION_RATE_SET, caller, blockClock.currentHeight(), ratePerBlock));
        log.info("Reward per block set by {}: {}", caller, ratePerBlock);
    }

    /* ----------- 暂停开关 ----------- */

    public void pauseWithdraw(String caller) {
        toggle(caller, true, pauseControl::isWithdrawPaused, pauseControl::setWithdrawPaused,
                "withdraw has been already paused", StakeEventType.WITHDRAW_PAUSED);
    }

    public void unpauseWithdraw(String caller) {
        toggle(caller, false, pauseControl::isWithdrawPaused, pauseControl::setWithdrawPaused,
                "withdraw has been already unpaused", StakeEventType.WITHDRAW_UNPAUSED);
    }

    public void pauseClaim(String caller) {
        toggle(caller, true, pauseControl::isClaimPaused, pauseControl::setClaimPaused,
                "claim has been already paused", StakeEventType.CLAIM_PAUSED);
    }

    public void unpauseClaim(String caller) {
        toggle(caller, false, pauseControl::isClaimPaused, pauseControl::setClaimPaused,
                "claim has been already unpaused", StakeEventType.CLAIM_UNPAUSED);
    }

    private void toggle(String caller, boolean target, BooleanSupplier state, Consumer<Boolean> apply,
                        String alreadyMessage, StakeEventType eventType) {
        requireAuthorized(caller, StakeAction.PAUSE);
        locks.withAll(() -> {
            if (state.getAsBoolean() == target) {
                throw StakeException.invalidParameter(alreadyMessage);
            }
            apply.accept(target);
            return null;
        });
        eventPublisher.publish(StakeEvents.config(eventType, caller, blockClock.currentHeight(), target));
        log.info("{} by {}", eventType, caller);
    }

    /**
     * 查看全量事件流水需要 AUDIT 或 ADMIN 角色。
     */
    public void requireEventAccess(String caller) {
        requireAuthorized(caller, StakeAction.AUDIT);
    }

    private void requireAuthorized(String caller, StakeAction action) {
        if (!authorizer.isAuthorized(caller, action)) {
            log.warn("Unauthorized staking admin call: caller={}, action={}", caller, action);
            throw new StakeException(StakeErrorCode.UNAUTHORIZED, "caller is not authorized for " + action);
        }
    }

    private static void collectSettlements(List<StakeEvent> events, List<PoolSettlement> settlements) {
        for (PoolSettlement settlement : settlements) {
            events.add(StakeEvents.settled(settlement));
        }
    }

    private void publishAll(List<StakeEvent> events) {
        for (StakeEvent event : events) {
            eventPublisher.publish(event);
        }
    }
}
