package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.common.exception.StakeErrorCode;
import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.modules.event.entity.StakeEvent;
import com.slb.stake_backend.modules.event.enums.StakeEventType;
import com.slb.stake_backend.modules.stake.config.StakingProperties;
import com.slb.stake_backend.modules.stake.engine.EmissionSchedule;
import com.slb.stake_backend.modules.stake.engine.Pool;
import com.slb.stake_backend.modules.stake.engine.RewardShortfallMode;
import com.slb.stake_backend.modules.stake.engine.StakeLedger;
import com.slb.stake_backend.modules.stake.port.PauseControl;
import com.slb.stake_backend.modules.stake.port.RewardAssetTransfer;
import com.slb.stake_backend.modules.stake.port.StakeAssetTransfer;
import com.slb.stake_backend.modules.stake.port.StakeEventPublisher;
import com.slb.stake_backend.modules.stake.vo.ClaimVo;
import com.slb.stake_backend.modules.stake.vo.DepositVo;
import com.slb.stake_backend.modules.stake.vo.StakePositionVo;
import com.slb.stake_backend.modules.stake.vo.WithdrawVo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StakingServiceTest {

    @Mock
    private PauseControl pauseControl;
    @Mock
    private StakeAssetTransfer stakeAssetTransfer;
    @Mock
    private RewardAssetTransfer rewardAssetTransfer;
    @Mock
    private StakeEventPublisher eventPublisher;

    @Captor
    private ArgumentCaptor<StakeEvent> eventCaptor;

    private final AtomicLong height = new AtomicLong(100);
    private StakeLedger ledger;
    private StakeLockManager locks;
    private StakingProperties properties;
    private StakingService stakingService;

    @BeforeEach
    void setup() {
        ledger = new StakeLedger(new EmissionSchedule("MetaNode", 100, 200, BigInteger.ONE));
        ledger.addPool(Pool.NATIVE_ASSET, BigInteger.ONE, BigInteger.ZERO, 10, true, 100);
        ledger.addPool("TKN", BigInteger.ONE, BigInteger.ZERO, 10, true, 100);
        properties = new StakingProperties();
        locks = new StakeLockManager(ledger);
        stakingService = new StakingService(ledger, locks, height::get, pauseControl,
                stakeAssetTransfer, rewardAssetTransfer, eventPublisher, properties);
    }

    @Test
    void depositNative_shouldPullNativeAssetAndPublishEvent() {
        DepositVo vo = stakingService.depositNative("alice", BigInteger.valueOf(100));

        verify(stakeAssetTransfer).pull(Pool.NATIVE_ASSET, "alice", BigInteger.valueOf(100));
        verify(eventPublisher).publish(eventCaptor.capture());
        assertEquals(StakeEventType.DEPOSIT, eventCaptor.getValue().getEventType());
        assertEquals(BigInteger.valueOf(100), vo.getStakeAmount());
        assertEquals(BigInteger.valueOf(100), ledger.stakingBalance(0, "alice"));
    }

    @Test
    void deposit_intoNativePool_shouldBeRejected() {
        StakeException ex = assertThrows(StakeException.class,
                () -> stakingService.deposit("alice", 0, BigInteger.TEN));
        assertEquals(StakeErrorCode.INVALID_PARAMETER, ex.getKind());
        verifyNoInteractions(stakeAssetTransfer);
    }

    @Test
    void deposit_pullFails_shouldLeaveLedgerUnchanged() {
        doThrow(new IllegalStateException("allowance exceeded"))
                .when(stakeAssetTransfer).pull("TKN", "alice", BigInteger.TEN);

        StakeException ex = assertThrows(StakeException.class,
                () -> stakingService.deposit("alice", 1, BigInteger.TEN));

        assertEquals(StakeErrorCode.TRANSFER_FAILED, ex.getKind());
        assertEquals(BigInteger.ZERO, ledger.stakingBalance(1, "alice"));
        assertEquals(BigInteger.ZERO, ledger.pool(1).getTotalStaked());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void deposit_zeroAmount_shouldSkipTransfer() {
        stakingService.deposit("alice", 1, BigInteger.ZERO);

        verifyNoInteractions(stakeAssetTransfer);
        verify(eventPublisher).publish(any(StakeEvent.class));
    }

    @Test
    void unstake_whenWithdrawPaused_shouldFail() {
        when(pauseControl.isWithdrawPaused()).thenReturn(true);

        StakeException ex = assertThrows(StakeException.class,
                () -> stakingService.unstake("alice", 1, BigInteger.ONE));
        assertEquals(StakeErrorCode.PAUSED, ex.getKind());
    }

    @Test
    void withdraw_whenPaused_shouldNotPush() {
        when(pauseControl.isWithdrawPaused()).thenReturn(true);

        StakeException ex = assertThrows(StakeException.class, () -> stakingService.withdraw("alice", 1));
        assertEquals(StakeErrorCode.PAUSED, ex.getKind());
        verifyNoInteractions(stakeAssetTransfer);
    }

    @Test
    void withdraw_matured_shouldPushAndClearQueue() {
        stakingService.deposit("alice", 1, BigInteger.valueOf(40));
        height.set(120);
        stakingService.unstake("alice", 1, BigInteger.valueOf(40));
        when(stakeAssetTransfer.push("TKN", "alice", BigInteger.valueOf(40))).thenReturn(TransferResults.abiTrue());
        height.set(130);

        WithdrawVo vo = stakingService.withdraw("alice", 1);

        assertEquals(BigInteger.valueOf(40), vo.getAmount());
        assertEquals(0, vo.getRemainingRequests());
        StakePositionVo position = stakingService.position(1, "alice");
        assertTrue(position.getRequests().isEmpty());
    }

    @Test
    void withdraw_pushReturnsFalse_shouldKeepQueue() {
        stakingService.deposit("alice", 1, BigInteger.valueOf(40));
        stakingService.unstake("alice", 1, BigInteger.valueOf(40));
        byte[] falseWord = new byte[32];
        when(stakeAssetTransfer.push(eq("TKN"), eq("alice"), any())).thenReturn(falseWord);
        height.set(110);

        StakeException ex = assertThrows(StakeException.class, () -> stakingService.withdraw("alice", 1));

        assertEquals(StakeErrorCode.TRANSFER_FAILED, ex.getKind());
        assertEquals(BigInteger.valueOf(40), stakingService.withdrawAmount(1, "alice").getPendingWithdrawAmount());
    }

    @Test
    void withdraw_emptyPushResult_shouldCountAsSuccess() {
        stakingService.depositNative("alice", BigInteger.valueOf(5));
        stakingService.unstake("alice", 0, BigInteger.valueOf(5));
        when(stakeAssetTransfer.push(Pool.NATIVE_ASSET, "alice", BigInteger.valueOf(5))).thenReturn(new byte[0]);
        height.set(110);

        assertEquals(BigInteger.valueOf(5), stakingService.withdraw("alice", 0).getAmount());
    }

    @Test
    void claim_whenPaused_shouldFail() {
        when(pauseControl.isClaimPaused()).thenReturn(true);

        StakeException ex = assertThrows(StakeException.class, () -> stakingService.claim("alice", 1));
        assertEquals(StakeErrorCode.PAUSED, ex.getKind());
        verifyNoInteractions(rewardAssetTransfer);
    }

    @Test
    void claim_shouldPayAtMostVaultBalance() {
        stakingService.deposit("alice", 1, BigInteger.valueOf(10));
        height.set(140);
        when(rewardAssetTransfer.rewardBalance("MetaNode")).thenReturn(BigInteger.valueOf(5));

        ClaimVo vo = stakingService.claim("alice", 1);

        // 两个池子各占一半：40 块 -> 20
        assertEquals(BigInteger.valueOf(20), vo.getOwed());
        assertEquals(BigInteger.valueOf(5), vo.getPaid());
        verify(rewardAssetTransfer).rewardTransfer("MetaNode", "alice", BigInteger.valueOf(5));
        assertEquals(BigInteger.ZERO, stakingService.pendingReward(1, "alice"));
    }

    @Test
    void claim_strictMode_shouldKeepShortfallClaimable() {
        properties.setRewardShortfallMode(RewardShortfallMode.STRICT);
        stakingService.deposit("alice", 1, BigInteger.valueOf(10));
        height.set(140);
        when(rewardAssetTransfer.rewardBalance("MetaNode")).thenReturn(BigInteger.valueOf(5));

        stakingService.claim("alice", 1);

        assertEquals(BigInteger.valueOf(15), stakingService.pendingReward(1, "alice"));
    }

    @Test
    void claim_transferFails_shouldKeepPendingReward() {
        stakingService.deposit("alice", 1, BigInteger.valueOf(10));
        height.set(140);
        when(rewardAssetTransfer.rewardBalance("MetaNode")).thenReturn(BigInteger.valueOf(100));
        doThrow(new IllegalStateException("vault offline"))
                .when(rewardAssetTransfer).rewardTransfer(anyString(), anyString(), any());

        StakeException ex = assertThrows(StakeException.class, () -> stakingService.claim("alice", 1));

        assertEquals(StakeErrorCode.TRANSFER_FAILED, ex.getKind());
        assertEquals(BigInteger.valueOf(20), stakingService.pendingReward(1, "alice"));
        assertEquals(100, ledger.pool(1).getLastSettledHeight());
    }

    @Test
    void claim_shouldPublishSettlementBeforeClaimEvent() {
        stakingService.deposit("alice", 1, BigInteger.valueOf(10));
        height.set(150);
        when(rewardAssetTransfer.rewardBalance("MetaNode")).thenReturn(BigInteger.valueOf(100));
        clearInvocations(eventPublisher);

        stakingService.claim("alice", 1);

        verify(eventPublisher, times(2)).publish(eventCaptor.capture());
        List<StakeEvent> events = eventCaptor.getAllValues();
        assertEquals(StakeEventType.POOL_SETTLED, events.get(0).getEventType());
        assertEquals(StakeEventType.CLAIM, events.get(1).getEventType());
    }

    @Test
    void unknownPool_shouldBeInvalidPoolId() {
        StakeException ex = assertThrows(StakeException.class, () -> stakingService.getPool(9));
        assertEquals(StakeErrorCode.INVALID_POOL_ID, ex.getKind());
    }

    @Test
    void unknownPoolLookups_shouldNotGrowLockMap() {
        for (int poolId = 2; poolId < 100_000; poolId++) {
            int id = poolId;
            assertThrows(StakeException.class, () -> stakingService.getPool(id));
        }
        assertThrows(StakeException.class, () -> stakingService.pendingReward(-3, "alice"));

        Map<?, ?> poolLocks = (Map<?, ?>) ReflectionTestUtils.getField(locks, "poolLocks");
        assertNotNull(poolLocks);
        assertTrue(poolLocks.isEmpty(), "lock map grew to " + poolLocks.size());
    }

    @Test
    void events_shouldBePublishedAfterLocksAreReleased() {
        ReentrantReadWriteLock global = (ReentrantReadWriteLock) ReflectionTestUtils.getField(locks, "globalLock");
        doAnswer(invocation -> {
            assertEquals(0, global.getReadLockCount());
            assertFalse(global.isWriteLocked());
            Map<?, ?> poolLocks = (Map<?, ?>) ReflectionTestUtils.getField(locks, "poolLocks");
            for (Object lock : poolLocks.values()) {
                assertFalse(((ReentrantLock) lock).isLocked());
            }
            return null;
        }).when(eventPublisher).publish(any(StakeEvent.class));
        when(rewardAssetTransfer.rewardBalance("MetaNode")).thenReturn(BigInteger.valueOf(100));

        stakingService.deposit("alice", 1, BigInteger.valueOf(10));
        height.set(150);
        stakingService.claim("alice", 1);
        stakingService.unstake("alice", 1, BigInteger.valueOf(10));
        height.set(160);
        when(stakeAssetTransfer.push("TKN", "alice", BigInteger.valueOf(10))).thenReturn(new byte[0]);
        stakingService.withdraw("alice", 1);

        // 存入、结算 + 领取、解押、提取
        verify(eventPublisher, times(5)).publish(any(StakeEvent.class));
    }
}
