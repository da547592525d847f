package com.slb.stake_backend.modules.stake.service;

import com.slb.stake_backend.common.exception.StakeErrorCode;
import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.modules.event.entity.StakeEvent;
import com.slb.stake_backend.modules.event.enums.StakeEventType;
import com.slb.stake_backend.modules.stake.engine.EmissionSchedule;
import com.slb.stake_backend.modules.stake.engine.Pool;
import com.slb.stake_backend.modules.stake.engine.StakeLedger;
import com.slb.stake_backend.modules.stake.port.Authorizer;
import com.slb.stake_backend.modules.stake.port.StakeAction;
import com.slb.stake_backend.modules.stake.port.StakeEventPublisher;
import com.slb.stake_backend.modules.stake.vo.PoolSettlementVo;
import com.slb.stake_backend.modules.stake.vo.PoolVo;
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
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StakingAdminServiceTest {

    @Mock
    private Authorizer authorizer;
    @Mock
    private StakeEventPublisher eventPublisher;

    @Captor
    private ArgumentCaptor<StakeEvent> eventCaptor;

    private final AtomicLong height = new AtomicLong(100);
    private StakeLedger ledger;
    private InMemoryPauseControl pauseControl;
    private StakeLockManager locks;
    private StakingAdminService adminService;

    @BeforeEach
    void setup() {
        ledger = new StakeLedger(new EmissionSchedule("MetaNode", 100, 200, BigInteger.ONE));
        pauseControl = new InMemoryPauseControl();
        locks = new StakeLockManager(ledger);
        adminService = new StakingAdminService(ledger, locks, height::get, pauseControl,
                authorizer, eventPublisher);
    }

    @Test
    void addPool_unauthorized_shouldFailWithoutChanges() {
        when(authorizer.isAuthorized("mallory", StakeAction.ADD_POOL)).thenReturn(false);

        StakeException ex = assertThrows(StakeException.class, () -> adminService.addPool("mallory",
                Pool.NATIVE_ASSET, BigInteger.ONE, BigInteger.ZERO, 10, true));

        assertEquals(StakeErrorCode.UNAUTHORIZED, ex.getKind());
        assertEquals(0, ledger.poolLength());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void addPool_shouldPublishPoolAdded() {
        when(authorizer.isAuthorized("admin", StakeAction.ADD_POOL)).thenReturn(true);

        PoolVo vo = adminService.addPool("admin", Pool.NATIVE_ASSET, BigInteger.valueOf(500), BigInteger.valueOf(100), 20, true);

        assertEquals(0, vo.getPoolId());
        assertEquals(BigInteger.valueOf(500), ledger.totalWeight());
        verify(eventPublisher).publish(eventCaptor.capture());
        StakeEvent event = eventCaptor.getValue();
        assertEquals(StakeEventType.POOL_ADDED, event.getEventType());
        assertEquals("admin", event.getPrincipal());
        assertEquals(Pool.NATIVE_ASSET, event.getAssetId());
    }

    @Test
    void setPoolWeight_shouldSettleThenPublishWeightChange() {
        when(authorizer.isAuthorized(eq("admin"), any())).thenReturn(true);
        adminService.addPool("admin", Pool.NATIVE_ASSET, BigInteger.ONE, BigInteger.ZERO, 10, true);
        ledger.commit(ledger.prepareDeposit(0, "alice", BigInteger.TEN, 100));
        height.set(150);
        clearInvocations(eventPublisher);

        PoolVo vo = adminService.setPoolWeight("admin", 0, BigInteger.valueOf(3), true);

        assertEquals(BigInteger.valueOf(3), vo.getWeight());
        assertEquals(150L, vo.getLastSettledHeight());
        verify(eventPublisher, times(2)).publish(eventCaptor.capture());
        assertEquals(StakeEventType.POOL_SETTLED, eventCaptor.getAllValues().get(0).getEventType());
        assertEquals(StakeEventType.POOL_WEIGHT_SET, eventCaptor.getAllValues().get(1).getEventType());
    }

    @Test
    void setPoolWeight_shouldPublishOutsideWriteLock() {
        when(authorizer.isAuthorized(eq("admin"), any())).thenReturn(true);
        adminService.addPool("admin", Pool.NATIVE_ASSET, BigInteger.ONE, BigInteger.ZERO, 10, true);
        ledger.commit(ledger.prepareDeposit(0, "alice", BigInteger.TEN, 100));
        height.set(150);
        ReentrantReadWriteLock global = (ReentrantReadWriteLock) ReflectionTestUtils.getField(locks, "globalLock");
        doAnswer(invocation -> {
            assertFalse(global.isWriteLocked());
            assertEquals(0, global.getReadLockCount());
            return null;
        }).when(eventPublisher).publish(any(StakeEvent.class));

        adminService.setPoolWeight("admin", 0, BigInteger.valueOf(3), true);
        adminService.pauseClaim("admin");

        // 新增池子、结算、改权重、暂停
        verify(eventPublisher, times(4)).publish(any(StakeEvent.class));
    }

    @Test
    void settlePool_alreadyCurrent_shouldReturnEmpty() {
        when(authorizer.isAuthorized(eq("admin"), any())).thenReturn(true);
        adminService.addPool("admin", Pool.NATIVE_ASSET, BigInteger.ONE, BigInteger.ZERO, 10, true);
        height.set(130);

        Optional<PoolSettlementVo> first = adminService.settlePool("admin", 0);
        Optional<PoolSettlementVo> second = adminService.settlePool("admin", 0);

        assertTrue(first.isPresent());
        assertEquals(130L, first.get().getToHeight());
        assertTrue(second.isEmpty());
    }

    @Test
    void settleAllPools_internalEntry_shouldSkipAuthorization() {
        ledger.addPool(Pool.NATIVE_ASSET, BigInteger.ONE, BigInteger.ZERO, 10, true, 100);
        ledger.addPool("TKN", BigInteger.ONE, BigInteger.ZERO, 10, true, 100);
        height.set(120);

        List<PoolSettlementVo> settled = adminService.settleAllPoolsInternal();

        assertEquals(2, settled.size());
        verifyNoInteractions(authorizer);
    }

    @Test
    void pauseWithdraw_twice_shouldBeInvalid() {
        when(authorizer.isAuthorized("admin", StakeAction.PAUSE)).thenReturn(true);

        adminService.pauseWithdraw("admin");
        StakeException ex = assertThrows(StakeException.class, () -> adminService.pauseWithdraw("admin"));

        assertEquals(StakeErrorCode.INVALID_PARAMETER, ex.getKind());
        assertTrue(pauseControl.isWithdrawPaused());
        assertFalse(pauseControl.isClaimPaused());
        verify(eventPublisher, times(1)).publish(any(StakeEvent.class));
    }

    @Test
    void unpauseClaim_whenNotPaused_shouldBeInvalid() {
        when(authorizer.isAuthorized("admin", StakeAction.PAUSE)).thenReturn(true);

        assertThrows(StakeException.class, () -> adminService.unpauseClaim("admin"));

        adminService.pauseClaim("admin");
        adminService.unpauseClaim("admin");
        assertFalse(pauseControl.isClaimPaused());
    }

    @Test
    void setStartHeight_afterEnd_shouldBeInvalidAndKeepSchedule() {
        when(authorizer.isAuthorized("admin", StakeAction.SET_EMISSION)).thenReturn(true);

        assertThrows(StakeException.class, () -> adminService.setStartHeight("admin", 500));

        assertEquals(100, ledger.schedule().getStartHeight());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void setEmissionRate_shouldPublishConfigEvent() {
        when(authorizer.isAuthorized("admin", StakeAction.SET_EMISSION)).thenReturn(true);

        adminService.setEmissionRate("admin", BigInteger.valueOf(7));

        assertEquals(BigInteger.valueOf(7), ledger.schedule().getRatePerBlock());
        verify(eventPublisher).publish(eventCaptor.capture());
        assertEquals(StakeEventType.EMISSION_RATE_SET, eventCaptor.getValue().getEventType());
    }

    @Test
    void requireEventAccess_withoutAuditRole_shouldFail() {
        when(authorizer.isAuthorized("bob", StakeAction.AUDIT)).thenReturn(false);

        StakeException ex = assertThrows(StakeException.class, () -> adminService.requireEventAccess("bob"));
        assertEquals(StakeErrorCode.UNAUTHORIZED, ex.getKind());
    }
}
