package com.slb.stake_backend.modules.stake.engine;

import com.slb.stake_backend.modules.stake.math.CheckedMath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SettlementEngineTest {

    private PoolRegistry registry;
    private SettlementEngine engine;

    @BeforeEach
    void setup() {
        EmissionSchedule schedule = new EmissionSchedule("MetaNode", 100, 200, BigInteger.valueOf(4));
        registry = new PoolRegistry();
        engine = new SettlementEngine(schedule, registry);
    }

    @Test
    void settle_shouldSplitEmissionByWeight() {
        Pool a = addPool("NATIVE", 1, 1_000);
        Pool b = addPool("TKN", 3, 1_000);

        PoolSettlement sa = engine.settle(a, 110);
        PoolSettlement sb = engine.settle(b, 110);

        // 10 块 * 4 = 40，按 1:3 拆分
        assertEquals(BigInteger.valueOf(10), sa.reward());
        assertEquals(BigInteger.valueOf(30), sb.reward());
        assertEquals(CheckedMath.SCALE.multiply(BigInteger.valueOf(10)).divide(BigInteger.valueOf(1_000)), a.getAccRewardPerShare());
        assertEquals(110, a.getLastSettledHeight());
    }

    @Test
    void settle_twiceAtSameHeight_shouldBeNoop() {
        Pool pool = addPool("NATIVE", 1, 10);
        assertNotNull(engine.settle(pool, 150));
        BigInteger acc = pool.getAccRewardPerShare();

        assertNull(engine.settle(pool, 150));
        assertNull(engine.settle(pool, 140));
        assertEquals(acc, pool.getAccRewardPerShare());
        assertEquals(150, pool.getLastSettledHeight());
    }

    @Test
    void settle_withNothingStaked_shouldAdvanceHeightAndDiscardEmission() {
        Pool pool = addPool("NATIVE", 1, 0);

        PoolSettlement settlement = engine.settle(pool, 150);

        assertEquals(BigInteger.valueOf(200), settlement.reward());
        assertEquals(BigInteger.ZERO, pool.getAccRewardPerShare());
        assertEquals(150, pool.getLastSettledHeight());
    }

    @Test
    void accumulator_shouldNeverDecrease() {
        Pool pool = addPool("NATIVE", 1, 7);
        BigInteger previous = pool.getAccRewardPerShare();
        for (long height = 90; height <= 230; height += 13) {
            engine.settle(pool, height);
            assertTrue(pool.getAccRewardPerShare().compareTo(previous) >= 0);
            previous = pool.getAccRewardPerShare();
        }
    }

    @Test
    void project_shouldMatchSettleWithoutMutating() {
        Pool pool = addPool("NATIVE", 1, 3);
        BigInteger projected = engine.projectAccRewardPerShare(pool, 170);

        assertEquals(BigInteger.ZERO, pool.getAccRewardPerShare());
        assertEquals(100, pool.getLastSettledHeight());
        engine.settle(pool, 170);
        assertEquals(projected, pool.getAccRewardPerShare());
    }

    @Test
    void stageAll_shouldNotWriteRegistry() {
        addPool("NATIVE", 1, 10);
        addPool("TKN", 1, 10);

        List<SettlementEngine.StagedSettlement> staged = engine.stageAll(150);

        assertEquals(2, staged.size());
        assertNotNull(staged.get(0).settlement());
        assertEquals(100, registry.get(0).getLastSettledHeight());
        assertEquals(100, registry.get(1).getLastSettledHeight());
    }

    private Pool addPool(String asset, long weight, long totalStaked) {
        Pool pool = new Pool();
        pool.setStakeAssetId(asset);
        pool.setWeight(BigInteger.valueOf(weight));
        pool.setLastSettledHeight(100);
        pool.setAccRewardPerShare(BigInteger.ZERO);
        pool.setTotalStaked(BigInteger.valueOf(totalStaked));
        pool.setMinDeposit(BigInteger.ZERO);
        pool.setUnstakeLockBlocks(10);
        registry.append(pool, registry.getTotalWeight().add(BigInteger.valueOf(weight)));
        return pool;
    }
}
