package com.slb.stake_backend.modules.stake.engine;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class WithdrawalQueueTest {

    @Test
    void maturedPrefix_shouldStopAtFirstUnmaturedEntry() {
        WithdrawalQueue queue = new WithdrawalQueue();
        queue.append(new UnstakeRequest(BigInteger.valueOf(10), 120));
        queue.append(new UnstakeRequest(BigInteger.valueOf(20), 110));
        queue.append(new UnstakeRequest(BigInteger.valueOf(30), 100));

        assertEquals(0, queue.maturedPrefixLength(115));
        // 非前缀部分也计入已到期总额
        assertEquals(BigInteger.valueOf(50), queue.totalMatured(115));
        assertEquals(3, queue.maturedPrefixLength(120));
        assertEquals(BigInteger.valueOf(60), queue.totalRequested());
    }

    @Test
    void removeFirst_shouldShiftRemainingEntriesInOrder() {
        WithdrawalQueue queue = new WithdrawalQueue();
        queue.append(new UnstakeRequest(BigInteger.ONE, 10));
        queue.append(new UnstakeRequest(BigInteger.TWO, 20));
        queue.append(new UnstakeRequest(BigInteger.TEN, 30));

        int matured = queue.maturedPrefixLength(25);
        assertEquals(2, matured);
        assertEquals(BigInteger.valueOf(3), queue.sumOfFirst(matured));

        queue.removeFirst(matured);
        assertEquals(1, queue.size());
        assertEquals(30, queue.view().get(0).maturityHeight());
    }

    @Test
    void copy_shouldBeIndependent() {
        WithdrawalQueue queue = new WithdrawalQueue();
        queue.append(new UnstakeRequest(BigInteger.ONE, 10));
        WithdrawalQueue copy = queue.copy();
        copy.removeFirst(1);

        assertTrue(copy.isEmpty());
        assertEquals(1, queue.size());
    }

    @Test
    void matured_atExactHeight_shouldBeReleasable() {
        assertTrue(new UnstakeRequest(BigInteger.ONE, 50).isMatured(50));
        assertFalse(new UnstakeRequest(BigInteger.ONE, 50).isMatured(49));
    }
}
