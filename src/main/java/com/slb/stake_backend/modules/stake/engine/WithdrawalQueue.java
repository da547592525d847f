package com.slb.stake_backend.modules.stake.engine;

import com.slb.stake_backend.modules.stake.math.CheckedMath;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 用户的解押请求队列（先进先出）。
 * <p>
 * 到期高度在创建请求时确定。提取只处理队首连续到期的部分，队首未到期时后面已到期的请求也要等待
 * （池子调低锁定块数后会出现这种情况）。
 */
public class WithdrawalQueue {

    private final List<UnstakeRequest> requests;

    public WithdrawalQueue() {
        this.requests = new ArrayList<>();
    }

    private WithdrawalQueue(List<UnstakeRequest> requests) {
        this.requests = new ArrayList<>(requests);
    }

    public void append(UnstakeRequest request) {
        requests.add(request);
    }

    /**
     * height 时队首连续到期的请求数。
     */
    public int maturedPrefixLength(long height) {
        int count = 0;
        for (UnstakeRequest request : requests) {
            if (!request.isMatured(height)) {
                break;
            }
            count++;
        }
        return count;
    }

    public BigInteger sumOfFirst(int count) {
        BigInteger sum = BigInteger.ZERO;
        for (int i = 0; i < count; i++) {
            sum = CheckedMath.add(sum, requests.get(i).amount());
        }
        return sum;
    }

    /**
     * 移除前 count 个请求，剩余请求前移。
     */
    public void removeFirst(int count) {
        if (count > 0) {
            requests.subList(0, count).clear();
        }
    }

    /** 队列中全部请求之和 */
    public BigInteger totalRequested() {
        return sumOfFirst(requests.size());
    }

    /** 所有已到期请求之和，不要求在队首 */
    public BigInteger totalMatured(long height) {
        BigInteger sum = BigInteger.ZERO;
        for (UnstakeRequest request : requests) {
            if (request.isMatured(height)) {
                sum = CheckedMath.add(sum, request.amount());
            }
        }
        return sum;
    }

    public int size() {
        return requests.size();
    }

    public boolean isEmpty() {
        return requests.isEmpty();
    }

    public List<UnstakeRequest> view() {
        return Collections.unmodifiableList(requests);
    }

    public WithdrawalQueue copy() {
        return new WithdrawalQueue(requests);
    }
}
