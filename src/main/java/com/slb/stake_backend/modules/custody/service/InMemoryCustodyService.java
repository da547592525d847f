package com.slb.stake_backend.modules.custody.service;

import com.slb.stake_backend.common.exception.StakeErrorCode;
import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.modules.custody.config.CustodyProperties;
import com.slb.stake_backend.modules.stake.engine.Pool;
import com.slb.stake_backend.modules.stake.engine.StakeLedger;
import com.slb.stake_backend.modules.stake.math.CheckedMath;
import com.slb.stake_backend.modules.stake.port.Authorizer;
import com.slb.stake_backend.modules.stake.port.RewardAssetTransfer;
import com.slb.stake_backend.modules.stake.port.StakeAction;
import com.slb.stake_backend.modules.stake.port.StakeAssetTransfer;
import com.slb.stake_backend.modules.stake.service.TransferResults;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * 进程内托管：账户余额、质押金库与奖励金库分开记账。
 * <p>
 * 原生资产转出返回空结果，代币转出返回 ABI true，与链上调用的返回形式一致。
 */
@Service
@Slf4j
public class InMemoryCustodyService implements StakeAssetTransfer, RewardAssetTransfer {

    private static final byte[] EMPTY = new byte[0];

    private final CustodyProperties properties;
    private final StakeLedger ledger;
    private final Authorizer authorizer;

    /** asset -> principal -> balance */
    private final Map<String, Map<String, BigInteger>> accounts = new HashMap<>();
    /** asset -> 质押金库余额 */
    private final Map<String, BigInteger> stakeVault = new HashMap<>();
    /** asset -> 奖励金库余额 */
    private final Map<String, BigInteger> rewardVault = new HashMap<>();

    public InMemoryCustodyService(CustodyProperties properties, StakeLedger ledger, Authorizer authorizer) {
        this.properties = properties;
        this.ledger = ledger;
        this.authorizer = authorizer;
    }

    @PostConstruct
    public void seed() {
        BigInteger funding = properties.getInitialRewardFunding();
        if (funding != null && funding.signum() > 0) {
            creditRewardVault(ledger.schedule().getRewardAssetId(), funding);
        }
        properties.getInitialBalances().forEach((asset, balances) ->
                balances.forEach((principal, amount) -> credit(asset, principal, amount)));
        log.info("Custody seeded: rewardFunding={}, assets={}", funding, properties.getInitialBalances().keySet());
    }

    /* ----------- StakeAssetTransfer ----------- */

    @Override
    public synchronized void pull(String assetId, String from, BigInteger amount) {
        BigInteger balance = balanceOf(assetId, from);
        if (balance.compareTo(amount) < 0) {
            throw new StakeException(StakeErrorCode.TRANSFER_FAILED,
                    "insufficient " + assetId + " balance: has " + balance + ", needs " + amount);
        }
        accountsOf(assetId).put(from, balance.subtract(amount));
        stakeVault.merge(assetId, amount, CheckedMath::add);
    }

    @Override
    public synchronized byte[] push(String assetId, String to, BigInteger amount) {
        BigInteger vault = stakeVault.getOrDefault(assetId, BigInteger.ZERO);
        if (vault.compareTo(amount) < 0) {
            throw new StakeException(StakeErrorCode.TRANSFER_FAILED, "staking vault holds less " + assetId + " than " + amount);
        }
        stakeVault.put(assetId, vault.subtract(amount));
        credit(assetId, to, amount);
        return Pool.NATIVE_ASSET.equals(assetId) ? EMPTY : TransferResults.abiTrue();
    }

    /* ----------- RewardAssetTransfer ----------- */

    @Override
    public synchronized BigInteger rewardBalance(String rewardAssetId) {
        return rewardVault.getOrDefault(rewardAssetId, BigInteger.ZERO);
    }

    @Override
    public synchronized void rewardTransfer(String rewardAssetId, String to, BigInteger amount) {
        BigInteger vault = rewardBalance(rewardAssetId);
        if (vault.compareTo(amount) < 0) {
            throw new StakeException(StakeErrorCode.TRANSFER_FAILED, "reward vault holds less " + rewardAssetId + " than " + amount);
        }
        rewardVault.put(rewardAssetId, vault.subtract(amount));
        credit(rewardAssetId, to, amount);
    }

    /* ----------- 管理与查询 ----------- */

    /**
     * 向奖励金库注入当前奖励资产。
     */
    public BigInteger fundRewards(String caller, BigInteger amount) {
        requireFunder(caller);
        CheckedMath.requireUint256(amount, "amount");
        String rewardAsset = ledger.schedule().getRewardAssetId();
        BigInteger balance = creditRewardVault(rewardAsset, amount);
        log.info("Reward vault funded by {}: asset={}, amount={}, balance={}", caller, rewardAsset, amount, balance);
        return balance;
    }

    /**
     * 给账户记入资产（本地联调用，相当于外部入金）。
     */
    public BigInteger creditAccount(String caller, String assetId, String principal, BigInteger amount) {
        requireFunder(caller);
        if (!StringUtils.hasText(assetId) || !StringUtils.hasText(principal)) {
            throw StakeException.invalidParameter("asset and principal must not be blank");
        }
        CheckedMath.requireUint256(amount, "amount");
        BigInteger balance = credit(assetId, principal, amount);
        log.info("Account credited by {}: asset={}, principal={}, amount={}", caller, assetId, principal, amount);
        return balance;
    }

    public synchronized BigInteger balanceOf(String assetId, String principal) {
        return accountsOf(assetId).getOrDefault(principal, BigInteger.ZERO);
    }

    public synchronized BigInteger stakeVaultBalance(String assetId) {
        return stakeVault.getOrDefault(assetId, BigInteger.ZERO);
    }

    private synchronized BigInteger credit(String assetId, String principal, BigInteger amount) {
        return accountsOf(assetId).merge(principal, amount, CheckedMath::add);
    }

    private synchronized BigInteger creditRewardVault(String assetId, BigInteger amount) {
        return rewardVault.merge(assetId, amount, CheckedMath::add);
    }

    private Map<String, BigInteger> accountsOf(String assetId) {
        return accounts.computeIfAbsent(assetId, a -> new HashMap<>());
    }

    private void requireFunder(String caller) {
        if (!authorizer.isAuthorized(caller, StakeAction.FUND)) {
            log.warn("Unauthorized custody call: caller={}", caller);
            throw new StakeException(StakeErrorCode.UNAUTHORIZED, "caller is not authorized for " + StakeAction.FUND);
        }
    }
}
