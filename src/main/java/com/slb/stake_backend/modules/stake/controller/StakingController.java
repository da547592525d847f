package com.slb.stake_backend.modules.stake.controller;

import com.slb.stake_backend.common.api.ApiResponse;
import com.slb.stake_backend.common.security.StakePrincipal;
import com.slb.stake_backend.common.vo.PageVo;
import com.slb.stake_backend.modules.event.service.StakeEventService;
import com.slb.stake_backend.modules.event.vo.StakeEventVo;
import com.slb.stake_backend.modules.stake.dto.StakeAmountDto;
import com.slb.stake_backend.modules.stake.service.StakingService;
import com.slb.stake_backend.modules.stake.vo.ClaimVo;
import com.slb.stake_backend.modules.stake.vo.DepositVo;
import com.slb.stake_backend.modules.stake.vo.EmissionVo;
import com.slb.stake_backend.modules.stake.vo.MultiplierVo;
import com.slb.stake_backend.modules.stake.vo.PoolVo;
import com.slb.stake_backend.modules.stake.vo.StakePositionVo;
import com.slb.stake_backend.modules.stake.vo.UnstakeVo;
import com.slb.stake_backend.modules.stake.vo.WithdrawAmountVo;
import com.slb.stake_backend.modules.stake.vo.WithdrawVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

@RestController
@RequestMapping("/api/v1/stake")
@Tag(name = "质押", description = "存入、解押、提取、领取奖励与查询 / Deposit, unstake, withdraw, claim and queries")
public class StakingController {

    private final StakingService stakingService;
    private final StakeEventService stakeEventService;

    public StakingController(StakingService stakingService, StakeEventService stakeEventService) {
        this.stakingService = stakingService;
        this.stakeEventService = stakeEventService;
    }

    /* ----------- 公开查询 ----------- */

    @GetMapping("/pools")
    @Operation(summary = "池子列表 / List pools")
    public ApiResponse<List<PoolVo>> pools() {
        return ApiResponse.ok(stakingService.listPools());
    }

    @GetMapping("/pools/{poolId}")
    @Operation(summary = "池子详情 / Pool detail", description = "poolId 不存在时返回 404 STAKE_INVALID_POOL_ID")
    public ApiResponse<PoolVo> pool(@PathVariable int poolId) {
        return ApiResponse.ok(stakingService.getPool(poolId));
    }

    @GetMapping("/emission")
    @Operation(summary = "排放参数与全局状态 / Emission config and pause flags")
    public ApiResponse<EmissionVo> emission() {
        return ApiResponse.ok(stakingService.emission());
    }

    @GetMapping("/multiplier")
    @Operation(summary = "区间奖励总量 / Reward emitted over [from, to)",
            description = "区间按 [startHeight, endHeight) 截断；from > to 返回 400")
    public ApiResponse<MultiplierVo> multiplier(@RequestParam long from, @RequestParam long to) {
        return ApiResponse.ok(stakingService.multiplier(from, to));
    }

    /* ----------- 用户操作 ----------- */

    @PostMapping("/native/deposit")
    @Operation(summary = "存入原生资产（0 号池）/ Deposit the native asset into pool 0")
    public ApiResponse<DepositVo> depositNative(@Valid @RequestBody StakeAmountDto dto,
                                                @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingService.depositNative(principal.getName(), dto.getAmount()));
    }

    @PostMapping("/pools/{poolId}/deposit")
    @Operation(summary = "存入代币 / Deposit a token", description = "poolId 为 0 时返回 400，请使用原生资产存入接口")
    public ApiResponse<DepositVo> deposit(@PathVariable int poolId,
                                          @Valid @RequestBody StakeAmountDto dto,
                                          @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingService.deposit(principal.getName(), poolId, dto.getAmount()));
    }

    @PostMapping("/pools/{poolId}/unstake")
    @Operation(summary = "申请解押 / Request an unstake",
            description = "数量立即移出质押，height + unstakeLockBlocks 之后可提取；提取暂停时返回 423")
    public ApiResponse<UnstakeVo> unstake(@PathVariable int poolId,
                                          @Valid @RequestBody StakeAmountDto dto,
                                          @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingService.unstake(principal.getName(), poolId, dto.getAmount()));
    }

    @PostMapping("/pools/{poolId}/withdraw")
    @Operation(summary = "提取已到期解押 / Withdraw matured unstake requests")
    public ApiResponse<WithdrawVo> withdraw(@PathVariable int poolId,
                                            @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingService.withdraw(principal.getName(), poolId));
    }

    @PostMapping("/pools/{poolId}/claim")
    @Operation(summary = "领取奖励 / Claim rewards")
    public ApiResponse<ClaimVo> claim(@PathVariable int poolId,
                                      @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingService.claim(principal.getName(), poolId));
    }

    /* ----------- 本人查询 ----------- */

    @GetMapping("/pools/{poolId}/position")
    @Operation(summary = "本人仓位 / Caller's position")
    public ApiResponse<StakePositionVo> position(@PathVariable int poolId,
                                                 @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingService.position(poolId, principal.getName()));
    }

    @GetMapping("/pools/{poolId}/balance")
    @Operation(summary = "质押余额 / Staking balance")
    public ApiResponse<String> stakingBalance(@PathVariable int poolId,
                                              @Parameter(description = "查询的账户，默认本人 / Principal, defaults to the caller")
                                              @RequestParam(required = false) String account,
                                              @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingService.stakingBalance(poolId, resolve(account, principal)).toString());
    }

    @GetMapping("/pools/{poolId}/pending-reward")
    @Operation(summary = "可领取奖励 / Pending reward",
            description = "不传 height 时按当前高度计算；只读推算，不修改账本")
    public ApiResponse<String> pendingReward(@PathVariable int poolId,
                                             @RequestParam(required = false) String account,
                                             @Parameter(description = "推算高度 / Height to project at")
                                             @RequestParam(required = false) Long height,
                                             @AuthenticationPrincipal StakePrincipal principal) {
        String who = resolve(account, principal);
        BigInteger pending = height == null
                ? stakingService.pendingReward(poolId, who)
                : stakingService.pendingRewardAt(poolId, who, height);
        return ApiResponse.ok(pending.toString());
    }

    @GetMapping("/pools/{poolId}/withdraw-amount")
    @Operation(summary = "解押队列汇总 / Requested and matured amounts")
    public ApiResponse<WithdrawAmountVo> withdrawAmount(@PathVariable int poolId,
                                                        @RequestParam(required = false) String account,
                                                        @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingService.withdrawAmount(poolId, resolve(account, principal)));
    }

    @GetMapping("/events")
    @Operation(summary = "本人事件流水 / Caller's staking events")
    public ApiResponse<PageVo<StakeEventVo>> events(@RequestParam(required = false) Integer poolId,
                                                    @RequestParam(required = false) String eventType,
                                                    @RequestParam(defaultValue = "1") int page,
                                                    @RequestParam(defaultValue = "20") int size,
                                                    @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakeEventService.listEvents(poolId, principal.getName(), eventType, page, size));
    }

    private static String resolve(String account, StakePrincipal principal) {
        return account != null && !account.isBlank() ? account.trim() : principal.getName();
    }
}
