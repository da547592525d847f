package com.slb.stake_backend.modules.stake.controller;

import com.slb.stake_backend.common.api.ApiResponse;
import com.slb.stake_backend.common.security.StakePrincipal;
import com.slb.stake_backend.common.vo.PageVo;
import com.slb.stake_backend.modules.event.service.StakeEventService;
import com.slb.stake_backend.modules.event.vo.StakeEventVo;
import com.slb.stake_backend.modules.stake.dto.AddPoolDto;
import com.slb.stake_backend.modules.stake.dto.PoolWeightDto;
import com.slb.stake_backend.modules.stake.dto.UpdatePoolDto;
import com.slb.stake_backend.modules.stake.service.StakingAdminService;
import com.slb.stake_backend.modules.stake.service.StakingService;
import com.slb.stake_backend.modules.stake.vo.EmissionVo;
import com.slb.stake_backend.modules.stake.vo.PoolSettlementVo;
import com.slb.stake_backend.modules.stake.vo.PoolVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * 管理员接口。权限由 {@code app.staking.roles} 配置，在服务层逐个动作校验。
 */
@RestController
@RequestMapping("/api/v1/admin/stake")
@Tag(name = "管理员/质押", description = "池子管理、排放参数、暂停开关与结算")
public class AdminStakingController {

    private final StakingAdminService stakingAdminService;
    private final StakingService stakingService;
    private final StakeEventService stakeEventService;

    public AdminStakingController(StakingAdminService stakingAdminService,
                                  StakingService stakingService,
                                  StakeEventService stakeEventService) {
        this.stakingAdminService = stakingAdminService;
        this.stakingService = stakingService;
        this.stakeEventService = stakeEventService;
    }

    /* ----------- 池子 ----------- */

    @PostMapping("/pools")
    @Operation(summary = "新增池子 / Add a pool")
    public ApiResponse<PoolVo> addPool(@Valid @RequestBody AddPoolDto dto,
                                       @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingAdminService.addPool(principal.getName(), dto.getStakeAssetId(), dto.getWeight(),
                dto.getMinDeposit(), dto.getUnstakeLockBlocks(), dto.isWithSettle()));
    }

    @PutMapping("/pools/{poolId}")
    @Operation(summary = "修改最小存入量与解押锁定块数 / Update pool parameters")
    public ApiResponse<PoolVo> updatePool(@PathVariable int poolId,
                                          @Valid @RequestBody UpdatePoolDto dto,
                                          @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingAdminService.updatePool(principal.getName(), poolId,
                dto.getMinDeposit(), dto.getUnstakeLockBlocks()));
    }

    @PutMapping("/pools/{poolId}/weight")
    @Operation(summary = "修改池子权重 / Set pool weight")
    public ApiResponse<PoolVo> setPoolWeight(@PathVariable int poolId,
                                             @Valid @RequestBody PoolWeightDto dto,
                                             @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingAdminService.setPoolWeight(principal.getName(), poolId,
                dto.getWeight(), dto.isWithSettle()));
    }

    @PostMapping("/pools/{poolId}/settle")
    @Operation(summary = "结算单个池子 / Settle one pool", description = "已结算到当前高度时 data 为空")
    public ApiResponse<PoolSettlementVo> settlePool(@PathVariable int poolId,
                                                    @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingAdminService.settlePool(principal.getName(), poolId).orElse(null));
    }

    @PostMapping("/pools/settle")
    @Operation(summary = "结算所有池子 / Settle all pools")
    public ApiResponse<List<PoolSettlementVo>> settleAllPools(@AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(stakingAdminService.settleAllPools(principal.getName()));
    }

    /* ----------- 排放参数 ----------- */

    @PutMapping("/emission/reward-asset")
    @Operation(summary = "设置奖励资产 / Set the reward asset")
    public ApiResponse<EmissionVo> setRewardAsset(@Parameter(description = "奖励资产 ID", required = true)
                                                  @RequestParam String value,
                                                  @AuthenticationPrincipal StakePrincipal principal) {
        stakingAdminService.setRewardAsset(principal.getName(), value);
        return ApiResponse.ok(stakingService.emission());
    }

    @PutMapping("/emission/start-height")
    @Operation(summary = "设置起始高度 / Set the start height", description = "必须不大于结束高度；不会结算池子")
    public ApiResponse<EmissionVo> setStartHeight(@RequestParam long value,
                                                  @AuthenticationPrincipal StakePrincipal principal) {
        stakingAdminService.setStartHeight(principal.getName(), value);
        return ApiResponse.ok(stakingService.emission());
    }

    @PutMapping("/emission/end-height")
    @Operation(summary = "设置结束高度 / Set the end height", description = "必须不小于起始高度；不会结算池子")
    public ApiResponse<EmissionVo> setEndHeight(@RequestParam long value,
                                                @AuthenticationPrincipal StakePrincipal principal) {
        stakingAdminService.setEndHeight(principal.getName(), value);
        return ApiResponse.ok(stakingService.emission());
    }

    @PutMapping("/emission/rate")
    @Operation(summary = "设置每块奖励 / Set reward per block", description = "必须大于 0；不会结算池子")
    public ApiResponse<EmissionVo> setEmissionRate(@RequestParam BigInteger value,
                                                   @AuthenticationPrincipal StakePrincipal principal) {
        stakingAdminService.setEmissionRate(principal.getName(), value);
        return ApiResponse.ok(stakingService.emission());
    }

    /* ----------- 暂停开关 ----------- */

    @PostMapping("/withdraw/pause")
    @Operation(summary = "暂停解押与提取 / Pause unstake and withdraw")
    public ApiResponse<Void> pauseWithdraw(@AuthenticationPrincipal StakePrincipal principal) {
        stakingAdminService.pauseWithdraw(principal.getName());
        return ApiResponse.ok();
    }

    @PostMapping("/withdraw/unpause")
    @Operation(summary = "恢复解押与提取 / Unpause unstake and withdraw")
    public ApiResponse<Void> unpauseWithdraw(@AuthenticationPrincipal StakePrincipal principal) {
        stakingAdminService.unpauseWithdraw(principal.getName());
        return ApiResponse.ok();
    }

    @PostMapping("/claim/pause")
    @Operation(summary = "暂停领取 / Pause claims")
    public ApiResponse<Void> pauseClaim(@AuthenticationPrincipal StakePrincipal principal) {
        stakingAdminService.pauseClaim(principal.getName());
        return ApiResponse.ok();
    }

    @PostMapping("/claim/unpause")
    @Operation(summary = "恢复领取 / Unpause claims")
    public ApiResponse<Void> unpauseClaim(@AuthenticationPrincipal StakePrincipal principal) {
        stakingAdminService.unpauseClaim(principal.getName());
        return ApiResponse.ok();
    }

    /* ----------- 事件 ----------- */

    @GetMapping("/events")
    @Operation(summary = "事件流水 / Staking events")
    public ApiResponse<PageVo<StakeEventVo>> events(@RequestParam(required = false) Integer poolId,
                                                    @RequestParam(required = false) String principal,
                                                    @RequestParam(required = false) String eventType,
                                                    @RequestParam(defaultValue = "1") int page,
                                                    @RequestParam(defaultValue = "20") int size,
                                                    @AuthenticationPrincipal StakePrincipal caller) {
        stakingAdminService.requireEventAccess(caller.getName());
        return ApiResponse.ok(stakeEventService.listEvents(poolId, principal, eventType, page, size));
    }
}
