package com.slb.stake_backend.modules.custody.controller;

import com.slb.stake_backend.common.api.ApiResponse;
import com.slb.stake_backend.common.security.StakePrincipal;
import com.slb.stake_backend.modules.custody.dto.CreditAccountDto;
import com.slb.stake_backend.modules.custody.dto.FundRewardsDto;
import com.slb.stake_backend.modules.custody.service.InMemoryCustodyService;
import com.slb.stake_backend.modules.custody.vo.BalanceVo;
import com.slb.stake_backend.modules.stake.engine.StakeLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "托管", description = "进程内资产托管：余额查询与管理员注资 / In-process custody")
public class CustodyController {

    private final InMemoryCustodyService custodyService;
    private final StakeLedger ledger;

    public CustodyController(InMemoryCustodyService custodyService, StakeLedger ledger) {
        this.custodyService = custodyService;
        this.ledger = ledger;
    }

    @GetMapping("/custody/balance")
    @Operation(summary = "查询本人资产余额 / Caller's balance of an asset")
    public ApiResponse<BalanceVo> balance(
            @Parameter(description = "资产", example = "NATIVE")
            @RequestParam String assetId,
            @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(new BalanceVo(assetId, principal.getName(), custodyService.balanceOf(assetId, principal.getName())));
    }

    @GetMapping("/custody/vault")
    @Operation(summary = "查询质押金库余额 / Staking vault balance of an asset")
    public ApiResponse<BalanceVo> stakeVault(@RequestParam String assetId) {
        return ApiResponse.ok(new BalanceVo(assetId, null, custodyService.stakeVaultBalance(assetId)));
    }

    @GetMapping("/custody/reward-vault")
    @Operation(summary = "查询奖励金库余额 / Reward vault balance")
    public ApiResponse<BalanceVo> rewardVault() {
        String rewardAsset = ledger.schedule().getRewardAssetId();
        return ApiResponse.ok(new BalanceVo(rewardAsset, null, custodyService.rewardBalance(rewardAsset)));
    }

    @PostMapping("/admin/custody/fund-rewards")
    @Operation(summary = "向奖励金库注资（管理员）/ Fund the reward vault")
    public ApiResponse<BalanceVo> fundRewards(@Valid @RequestBody FundRewardsDto dto,
                                              @AuthenticationPrincipal StakePrincipal principal) {
        String rewardAsset = ledger.schedule().getRewardAssetId();
        return ApiResponse.ok(new BalanceVo(rewardAsset, null, custodyService.fundRewards(principal.getName(), dto.getAmount())));
    }

    @PostMapping("/admin/custody/credit")
    @Operation(summary = "账户入金（管理员）/ Credit an account")
    public ApiResponse<BalanceVo> credit(@Valid @RequestBody CreditAccountDto dto,
                                         @AuthenticationPrincipal StakePrincipal principal) {
        return ApiResponse.ok(new BalanceVo(dto.getAssetId(), dto.getPrincipal(),
                custodyService.creditAccount(principal.getName(), dto.getAssetId(), dto.getPrincipal(), dto.getAmount())));
    }
}
