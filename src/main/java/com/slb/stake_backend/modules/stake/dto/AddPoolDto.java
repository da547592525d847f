package com.slb.stake_backend.modules.stake.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "新增池子 / Add a pool")
public class AddPoolDto {

    @NotBlank(message = "stakeAssetId 不能为空")
    @Schema(description = "质押资产：第一个池子必须为 NATIVE，其余为代币 / Staking asset: NATIVE for pool 0, a token otherwise",
            example = "NATIVE")
    private String stakeAssetId;

    @NotNull(message = "weight 不能为空")
    @DecimalMin(value = "1", message = "weight 必须大于 0")
    @Schema(description = "池子权重 / Pool weight", example = "500")
    private BigInteger weight;

    @NotNull(message = "minDeposit 不能为空")
    @DecimalMin(value = "0", message = "minDeposit 不能为负数")
    @Schema(description = "最小存入量 / Minimum deposit", example = "100")
    private BigInteger minDeposit;

    @NotNull(message = "unstakeLockBlocks 不能为空")
    @Min(value = 1, message = "unstakeLockBlocks 必须大于 0")
    @Schema(description = "解押锁定块数 / Unstake lock blocks", example = "20")
    private Long unstakeLockBlocks;

    @Schema(description = "新增前是否先结算所有池子 / Settle all pools first", example = "true")
    private boolean withSettle = true;
}
