package com.slb.stake_backend.modules.stake.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "修改池子参数 / Update pool parameters")
public class UpdatePoolDto {

    @NotNull(message = "minDeposit 不能为空")
    @DecimalMin(value = "0", message = "minDeposit 不能为负数")
    private BigInteger minDeposit;

    @NotNull(message = "unstakeLockBlocks 不能为空")
    @Min(value = 1, message = "unstakeLockBlocks 必须大于 0")
    @Schema(description = "新的解押锁定块数，仅影响之后的解押请求 / Applies to later unstake requests only", example = "20")
    private Long unstakeLockBlocks;
}
