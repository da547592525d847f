package com.slb.stake_backend.modules.stake.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "修改池子权重 / Set pool weight")
public class PoolWeightDto {

    @NotNull(message = "weight 不能为空")
    @DecimalMin(value = "1", message = "weight 必须大于 0")
    private BigInteger weight;

    @Schema(description = "修改前是否先结算所有池子 / Settle all pools first", example = "true")
    private boolean withSettle = true;
}
