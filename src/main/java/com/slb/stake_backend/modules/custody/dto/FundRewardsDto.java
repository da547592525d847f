package com.slb.stake_backend.modules.custody.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "奖励金库注资 / Fund the reward vault")
public class FundRewardsDto {

    @NotNull(message = "amount 不能为空")
    @DecimalMin(value = "1", message = "amount 必须大于 0")
    @Schema(description = "注资数量（奖励资产最小单位）/ Amount in reward asset base units", example = "1000000000000000000000")
    private BigInteger amount;
}
