package com.slb.stake_backend.modules.stake.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

/**
 * 存入 / 解押请求体。
 */
@Data
@Schema(description = "质押数量请求体 / Staking amount request body")
public class StakeAmountDto {

    @NotNull(message = "amount 不能为空")
    @DecimalMin(value = "0", message = "amount 不能为负数")
    @Schema(description = "数量（资产最小单位，建议以字符串传递）/ Amount in base units, preferably sent as a string",
            example = "1000000000000000000")
    private BigInteger amount;
}
