package com.slb.stake_backend.modules.custody.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

@Data
@Schema(description = "账户入金 / Credit an account")
public class CreditAccountDto {

    @NotBlank(message = "assetId 不能为空")
    @Schema(description = "资产 / Asset id", example = "NATIVE")
    private String assetId;

    @NotBlank(message = "principal 不能为空")
    @Schema(description = "账户 / Principal", example = "alice")
    private String principal;

    @NotNull(message = "amount 不能为空")
    @DecimalMin(value = "1", message = "amount 必须大于 0")
    private BigInteger amount;
}
