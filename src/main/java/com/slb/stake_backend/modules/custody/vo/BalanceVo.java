package com.slb.stake_backend.modules.custody.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "资产余额 / Asset balance")
public class BalanceVo {

    @Schema(description = "资产 / Asset id", example = "NATIVE")
    private String assetId;

    @Schema(description = "账户，金库余额时为空 / Principal, null for vault balances", nullable = true)
    private String principal;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigInteger balance;
}
