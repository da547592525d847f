package com.slb.stake_backend.modules.stake.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawAmountVo {

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "解押队列总量 / Total requested")
    private BigInteger requestAmount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Schema(description = "已到期可提取总量 / Total matured")
    private BigInteger pendingWithdrawAmount;
}
