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
@Schema(description = "解押请求 / Unstake request")
public class UnstakeRequestVo {

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigInteger amount;

    @Schema(description = "可提取高度 / Height from which the amount can be withdrawn", example = "170")
    private Long maturityHeight;

    @Schema(description = "当前高度下是否已到期 / Whether matured at the current height")
    private Boolean matured;
}
