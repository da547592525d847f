package com.slb.stake_backend.modules.stake.vo;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MultiplierVo {
    private Long from;
    private Long to;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigInteger multiplier;
}
