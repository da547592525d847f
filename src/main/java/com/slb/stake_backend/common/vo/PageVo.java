package com.slb.stake_backend.common.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "分页结果 / Paged result")
public class PageVo<T> {
    private Long total;
    private Integer page;
    private Integer size;
    private List<T> list;
}
