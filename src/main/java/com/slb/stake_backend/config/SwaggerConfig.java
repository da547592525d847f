package com.slb.stake_backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    private static final String SECURITY_SCHEME_NAME = "BearerAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("多池质押账本 API / Multi-pool Staking Ledger API")
                        .version("1.0.0")
                        .description(
                                """
                                用户可将质押资产存入多个池子（0 号池为原生资产，其余为代币），按池子权重分享
                                [startHeight, endHeight) 区间内的每块固定奖励。
                                Users lock a staking asset into weighted pools and share a constant per-block reward
                                emitted over the [startHeight, endHeight) window.

                                约定 / Conventions:
                                - 所有金额均为无符号 256 位整数，以十进制字符串传输，避免精度丢失。
                                  All amounts are unsigned 256-bit integers carried as decimal strings.
                                - 统一返回 ApiResponse<T>：code=0 表示成功，失败时 code 与 HTTP 状态一致，
                                  error.code 为稳定机器码（如 STAKE_PAUSED、STAKE_INSUFFICIENT_BALANCE）。
                                  Every response uses the ApiResponse<T> envelope; on failure error.code carries a
                                  stable machine code.
                                - 区块高度由服务端时钟给出；解押请求在 height + unstakeLockBlocks 后可提取。
                                  Heights come from the server clock; unstaked amounts become withdrawable at
                                  height + unstakeLockBlocks.
                                """
                        )
                )
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("JWT 访问令牌，subject 为质押账户 / JWT access token whose subject is the staking principal")
                        )
                );
    }
}
