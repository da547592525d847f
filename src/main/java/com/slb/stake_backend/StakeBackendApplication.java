package com.slb.stake_backend;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.slb.stake_backend")
@MapperScan("com.slb.stake_backend.modules.*.mapper")
@ConfigurationPropertiesScan("com.slb.stake_backend")
public class StakeBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(StakeBackendApplication.class, args);
	}

}
