package com.stakeledger.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StakeLedgerApplication {
	public static void main(String[] args) {
		SpringApplication.run(StakeLedgerApplication.class, args);
	}
}
