package com.studioflow.finance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@org.springframework.scheduling.annotation.EnableScheduling
public class StudioFlowFinanceApplication {

	public static void main(String[] args) {
		SpringApplication.run(StudioFlowFinanceApplication.class, args);
	}

}
