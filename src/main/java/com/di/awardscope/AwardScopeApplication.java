package com.di.awardscope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AwardScopeApplication {

	public static void main(String[] args) {
		SpringApplication.run(AwardScopeApplication.class, args);
	}
}
