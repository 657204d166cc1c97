package com.example.crazyeights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class CrazyEightsApplication {

	public static void main(String[] args) {
		SpringApplication.run(CrazyEightsApplication.class, args);
	}

}
