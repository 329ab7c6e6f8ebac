package com.tony.gridironStats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GridironStatsApplication {

	public static void main(String[] args) {
		SpringApplication.run(GridironStatsApplication.class, args);
	}

}
