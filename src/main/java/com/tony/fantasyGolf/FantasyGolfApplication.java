package com.tony.fantasyGolf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FantasyGolfApplication {

	public static void main(String[] args) {
		SpringApplication.run(FantasyGolfApplication.class, args);
	}

}
