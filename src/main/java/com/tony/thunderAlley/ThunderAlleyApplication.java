package com.tony.thunderAlley;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThunderAlleyApplication {

	public static void main(String[] args) {
		SpringApplication.run(ThunderAlleyApplication.class, args);
	}

}
