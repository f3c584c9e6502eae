package com.yerin.submitflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SubmitflowApplication {

	public static void main(String[] args) {
		SpringApplication.run(SubmitflowApplication.class, args);
	}

}
