package com.yerin.flowq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FlowqApplication {

	public static void main(String[] args) {
		SpringApplication.run(FlowqApplication.class, args);
	}

}
