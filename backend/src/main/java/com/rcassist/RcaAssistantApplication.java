package com.rcassist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * RCA Assistant - evidence-driven root cause analysis service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RcaAssistantApplication {

	public static void main(String[] args) {
		SpringApplication.run(RcaAssistantApplication.class, args);
	}

}
