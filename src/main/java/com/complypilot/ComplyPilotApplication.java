package com.complypilot;

import com.complypilot.config.ComplyPilotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ComplyPilotProperties.class)
public class ComplyPilotApplication {

	public static void main(String[] args) {
		SpringApplication.run(ComplyPilotApplication.class, args);
	}

}
