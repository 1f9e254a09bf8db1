package com.susanoo.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SusanooBackendApplication {

	public static void main(String[] args) {
		// Session expiry and audit timestamps are compared in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(SusanooBackendApplication.class, args);
	}

}
