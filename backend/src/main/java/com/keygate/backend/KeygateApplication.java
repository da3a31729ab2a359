package com.keygate.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KeygateApplication {

	public static void main(String[] args) {
		// Session expiry columns and token timestamps are all compared in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(KeygateApplication.class, args);
	}

}
