package com.portico.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PorticoApplication {

	public static void main(String[] args) {
		// Sessions and token expiries are compared in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(PorticoApplication.class, args);
	}

}
