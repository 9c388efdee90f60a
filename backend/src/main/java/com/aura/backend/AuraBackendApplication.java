package com.aura.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuraBackendApplication {
	public static void main(String[] args) {
		SpringApplication.run(AuraBackendApplication.class, args);
	}
}
