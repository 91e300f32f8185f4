package com.leadfunnel.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeadFunnelApplication {

	public static void main(String[] args) {
		SpringApplication.run(LeadFunnelApplication.class, args);
	}
}
