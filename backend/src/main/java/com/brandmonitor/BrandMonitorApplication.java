package com.brandmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * BrandMonitor - keyword-driven brand reputation monitoring service.
 */
@SpringBootApplication
public class BrandMonitorApplication {

	public static void main(String[] args) {
		SpringApplication.run(BrandMonitorApplication.class, args);
	}

}
