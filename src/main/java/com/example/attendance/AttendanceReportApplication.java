package com.example.attendance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point for the attendance report service.
 * Only wires the application context; the HTTP endpoints live under the interfaces layer.
 */
@SpringBootApplication
public class AttendanceReportApplication {

	public static void main(String[] args) {
		SpringApplication.run(AttendanceReportApplication.class, args);
	}

}
