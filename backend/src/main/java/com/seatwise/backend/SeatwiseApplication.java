package com.seatwise.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeatwiseApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC for consistent logs and snapshot timestamps
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(SeatwiseApplication.class, args);
	}

}
