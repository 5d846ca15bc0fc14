package com.classengage.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClassEngageApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC so stored timestamps and logs agree
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(ClassEngageApplication.class, args);
	}

}
