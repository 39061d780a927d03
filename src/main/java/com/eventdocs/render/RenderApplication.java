package com.eventdocs.render;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RenderApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC so parsed export timestamps keep their offsets stable in logs
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(RenderApplication.class, args);
	}

}
