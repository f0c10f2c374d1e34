package com.argforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ArgForge - synthetic logical argument generation.
 */
@SpringBootApplication
public class ArgForgeApplication {

	public static void main(String[] args) {
		SpringApplication.run(ArgForgeApplication.class, args);
	}

}
