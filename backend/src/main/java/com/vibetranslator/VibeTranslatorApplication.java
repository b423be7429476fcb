package com.vibetranslator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Social Vibe Translator - rewrites a message into five tone variants and ranks them.
 */
@SpringBootApplication
public class VibeTranslatorApplication {

	public static void main(String[] args) {
		SpringApplication.run(VibeTranslatorApplication.class, args);
	}

}
