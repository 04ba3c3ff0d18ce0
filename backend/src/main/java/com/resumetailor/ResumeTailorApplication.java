package com.resumetailor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ResumeTailor - tailors resume wording to a job description.
 */
@SpringBootApplication
@EnableScheduling
public class ResumeTailorApplication {

	public static void main(String[] args) {
		SpringApplication.run(ResumeTailorApplication.class, args);
	}

}
