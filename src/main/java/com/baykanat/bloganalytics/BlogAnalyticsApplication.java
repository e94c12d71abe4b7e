package com.baykanat.bloganalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Uygulama giriş noktası; @EnableScheduling ile periyodik rollup aggregation. */
@SpringBootApplication
@EnableScheduling
public class BlogAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(BlogAnalyticsApplication.class, args);
	}

}
