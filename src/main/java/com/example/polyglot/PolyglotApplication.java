package com.example.polyglot;

import com.example.polyglot.config.PolyglotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PolyglotProperties.class)
public class PolyglotApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(PolyglotApplication.class, args)));
	}

}
